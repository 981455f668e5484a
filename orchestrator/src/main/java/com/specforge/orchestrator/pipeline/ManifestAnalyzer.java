package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.specforge.orchestrator.claude.CompletionClient;
import com.specforge.orchestrator.config.PipelineProperties;
import com.specforge.orchestrator.model.FileCategory;
import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.ManifestEntry;
import com.specforge.orchestrator.model.TargetConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a specification into a Manifest with one completion call.
 *
 * Parsing happens in two passes: the reply as a whole (or its fenced
 * block), then the largest balanced JSON fragment in it. If neither
 * yields a JSON object the session cannot continue.
 */
@Component
public class ManifestAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ManifestAnalyzer.class);

    private final CompletionClient        completion;
    private final PromptTemplates         prompts;
    private final PipelineProperties.Call limits;

    public ManifestAnalyzer(CompletionClient completion,
                            PromptTemplates prompts,
                            PipelineProperties properties) {
        this.completion = completion;
        this.prompts    = prompts;
        this.limits     = properties.manifest();
    }

    /**
     * @throws PipelineException COMPLETION_FAILED if the completion call fails,
     *                           MANIFEST_UNPARSEABLE if the reply holds no JSON object,
     *                           EMPTY_MANIFEST if it lists no files at all
     */
    public Manifest analyze(JsonNode specification, TargetConfig target) {
        String raw;
        try {
            raw = completion.complete(prompts.manifest(specification, target),
                    limits.maxTokens(), limits.temperature());
        } catch (RuntimeException e) {
            throw new PipelineException(PipelineException.Kind.COMPLETION_FAILED,
                    "Manifest completion failed: " + e.getMessage(), e);
        }

        JsonNode root = ResponseParser.parseJsonLeniently(raw)
                .filter(JsonNode::isObject)
                .orElseThrow(() -> new PipelineException(PipelineException.Kind.MANIFEST_UNPARSEABLE,
                        "Manifest parsing failed: completion reply is not a JSON object ("
                        + preview(raw) + ")"));

        List<ManifestEntry> entries = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (FileCategory category : FileCategory.values()) {
            for (JsonNode item : root.path(category.jsonKey())) {
                ManifestEntry entry = toEntry(item, category);
                if (entry == null) continue;
                if (!seen.add(entry.path())) {
                    log.warn("Duplicate manifest path '{}' in {} dropped", entry.path(), category);
                    continue;
                }
                entries.add(entry);
            }
        }

        if (entries.isEmpty()) {
            throw new PipelineException(PipelineException.Kind.EMPTY_MANIFEST,
                    "Manifest lists no files to generate");
        }

        Manifest manifest = new Manifest(entries,
                describeAll(firstPresent(root, "api_endpoints", "apiEndpoints")),
                describeAll(firstPresent(root, "data_models", "dataModels")));
        log.info("Manifest has {} files, {} endpoints, {} data models",
                manifest.size(), manifest.apiEndpoints().size(), manifest.dataModels().size());
        return manifest;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Null for entries without a usable path. A bare string is taken as the path. */
    private static ManifestEntry toEntry(JsonNode item, FileCategory category) {
        String path;
        String purpose = "";
        Set<String> deps = new LinkedHashSet<>();

        if (item.isTextual()) {
            path = item.asText();
        } else if (item.isObject()) {
            path    = item.path("path").asText("");
            purpose = item.path("purpose").asText(item.path("description").asText(""));
            for (JsonNode d : firstPresent(item, "dependencies", "declared_dependencies")) {
                if (d.isTextual() && !d.asText().isBlank()) deps.add(d.asText().strip());
            }
        } else {
            return null;
        }

        path = normalizePath(path);
        return path.isEmpty() ? null : new ManifestEntry(path, category, purpose.strip(), deps);
    }

    private static String normalizePath(String path) {
        String p = path.strip().replace('\\', '/');
        while (p.startsWith("./")) p = p.substring(2);
        while (p.startsWith("/"))  p = p.substring(1);
        return p;
    }

    private static JsonNode firstPresent(JsonNode node, String... names) {
        for (String name : names) {
            if (node.has(name)) return node.get(name);
        }
        return node.path(names[0]);
    }

    /** Endpoint and model lists may come back as strings or as small objects. */
    private static List<String> describeAll(JsonNode array) {
        List<String> out = new ArrayList<>();
        for (JsonNode n : array) {
            String s = n.isTextual() ? n.asText() : n.toString();
            if (!s.isBlank()) out.add(s.strip());
        }
        return out;
    }

    private static String preview(String raw) {
        if (raw == null) return "empty reply";
        String flat = raw.strip().replaceAll("\\s+", " ");
        return flat.length() <= 80 ? flat : flat.substring(0, 80) + "…";
    }
}
