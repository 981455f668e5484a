package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.ManifestEntry;
import com.specforge.orchestrator.model.StaticAnalysisReport;
import com.specforge.orchestrator.model.TargetConfig;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prompts for the four completion calls the pipeline makes.
 *
 * Each prompt states the exact output shape expected back, because the
 * reply is parsed by {@link ResponseParser} rather than read by a human:
 *   - manifest  → one JSON object with per-category file lists
 *   - generate  → raw file content, no prose
 *   - analyze   → one JSON static-analysis report
 *   - fix       → raw corrected file content, no prose
 */
@Component
public class PromptTemplates {

    private final ObjectMapper json;

    public PromptTemplates(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public String manifest(JsonNode specification, TargetConfig target) {
        return MANIFEST_PROMPT
                .replace("{{TECH}}", target.describe())
                .replace("{{SPEC}}", pretty(specification));
    }

    public String generate(JsonNode specification, TargetConfig target, Manifest manifest,
                           ManifestEntry entry, String language) {
        return GENERATE_PROMPT
                .replace("{{PATH}}", entry.path())
                .replace("{{CATEGORY}}", entry.category().jsonKey())
                .replace("{{LANGUAGE}}", language)
                .replace("{{PURPOSE}}", entry.purpose())
                .replace("{{DEPENDENCIES}}", bulletList(List.copyOf(entry.declaredDependencies())))
                .replace("{{TECH}}", target.describe())
                .replace("{{API}}", bulletList(manifest.apiEndpoints()))
                .replace("{{MODELS}}", bulletList(manifest.dataModels()))
                .replace("{{SPEC}}", pretty(specification));
    }

    public String analyze(ManifestEntry entry, String language, String content) {
        return ANALYZE_PROMPT
                .replace("{{PATH}}", entry.path())
                .replace("{{LANGUAGE}}", language)
                .replace("{{PURPOSE}}", entry.purpose())
                .replace("{{CODE}}", content);
    }

    public String fix(ManifestEntry entry, String language, String content, List<StaticAnalysisReport.Issue> issues) {
        return FIX_PROMPT
                .replace("{{PATH}}", entry.path())
                .replace("{{LANGUAGE}}", language)
                .replace("{{PURPOSE}}", entry.purpose())
                .replace("{{ISSUES}}", pretty(issues))
                .replace("{{CODE}}", content);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String pretty(Object value) {
        try {
            return json.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as JSON", e);
        }
    }

    private static String bulletList(List<String> items) {
        if (items.isEmpty()) return "  (none)";
        StringBuilder sb = new StringBuilder();
        items.forEach(i -> sb.append("  - ").append(i).append('\n'));
        return sb.toString().stripTrailing();
    }

    // ------------------------------------------------------------------
    // Templates
    // ------------------------------------------------------------------

    private static final String MANIFEST_PROMPT = """
            You are a senior software architect planning the source tree of a new project.

            TECHNOLOGIES:
            {{TECH}}

            PROJECT SPECIFICATION (JSON):
            {{SPEC}}

            List every file needed to implement this specification with the chosen
            technologies. Respond with ONE JSON object and nothing else, using exactly
            this shape:

            {
              "frontend": [ {"path": "src/App.tsx", "purpose": "...", "dependencies": ["..."]} ],
              "backend":  [ {"path": "...", "purpose": "...", "dependencies": []} ],
              "config":   [ {"path": "...", "purpose": "...", "dependencies": []} ],
              "database": [ {"path": "...", "purpose": "...", "dependencies": []} ],
              "api_endpoints": [ "GET /api/items - list items", "..." ],
              "data_models":   [ "Item(id, name, createdAt)", "..." ]
            }

            Rules:
              - Paths are relative to the repository root and unique.
              - "dependencies" lists other paths or packages the file relies on.
              - Use an empty array for a category that needs no files.
            """;

    private static final String GENERATE_PROMPT = """
            You are an expert {{LANGUAGE}} developer writing one file of a larger project.

            FILE: {{PATH}}
            CATEGORY: {{CATEGORY}}
            PURPOSE: {{PURPOSE}}
            DEPENDS ON:
            {{DEPENDENCIES}}

            TECHNOLOGIES:
            {{TECH}}

            API ENDPOINTS IN THIS PROJECT:
            {{API}}

            DATA MODELS IN THIS PROJECT:
            {{MODELS}}

            PROJECT SPECIFICATION (JSON):
            {{SPEC}}

            Write the complete content of {{PATH}}. Output ONLY the file content:
            no explanations, no headings, no Markdown code fences.
            """;

    private static final String ANALYZE_PROMPT = """
            You are a static-analysis tool reviewing one generated {{LANGUAGE}} file.

            FILE: {{PATH}}
            PURPOSE: {{PURPOSE}}

            CODE:
            {{CODE}}

            Report bugs, security problems, missing error handling and clear style
            violations. Respond with ONE JSON object and nothing else:

            {
              "qualityScore": 0-100,
              "issues": [
                {"severity": "HIGH|MEDIUM|LOW", "location": "line or symbol",
                 "message": "what is wrong", "suggestion": "how to fix it"}
              ],
              "recommendations": [ "..." ]
            }

            Use an empty "issues" array if the file has no problems.
            """;

    private static final String FIX_PROMPT = """
            You are an expert {{LANGUAGE}} developer fixing one file.

            FILE: {{PATH}}
            PURPOSE: {{PURPOSE}}

            ISSUES FOUND BY STATIC ANALYSIS:
            {{ISSUES}}

            CURRENT CODE:
            {{CODE}}

            Rewrite the file so that every issue above is resolved without changing
            its purpose. Output ONLY the corrected file content: no explanations,
            no Markdown code fences.
            """;
}
