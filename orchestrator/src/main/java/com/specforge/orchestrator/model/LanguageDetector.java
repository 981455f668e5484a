package com.specforge.orchestrator.model;

import java.util.Locale;
import java.util.Map;

/**
 * Maps a file path to a language name by its extension.
 * Unknown extensions map to "text".
 */
public final class LanguageDetector {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry("js",   "javascript"),
            Map.entry("jsx",  "jsx"),
            Map.entry("ts",   "typescript"),
            Map.entry("tsx",  "tsx"),
            Map.entry("py",   "python"),
            Map.entry("rb",   "ruby"),
            Map.entry("java", "java"),
            Map.entry("go",   "go"),
            Map.entry("php",  "php"),
            Map.entry("html", "html"),
            Map.entry("css",  "css"),
            Map.entry("scss", "scss"),
            Map.entry("less", "less"),
            Map.entry("json", "json"),
            Map.entry("md",   "markdown"),
            Map.entry("sql",  "sql"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml",  "yaml"),
            Map.entry("xml",  "xml"),
            Map.entry("sh",   "bash"),
            Map.entry("bash", "bash"),
            Map.entry("dockerfile", "dockerfile")
    );

    private LanguageDetector() {}

    public static String detect(String path) {
        if (path == null || path.isBlank()) return "text";
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        // "Dockerfile" has no extension; the whole name is the key.
        String ext = dot < 0 ? name : name.substring(dot + 1);
        return BY_EXTENSION.getOrDefault(ext, "text");
    }
}
