package com.specforge.orchestrator.model;

/**
 * Technology choices the generated project must use.
 * Any field may be null, in which case the model picks a sensible default.
 */
public record TargetConfig(String frontend, String backend, String database) {

    public static TargetConfig unspecified() {
        return new TargetConfig(null, null, null);
    }

    /** One line per choice, ready to be embedded in a prompt. */
    public String describe() {
        return "Frontend: " + orDefault(frontend) + "\n"
             + "Backend: "  + orDefault(backend)  + "\n"
             + "Database: " + orDefault(database);
    }

    private static String orDefault(String v) {
        return (v == null || v.isBlank()) ? "(your choice)" : v;
    }
}
