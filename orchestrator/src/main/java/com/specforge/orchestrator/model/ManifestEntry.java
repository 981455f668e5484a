package com.specforge.orchestrator.model;

import java.util.Set;

/**
 * One planned file.
 *
 * declaredDependencies are informational only (they go into prompts);
 * nothing orders or blocks workers on them.
 */
public record ManifestEntry(String path,
                            FileCategory category,
                            String purpose,
                            Set<String> declaredDependencies) {

    public ManifestEntry {
        declaredDependencies = declaredDependencies == null ? Set.of() : Set.copyOf(declaredDependencies);
        if (purpose == null) purpose = "";
    }
}
