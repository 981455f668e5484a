package com.specforge.orchestrator.model;

import java.util.Objects;

/**
 * Source-control destination for generated files.
 * The branch defaults to "main", like the repository default in the schema.
 */
public record PublishTarget(String owner, String repository, String branch) {

    public static final String DEFAULT_BRANCH = "main";

    public PublishTarget {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(repository, "repository");
        if (branch == null || branch.isBlank()) branch = DEFAULT_BRANCH;
    }
}
