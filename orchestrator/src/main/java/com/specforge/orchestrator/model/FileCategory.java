package com.specforge.orchestrator.model;

import java.util.Locale;

/** The manifest buckets a generated file can belong to. */
public enum FileCategory {
    FRONTEND,
    BACKEND,
    CONFIG,
    DATABASE;

    /** Key used for this category in the manifest JSON returned by the model. */
    public String jsonKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
