package com.specforge.orchestrator.model;

/** Result of pushing a generated file to the source-control host. */
public enum PublishOutcome {
    SKIPPED,     // session has no publish target
    PUBLISHED,
    FAILED
}
