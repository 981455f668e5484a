package com.specforge.orchestrator.model;

import java.time.Instant;

/** Proof that a file landed on the source-control host. */
public record PublishRecord(String revisionId, String url, Instant publishedAt) {}
