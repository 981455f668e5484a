package com.specforge.orchestrator.api.dto;

/**
 * Error body for every non-2xx response.
 *
 * @param code      machine-readable error code, e.g. SPECIFICATION_MISSING
 * @param traceId   id also written to the log line for this error
 * @param timestamp ISO-8601 instant
 */
public record ErrorResponse(String code, String message, String traceId, String timestamp) {}
