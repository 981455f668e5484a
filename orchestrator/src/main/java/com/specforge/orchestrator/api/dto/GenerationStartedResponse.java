package com.specforge.orchestrator.api.dto;

import java.util.UUID;

/** Response body for POST /code/generate. Poll GET /code/status/{sessionId} next. */
public record GenerationStartedResponse(UUID sessionId, String status) {}
