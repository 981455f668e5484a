package com.specforge.orchestrator.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.specforge.orchestrator.model.Manifest;
import com.specforge.orchestrator.model.PublishTarget;
import com.specforge.orchestrator.model.TargetConfig;

import java.util.UUID;

/**
 * Everything a worker needs about its session, passed explicitly instead
 * of read from shared state.
 *
 * @param publishTarget null when the session does not publish
 */
public record WorkerContext(UUID          sessionId,
                            JsonNode      specification,
                            TargetConfig  target,
                            Manifest      manifest,
                            PublishTarget publishTarget) {}
