package com.specforge.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs for the generation pipeline, bound from {@code specforge.pipeline.*}.
 *
 * @param maxConcurrentWorkers files processed at once across all sessions
 * @param maxConcurrentSessions sessions whose stages run at once
 * @param model                completion model id
 * @param completionTimeout    wall-clock limit for one completion call
 * @param manifest             limits for the manifest call
 * @param generation           limits for the per-file generation call
 * @param analysis             limits for the static-analysis call
 * @param fix                  limits for the single fix call
 */
@ConfigurationProperties(prefix = "specforge.pipeline")
public record PipelineProperties(
        Integer  maxConcurrentWorkers,
        Integer  maxConcurrentSessions,
        String   model,
        Duration completionTimeout,
        Call     manifest,
        Call     generation,
        Call     analysis,
        Call     fix) {

    /** Output-token cap and temperature for one kind of completion call. */
    public record Call(int maxTokens, double temperature) {}

    public PipelineProperties {
        if (maxConcurrentWorkers == null || maxConcurrentWorkers < 1)   maxConcurrentWorkers = 4;
        if (maxConcurrentSessions == null || maxConcurrentSessions < 1) maxConcurrentSessions = 2;
        if (model == null || model.isBlank()) model = "claude-sonnet-4-6";
        if (completionTimeout == null)        completionTimeout = Duration.ofSeconds(120);
        if (manifest == null)   manifest   = new Call(4096, 0.2);
        if (generation == null) generation = new Call(8192, 0.2);
        if (analysis == null)   analysis   = new Call(2048, 0.0);
        if (fix == null)        fix        = new Call(8192, 0.1);
    }

    /** All defaults; used by tests and when no properties are bound. */
    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null, null, null);
    }
}
