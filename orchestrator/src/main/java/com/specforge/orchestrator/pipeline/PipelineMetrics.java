package com.specforge.orchestrator.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Pipeline instrumentation:
 * <pre>
 *   specforge.stage.duration{stage="generate|analyze|fix|publish", status="success|error"}
 *   specforge.file.outcomes{state="done|errored", publish="published|failed|skipped|none"}
 *   specforge.session.outcomes{status="completed|failed"}
 * </pre>
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** Time one stage; the status tag is "error" if the supplier throws. */
    public <T> T timeStage(String stage, Supplier<T> work) {
        Timer.Sample sample = Timer.start(registry);
        String status = "success";
        try {
            return work.get();
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(Timer.builder("specforge.stage.duration")
                    .tag("stage", stage)
                    .tag("status", status)
                    .register(registry));
        }
    }

    public void recordFile(FileOutcome outcome) {
        registry.counter("specforge.file.outcomes",
                "state",   lower(outcome.state()),
                "publish", outcome.publishOutcome() == null ? "none" : lower(outcome.publishOutcome())
        ).increment();
    }

    public void recordSession(boolean completed) {
        registry.counter("specforge.session.outcomes",
                "status", completed ? "completed" : "failed").increment();
    }

    private static String lower(Enum<?> e) {
        return e.name().toLowerCase(Locale.ROOT);
    }
}
