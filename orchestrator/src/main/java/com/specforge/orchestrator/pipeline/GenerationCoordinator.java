package com.specforge.orchestrator.pipeline;

import com.specforge.orchestrator.model.ManifestEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Fans a manifest out to one FileWorker per entry and waits for all of them.
 *
 * Workers run on the shared bounded pool, so the number of files in flight
 * across every session never exceeds the pool size. Results are keyed by
 * path and returned in manifest order regardless of completion order.
 */
@Component
public class GenerationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(GenerationCoordinator.class);

    private final FileWorker      worker;
    private final ExecutorService pool;

    public GenerationCoordinator(FileWorker worker,
                                 @Qualifier("fileWorkerPool") ExecutorService pool) {
        this.worker = worker;
        this.pool   = pool;
    }

    public AggregateResult run(WorkerContext ctx) {
        List<ManifestEntry> entries = ctx.manifest().entries();
        Map<String, CompletableFuture<FileOutcome>> futures = new LinkedHashMap<>();

        for (int i = 0; i < entries.size(); i++) {
            ManifestEntry entry = entries.get(i);
            int position = i;
            futures.put(entry.path(), CompletableFuture
                    .supplyAsync(() -> worker.process(ctx, entry, position), pool)
                    .exceptionally(e -> {
                        Throwable cause = e instanceof CompletionException && e.getCause() != null
                                ? e.getCause() : e;
                        log.error("Worker for {} crashed", entry.path(), cause);
                        return FileOutcome.crashed(entry.path(), position,
                                "Worker crashed: " + cause.getMessage());
                    }));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();

        List<FileOutcome> outcomes = new ArrayList<>(futures.size());
        futures.values().forEach(f -> outcomes.add(f.join()));
        AggregateResult result = new AggregateResult(outcomes);
        log.info("Session {}: {} of {} files done, {} errored",
                ctx.sessionId(), result.succeeded(), outcomes.size(), result.errored());
        return result;
    }
}
