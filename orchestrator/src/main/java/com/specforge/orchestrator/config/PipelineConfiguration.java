package com.specforge.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for the pipeline.
 *
 * Session runs and file workers get separate pools. A session thread blocks
 * while its workers run, so sharing one pool could starve the workers.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    /** Bounded pool shared by the file workers of every session. */
    @Bean(name = "fileWorkerPool", destroyMethod = "shutdown")
    public ExecutorService fileWorkerPool(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.maxConcurrentWorkers(), named("file-worker-"));
    }

    @Bean(name = "sessionExecutor", destroyMethod = "shutdown")
    public ExecutorService sessionExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.maxConcurrentSessions(), named("session-"));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
