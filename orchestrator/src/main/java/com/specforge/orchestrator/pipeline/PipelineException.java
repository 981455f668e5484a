package com.specforge.orchestrator.pipeline;

/**
 * A failure the pipeline knows how to classify.
 *
 * Unchecked so stages only catch it where they have a specific recovery
 * strategy; everything else propagates to the orchestrator, which fails
 * the session with the message.
 */
public class PipelineException extends RuntimeException {

    public enum Kind {
        SPECIFICATION_MISSING,
        MANIFEST_UNPARSEABLE,
        EMPTY_MANIFEST,
        EMPTY_GENERATION,
        COMPLETION_FAILED,
        ALL_FILES_FAILED
    }

    private final Kind kind;

    public PipelineException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
