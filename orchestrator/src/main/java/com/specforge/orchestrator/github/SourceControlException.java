package com.specforge.orchestrator.github;

/**
 * Thrown when the source-control host returns an error or is unreachable.
 */
public class SourceControlException extends RuntimeException {

    public SourceControlException(String message) {
        super(message);
    }

    public SourceControlException(String message, Throwable cause) {
        super(message, cause);
    }
}
