package com.specforge.orchestrator.pipeline;

import com.specforge.orchestrator.model.FileProgress;
import com.specforge.orchestrator.model.FileState;
import com.specforge.orchestrator.model.FixOutcome;
import com.specforge.orchestrator.model.PublishOutcome;

import java.util.List;

/**
 * What one worker reports back to the coordinator once it settles.
 *
 * @param cancelled true if the worker stopped early because the session was cancelled
 */
public record FileOutcome(String         path,
                          int            position,
                          FileState      state,
                          boolean        cancelled,
                          boolean        analysisFallback,
                          FixOutcome     fixOutcome,
                          PublishOutcome publishOutcome,
                          List<String>   errors) {

    public FileOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    static FileOutcome of(FileProgress p, boolean cancelled) {
        return new FileOutcome(p.path(), p.position(), p.state(), cancelled,
                p.analysisFallback(), p.fixOutcome(), p.publishOutcome(), p.errors());
    }

    /** Used when a worker died with an exception the worker itself did not handle. */
    static FileOutcome crashed(String path, int position, String message) {
        return new FileOutcome(path, position, FileState.ERRORED, false,
                false, null, null, List.of(message));
    }

    public boolean isDone()    { return state == FileState.DONE; }
    public boolean isErrored() { return state == FileState.ERRORED; }
}
