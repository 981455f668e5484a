package com.specforge.orchestrator.github;

/**
 * Writes single files to a hosted repository.
 */
public interface SourceControlClient {

    /** Revision created by a write and a browsable link to the file. */
    record PutFileResult(String revisionId, String url) {}

    /**
     * Create or overwrite {@code path} on {@code branch} with one commit.
     *
     * @throws SourceControlException if the host rejects the write or is unreachable
     */
    PutFileResult putFile(String owner, String repository, String path,
                          String content, String branch, String message);
}
