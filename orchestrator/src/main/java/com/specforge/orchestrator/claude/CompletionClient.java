package com.specforge.orchestrator.claude;

/**
 * The one operation the pipeline needs from a text-completion capability.
 *
 * Implementations do no prompt building and no response parsing; the
 * pipeline owns both.
 */
public interface CompletionClient {

    /**
     * @param prompt          full user prompt
     * @param maxOutputTokens cap on the reply length
     * @param temperature     sampling temperature, 0.0 - 1.0
     * @return the raw reply text
     */
    String complete(String prompt, int maxOutputTokens, double temperature);

    /** Identifier of the model answering, recorded on each session. */
    String modelId();
}
