package com.dcruver.filetaxonomy.nlp;

/**
 * Text-in, text-out access to a language model.
 */
public interface LlmProvider {

    /**
     * Short name used in logs and results, e.g. "ollama".
     */
    String identifier();

    boolean isAvailable();

    String complete(String prompt, LlmOptions options) throws LlmException;

    /**
     * Ask for a JSON object. Implementations may return the JSON wrapped in prose or a markdown
     * fence; {@link LlmJson} cleans that up.
     */
    String completeJson(String prompt, LlmOptions options) throws LlmException;
}
