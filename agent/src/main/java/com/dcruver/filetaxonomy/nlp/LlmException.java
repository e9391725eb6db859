package com.dcruver.filetaxonomy.nlp;

/**
 * An LLM call failed or returned nothing usable. Callers treat this as a per-item failure.
 */
public class LlmException extends Exception {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
