package com.example.hipagent.exception;

/**
 * A setup problem that makes answering questions pointless: missing corpus, an index with no
 * embedded chunks, mismatched embedding dimensions, no chat model. Raised before any question
 * is processed.
 */
public class AgentConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AgentConfigurationException(String message) {
        super(message);
    }

    public AgentConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
