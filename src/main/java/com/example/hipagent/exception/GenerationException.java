package com.example.hipagent.exception;

/**
 * The generation service did not produce usable text: timeout, transport error or empty body.
 */
public class GenerationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
