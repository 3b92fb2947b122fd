package com.example.hipagent.service;

import com.example.hipagent.exception.GenerationException;
import com.example.hipagent.model.Prompt;

/**
 * The text-generation service, called once per question.
 * Retries and rate limiting, if any, live behind this interface.
 */
public interface GenerationClient {

    /**
     * @return the generated text, never null or blank
     * @throws GenerationException on timeout, transport error or an empty response
     */
    String generate(Prompt prompt);
}
