package com.example.hipagent.model;

import java.util.List;

/**
 * Request payload for answering one multiple-choice question.
 *
 * @param question question text
 * @param choices  answer choices in their original order
 */
public record AnswerRequest(
        String question,
        List<String> choices
) {
    public List<String> resolveChoices() {
        return choices == null ? List.of() : choices;
    }
}
