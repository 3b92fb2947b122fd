package com.example.hipagent.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A worked example shown to the model before the real question.
 * The answer is stored as a choice index and rendered through the shared label table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FewShotExample(
        String question,
        List<String> choices,
        String reasoning,
        int answerIndex
) {
    public FewShotExample {
        choices = choices == null ? List.of() : List.copyOf(choices);
        if (answerIndex < 0 || answerIndex >= choices.size()) {
            throw new IllegalArgumentException(
                    "Exemplar answer index " + answerIndex + " is outside " + choices.size() + " choices");
        }
    }
}
