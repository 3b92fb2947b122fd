package com.example.hipagent.model;

import java.util.List;

/**
 * A multiple-choice question. The order of {@code choices} is significant: every index
 * produced or compared anywhere refers to this exact order.
 *
 * @param id           identifier, unique within a batch
 * @param text         question text
 * @param choices      answer-choice texts in their original order
 * @param correctIndex index of the correct choice, or {@code null} outside evaluation
 */
public record Question(
        String id,
        String text,
        List<String> choices,
        Integer correctIndex
) {
    public Question {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question " + id + " has no text");
        }
        if (choices == null || choices.size() < 2) {
            throw new IllegalArgumentException("Question " + id + " needs at least two choices");
        }
        choices = List.copyOf(choices);
        if (correctIndex != null && (correctIndex < 0 || correctIndex >= choices.size())) {
            throw new IllegalArgumentException(
                    "Question " + id + " correct index " + correctIndex + " is outside " + choices.size() + " choices");
        }
    }

    public static Question unlabeled(String id, String text, List<String> choices) {
        return new Question(id, text, choices, null);
    }

    /**
     * Builds a labeled question from the text of the correct answer, matched exactly
     * against the original choice list.
     */
    public static Question withAnswerText(String id, String text, List<String> choices, String answerText) {
        if (choices == null) {
            throw new IllegalArgumentException("Question " + id + " needs at least two choices");
        }
        int index = choices.indexOf(answerText);
        if (index < 0) {
            throw new IllegalArgumentException(
                    "Question " + id + " answer '" + answerText + "' is not one of its choices");
        }
        return new Question(id, text, choices, index);
    }

    public boolean isLabeled() {
        return correctIndex != null;
    }
}
