package com.example.hipagent.util;

import java.util.List;
import java.util.Optional;

/**
 * The single label table shared by prompt composition and answer extraction.
 *
 * Choice i (0-based, in the original order) is rendered as letter {@code 'A' + i}.
 * Nothing else in the code base derives a letter from an index or the other way round.
 */
public final class ChoiceLabels {

    public static final String LETTERS = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    public static final int MIN_CHOICES = 2;

    public static final int MAX_CHOICES = LETTERS.length();

    /** Sentinel index meaning "no confident answer". */
    public static final int NO_MATCH = -1;

    /** Line prefix the model is told to put in front of its chosen label. */
    public static final String FINAL_ANSWER_PREFIX = "Final answer:";

    private ChoiceLabels() {
    }

    public static String label(int index) {
        if (index < 0 || index >= MAX_CHOICES) {
            throw new IllegalArgumentException("No label for choice index " + index);
        }
        return String.valueOf(LETTERS.charAt(index));
    }

    /**
     * Maps a label (case-insensitive, surrounding whitespace ignored) back to its index,
     * provided the index is valid for {@code choiceCount} choices.
     */
    public static Optional<Integer> indexOf(String label, int choiceCount) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        if (trimmed.length() != 1) {
            return Optional.empty();
        }
        int index = LETTERS.indexOf(Character.toUpperCase(trimmed.charAt(0)));
        if (index < 0 || index >= choiceCount) {
            return Optional.empty();
        }
        return Optional.of(index);
    }

    /** Labels valid for a question with {@code choiceCount} choices, e.g. "A, B, C or D". */
    public static String describeRange(int choiceCount) {
        int count = Math.min(Math.max(choiceCount, 0), MAX_CHOICES);
        if (count == 0) {
            return "";
        }
        if (count == 1) {
            return label(0);
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < count - 1; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(label(i));
        }
        return sb.append(" or ").append(label(count - 1)).toString();
    }

    /** Renders "A) first\nB) second..." in the original order. */
    public static String render(List<String> choices) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < choices.size(); i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(label(i)).append(") ").append(choices.get(i));
        }
        return sb.toString();
    }

    public static boolean isSupportedCount(int choiceCount) {
        return choiceCount >= MIN_CHOICES && choiceCount <= MAX_CHOICES;
    }
}
