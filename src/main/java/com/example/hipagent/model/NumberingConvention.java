package com.example.hipagent.model;

import java.util.Optional;

/**
 * How a bare number in a generated response is mapped onto a choice index.
 */
public enum NumberingConvention {

    /** "0" is the first choice. */
    ZERO_BASED(0),

    /** "1" is the first choice. */
    ONE_BASED(1);

    private final int offset;

    NumberingConvention(int offset) {
        this.offset = offset;
    }

    public Optional<Integer> toIndex(int number, int choiceCount) {
        int index = number - offset;
        return index >= 0 && index < choiceCount ? Optional.of(index) : Optional.empty();
    }
}
