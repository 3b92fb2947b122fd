package com.example.hipagent.model;

import com.example.hipagent.util.ChoiceLabels;

/**
 * Outcome of mapping a free-form response onto a choice index.
 *
 * @param index    0-based index into the original choice list, or -1 for no match
 * @param strategy the extraction strategy that produced the index
 */
public record ExtractionResult(
        int index,
        Strategy strategy
) {
    public static final ExtractionResult NO_MATCH = new ExtractionResult(ChoiceLabels.NO_MATCH, Strategy.NONE);

    public enum Strategy {
        LABEL,
        NUMERIC,
        FUZZY,
        NONE
    }

    public ExtractionResult {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy must not be null");
        }
        if ((strategy == Strategy.NONE) != (index == ChoiceLabels.NO_MATCH)) {
            throw new IllegalArgumentException("index " + index + " does not fit strategy " + strategy);
        }
        if (index < ChoiceLabels.NO_MATCH) {
            throw new IllegalArgumentException("invalid index " + index);
        }
    }

    public static ExtractionResult of(int index, Strategy strategy) {
        return new ExtractionResult(index, strategy);
    }

    public boolean isMatch() {
        return strategy != Strategy.NONE;
    }
}
