package com.example.hipagent.model;

import com.example.hipagent.util.ChoiceLabels;

/**
 * @param index    chosen index, or -1
 * @param label    letter of the chosen index, or null for -1
 * @param strategy extraction strategy that resolved the index
 * @param status   outcome of the agent call
 */
public record AnswerResponse(
        int index,
        String label,
        ExtractionResult.Strategy strategy,
        AgentAnswer.Status status
) {
    public static AnswerResponse from(AgentAnswer answer) {
        int index = answer.index();
        String label = index == ChoiceLabels.NO_MATCH ? null : ChoiceLabels.label(index);
        return new AnswerResponse(index, label, answer.extraction().strategy(), answer.status());
    }
}
