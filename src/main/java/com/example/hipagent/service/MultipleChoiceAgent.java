package com.example.hipagent.service;

import com.example.hipagent.model.AgentAnswer;

import java.util.List;

/**
 * Answers a multiple-choice question with an index into the given choices.
 */
@FunctionalInterface
public interface MultipleChoiceAgent {

    AgentAnswer answer(String question, List<String> choices);

    /**
     * @return index in [0, choices.size() - 1], or -1 when there is no confident answer
     */
    default int getResponse(String question, List<String> choices) {
        return answer(question, choices).index();
    }
}
