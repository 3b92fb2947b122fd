package com.example.hipagent.model;

/**
 * One question scored in one evaluation run.
 */
public record RunResult(
        String questionId,
        int predictedIndex,
        int correctIndex,
        Outcome outcome
) {
    public enum Outcome {
        CORRECT,
        INCORRECT,
        /** No confident answer could be extracted (never counted as correct). */
        NO_MATCH,
        /** The generation service or agent failed for this question. */
        SERVICE_FAILURE
    }

    public static RunResult score(Question question, AgentAnswer answer) {
        int correct = question.correctIndex();
        int predicted = answer.index();
        Outcome outcome = switch (answer.status()) {
            case SERVICE_FAILURE -> Outcome.SERVICE_FAILURE;
            case NO_MATCH, INVALID_INPUT -> Outcome.NO_MATCH;
            case ANSWERED -> predicted == correct ? Outcome.CORRECT : Outcome.INCORRECT;
        };
        return new RunResult(question.id(), predicted, correct, outcome);
    }

    public static RunResult failed(Question question) {
        return new RunResult(question.id(), ExtractionResult.NO_MATCH.index(), question.correctIndex(),
                Outcome.SERVICE_FAILURE);
    }

    public boolean isCorrect() {
        return outcome == Outcome.CORRECT;
    }
}
