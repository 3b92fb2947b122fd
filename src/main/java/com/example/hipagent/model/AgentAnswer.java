package com.example.hipagent.model;

/**
 * Full result of one agent call. {@link #index()} is what the public contract returns.
 *
 * @param extraction the extracted choice, {@link ExtractionResult#NO_MATCH} when none
 * @param status     how the call ended
 * @param retrieval  context that was retrieved for the prompt (empty when RAG is off or failed)
 */
public record AgentAnswer(
        ExtractionResult extraction,
        Status status,
        RetrievalResult retrieval
) {
    public enum Status {
        /** A choice was extracted from the generated text. */
        ANSWERED,
        /** The service answered, but no strategy resolved a choice. */
        NO_MATCH,
        /** The generation call timed out or failed. */
        SERVICE_FAILURE,
        /** The question or choices were rejected before any call was made. */
        INVALID_INPUT
    }

    public AgentAnswer {
        if (extraction == null) {
            extraction = ExtractionResult.NO_MATCH;
        }
        if (retrieval == null) {
            retrieval = RetrievalResult.empty(null);
        }
    }

    public static AgentAnswer of(ExtractionResult extraction, RetrievalResult retrieval) {
        return new AgentAnswer(extraction, extraction.isMatch() ? Status.ANSWERED : Status.NO_MATCH, retrieval);
    }

    public static AgentAnswer serviceFailure(RetrievalResult retrieval) {
        return new AgentAnswer(ExtractionResult.NO_MATCH, Status.SERVICE_FAILURE, retrieval);
    }

    public static AgentAnswer invalidInput() {
        return new AgentAnswer(ExtractionResult.NO_MATCH, Status.INVALID_INPUT, null);
    }

    public int index() {
        return extraction.index();
    }
}
