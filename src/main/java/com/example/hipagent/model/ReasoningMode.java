package com.example.hipagent.model;

public enum ReasoningMode {
    /** Ask only for the final answer line. */
    DIRECT,
    /** Ask for step-by-step reasoning followed by the final answer line. */
    CHAIN_OF_THOUGHT
}
