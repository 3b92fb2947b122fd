package com.example.hipagent.config;

import com.example.hipagent.model.NumberingConvention;
import com.example.hipagent.model.ReasoningMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * All tunables of the agent, bound once from {@code hip-agent.*} and passed to each
 * component explicitly.
 */
@Validated
@ConfigurationProperties(prefix = "hip-agent")
public record HipAgentProperties(
        @Valid @DefaultValue Corpus corpus,
        @Valid @DefaultValue Rag rag,
        @Valid @DefaultValue PromptSettings prompt,
        @Valid @DefaultValue Extraction extraction,
        @Valid @DefaultValue Generation generation,
        @Valid @DefaultValue Evaluation evaluation
) {

    /**
     * @param location     Spring resource holding the reference text
     * @param chunkSize    target chunk length in characters (about four characters per token)
     * @param chunkOverlap characters shared by consecutive chunks
     */
    public record Corpus(
            @DefaultValue("classpath:corpus/textbook.txt") String location,
            @Min(1) @DefaultValue("3200") int chunkSize,
            @Min(0) @DefaultValue("200") int chunkOverlap
    ) {
    }

    /**
     * @param enabled         whether questions are answered with retrieved context
     * @param topK            chunks fetched from the index per question
     * @param contextChunks   retrieved chunks placed into the prompt
     * @param maxContextChars cumulative character budget of retrieved chunks, 0 or less for none
     * @param minSimilarity   chunks scoring at or below this are not used as context
     */
    public record Rag(
            @DefaultValue("true") boolean enabled,
            @Min(1) @DefaultValue("5") int topK,
            @Min(1) @DefaultValue("3") int contextChunks,
            @DefaultValue("6000") int maxContextChars,
            @DecimalMin("-1.0") @DecimalMax("1.0") @DefaultValue("0.3") double minSimilarity
    ) {
    }

    public record PromptSettings(
            @NotBlank @DefaultValue("You are an expert tutor. Answer the following multiple-choice question accurately.")
            String systemRole,
            @NotNull @DefaultValue("CHAIN_OF_THOUGHT") ReasoningMode reasoningMode,
            @DefaultValue("true") boolean fewShotEnabled,
            @DefaultValue("classpath:prompts/few-shot-examples.json") String exemplarsLocation
    ) {
    }

    /**
     * @param numbering      how bare numbers in a response map onto choices
     * @param fuzzyThreshold minimum normalized similarity for the fuzzy text strategy
     */
    public record Extraction(
            @NotNull @DefaultValue("ONE_BASED") NumberingConvention numbering,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.8") double fuzzyThreshold
    ) {
    }

    /**
     * @param provider    ChatClient to use, looked up as "&lt;provider&gt;ChatClient"
     * @param model       model identifier sent with every request
     * @param temperature sampling temperature
     * @param timeout     upper bound for a single generation call
     */
    public record Generation(
            @NotBlank @DefaultValue("openai") String provider,
            @NotBlank @DefaultValue("gpt-3.5-turbo") String model,
            @DecimalMin("0.0") @DecimalMax("2.0") @DefaultValue("0.0") double temperature,
            @NotNull @DefaultValue("30s") Duration timeout
    ) {
    }

    /**
     * @param enabled            run the evaluation at startup and exit with its verdict
     * @param questionsLocation  Spring resource holding the labeled question set (JSON)
     * @param runs               independent repetitions over the question set
     * @param passThreshold      minimum median accuracy to pass
     * @param parallelism        worker threads calling the agent
     * @param reportPath         optional file the JSON report is written to
     */
    public record Evaluation(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("classpath:evaluation/questions.json") String questionsLocation,
            @Min(1) @DefaultValue("3") int runs,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.70") double passThreshold,
            @Min(1) @DefaultValue("4") int parallelism,
            String reportPath
    ) {
    }
}
