package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.exception.GenerationException;
import com.example.hipagent.model.AgentAnswer;
import com.example.hipagent.model.ExtractionResult;
import com.example.hipagent.model.Prompt;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.model.ScoredChunk;
import com.example.hipagent.util.ChoiceLabels;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * RAG answer pipeline for one question:
 * - Validate the question and choices
 * - Retrieve context (skipped when RAG is disabled; degrades to no context on provider errors)
 * - Compose the prompt
 * - Call the generation service exactly once
 * - Extract the choice index
 *
 * Holds no state between calls apart from the read-only index behind the retrieval service.
 * Wired as a bean in {@link com.example.hipagent.config.AgentConfig}.
 */
@RequiredArgsConstructor
public class RagAnswerService implements MultipleChoiceAgent {

    private static final Logger log = LoggerFactory.getLogger(RagAnswerService.class);

    private final RagRetrievalService ragRetrievalService;
    private final PromptComposer promptComposer;
    private final GenerationClient generationClient;
    private final AnswerExtractor answerExtractor;
    private final HipAgentProperties.Rag ragSettings;

    @Override
    public AgentAnswer answer(String question, List<String> choices) {
        String invalid = validate(question, choices);
        if (invalid != null) {
            log.warn("Rejected question: {}", invalid);
            return AgentAnswer.invalidInput();
        }

        RetrievalResult context = retrieveContext(question);
        Prompt prompt = promptComposer.compose(question, choices, context);

        String responseText;
        try {
            responseText = generationClient.generate(prompt);
        } catch (GenerationException e) {
            log.warn("Generation failed, recording no answer: {}", e.getMessage());
            return AgentAnswer.serviceFailure(context);
        } catch (RuntimeException e) {
            log.warn("Generation client raised {}, recording no answer", e.toString(), e);
            return AgentAnswer.serviceFailure(context);
        }

        ExtractionResult extraction = answerExtractor.extract(responseText, choices);
        if (!extraction.isMatch()) {
            log.info("Could not map response to a choice ({} chars)", responseText.length());
        }
        return AgentAnswer.of(extraction, context);
    }

    /**
     * Retrieved chunks that clear the similarity floor, capped at the configured count.
     */
    RetrievalResult retrieveContext(String question) {
        if (!ragSettings.enabled()) {
            return RetrievalResult.empty(question);
        }
        RetrievalResult retrieved;
        try {
            retrieved = ragRetrievalService.retrieve(question, ragSettings.topK(), ragSettings.maxContextChars());
        } catch (AgentConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("RAG retrieval failed, continuing without context: {}", e.toString());
            return RetrievalResult.empty(question);
        }

        List<ScoredChunk> usable = retrieved.chunks().stream()
                .filter(sc -> sc.score() > ragSettings.minSimilarity())
                .limit(ragSettings.contextChunks())
                .toList();
        log.debug("RAG retrieval: {} of {} retrieved chunks used as context", usable.size(), retrieved.chunks().size());
        if (usable.size() == retrieved.chunks().size()) {
            return retrieved;
        }
        return new RetrievalResult(question, usable, RagRetrievalService.buildContext(usable));
    }

    private static String validate(String question, List<String> choices) {
        if (question == null || question.isBlank()) {
            return "question cannot be empty";
        }
        if (choices == null || choices.size() < ChoiceLabels.MIN_CHOICES) {
            return "must provide at least " + ChoiceLabels.MIN_CHOICES + " answer choices";
        }
        if (choices.size() > ChoiceLabels.MAX_CHOICES) {
            return "at most " + ChoiceLabels.MAX_CHOICES + " answer choices are supported";
        }
        if (choices.stream().anyMatch(c -> c == null || c.isBlank())) {
            return "answer choices cannot be empty";
        }
        return null;
    }
}
