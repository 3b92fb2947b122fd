package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.Chunk;
import com.example.hipagent.model.FewShotExample;
import com.example.hipagent.model.Prompt;
import com.example.hipagent.model.ReasoningMode;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.model.ScoredChunk;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PromptComposerTest {

    private static final String QUESTION = "Which organelle produces ATP?";
    private static final List<String> CHOICES = List.of("Nucleus", "Mitochondrion", "Ribosome", "Golgi apparatus");

    private static final FewShotExample EXEMPLAR = new FewShotExample(
            "Which concept did Darwin and Wallace discover?",
            List.of("mutation", "natural selection"),
            "Both proposed natural selection.",
            1);

    private static HipAgentProperties.PromptSettings settings(ReasoningMode mode, boolean fewShot) {
        return new HipAgentProperties.PromptSettings("You are a biology tutor.", mode, fewShot, "unused");
    }

    private static RetrievalResult context() {
        Chunk chunk = new Chunk(4, 0, "Mitochondria are the site of cellular respiration.", new float[]{1f});
        List<ScoredChunk> chunks = List.of(new ScoredChunk(chunk, 0.82));
        return new RetrievalResult(QUESTION, chunks, RagRetrievalService.buildContext(chunks));
    }

    @Test
    void finalAnswerInstructionNamesTheValidLabels() {
        assertThat(PromptComposer.finalAnswerInstruction(3)).isEqualTo(
                "End your response with a line of the form \"Final answer: <letter>\", where <letter> is one of A, B or C.");
    }

    @Nested
    class ChainOfThought {

        private final PromptComposer composer =
                new PromptComposer(settings(ReasoningMode.CHAIN_OF_THOUGHT, true), List.of(EXEMPLAR));

        @Test
        void layoutIsContextThenExamplesThenQuestion() {
            Prompt prompt = composer.compose(QUESTION, CHOICES, context());
            String user = prompt.user();

            assertThat(prompt.system()).isEqualTo("You are a biology tutor.");
            assertThat(user).startsWith(PromptComposer.CONTEXT_HEADER);
            assertThat(user).contains("Mitochondria are the site of cellular respiration.");
            assertThat(user.indexOf(PromptComposer.CONTEXT_FOOTER))
                    .isLessThan(user.indexOf("Example 1:"));
            assertThat(user.indexOf(PromptComposer.NEW_QUESTION_INTRO))
                    .isLessThan(user.indexOf("Question: " + QUESTION));
        }

        @Test
        void exemplarsShowReasoningAndLabeledAnswer() {
            String user = composer.compose(QUESTION, CHOICES, null).user();

            assertThat(user).contains("A) mutation\nB) natural selection");
            assertThat(user).contains("Reasoning: Both proposed natural selection.\nFinal answer: B");
        }

        @Test
        void choicesAreLabeledInOriginalOrder() {
            String user = composer.compose(QUESTION, CHOICES, null).user();

            assertThat(user).contains("A) Nucleus\nB) Mitochondrion\nC) Ribosome\nD) Golgi apparatus");
        }

        @Test
        void asksForReasoningAndEndsWithFinalAnswerInstruction() {
            String user = composer.compose(QUESTION, CHOICES, null).user();

            assertThat(user).contains(PromptComposer.REASONING_INSTRUCTIONS);
            assertThat(user).contains("Reasoning: [your step-by-step analysis]");
            assertThat(user).endsWith(PromptComposer.finalAnswerInstruction(4));
        }

        @Test
        void noContextBlockWithoutContext() {
            String user = composer.compose(QUESTION, CHOICES, RetrievalResult.empty(QUESTION)).user();

            assertThat(user).doesNotContain(PromptComposer.CONTEXT_HEADER);
        }

        @Test
        void sameInputsSamePrompt() {
            assertThat(composer.compose(QUESTION, CHOICES, context()))
                    .isEqualTo(composer.compose(QUESTION, CHOICES, context()));
        }
    }

    @Nested
    class Direct {

        private final PromptComposer composer =
                new PromptComposer(settings(ReasoningMode.DIRECT, false), List.of(EXEMPLAR));

        @Test
        void noReasoningRequestedButFinalAnswerLineStillRequired() {
            String user = composer.compose(QUESTION, CHOICES, null).user();

            assertThat(user).doesNotContain("Reasoning:");
            assertThat(user).doesNotContain("Instructions:");
            assertThat(user).endsWith(PromptComposer.finalAnswerInstruction(4));
        }

        @Test
        void fewShotDisabledLeavesExamplesOut() {
            String user = composer.compose(QUESTION, CHOICES, null).user();

            assertThat(user).doesNotContain(PromptComposer.FEW_SHOT_INTRO);
            assertThat(user).startsWith("Question: " + QUESTION);
        }

        @Test
        void explicitExemplarsOmitReasoningInDirectMode() {
            String user = composer.compose(QUESTION, CHOICES, null, List.of(EXEMPLAR), ReasoningMode.DIRECT).user();

            assertThat(user).contains("Example 1:");
            assertThat(user).contains("B) natural selection\n\nFinal answer: B");
            assertThat(user).doesNotContain("Both proposed natural selection.");
        }
    }

    @Test
    void rejectsUnsupportedChoiceCount() {
        PromptComposer composer = new PromptComposer(settings(ReasoningMode.DIRECT, false), null);

        assertThatThrownBy(() -> composer.compose(QUESTION, List.of("only"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
