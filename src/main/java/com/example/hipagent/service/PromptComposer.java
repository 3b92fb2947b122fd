package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.FewShotExample;
import com.example.hipagent.model.Prompt;
import com.example.hipagent.model.ReasoningMode;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.util.ChoiceLabels;

import java.util.List;

/**
 * Assembles the prompt for one question. Pure string assembly: the same inputs always give
 * the same prompt.
 *
 * Choices are labeled through {@link ChoiceLabels} and every prompt, whatever the reasoning
 * mode, ends with the instruction to write {@value ChoiceLabels#FINAL_ANSWER_PREFIX} followed by
 * a label, which is what {@link AnswerExtractor} looks for first.
 */
public class PromptComposer {

    public static final String CONTEXT_HEADER = "=== Relevant Reference Information ===";
    static final String CONTEXT_FOOTER = "=== End of Reference Information ===";
    static final String FEW_SHOT_INTRO = "Here are examples of how to approach similar questions:";
    static final String NEW_QUESTION_INTRO = "Now answer this NEW question:";

    static final String REASONING_INSTRUCTIONS = """
            Instructions:
            1. Read the reference information carefully (if provided above)
            2. Identify key concepts that directly relate to the question
            3. Evaluate each answer choice against the reference information
            4. Use your own knowledge to support your reasoning
            5. Choose the most accurate answer""";

    private final HipAgentProperties.PromptSettings settings;
    private final List<FewShotExample> defaultExemplars;

    public PromptComposer(HipAgentProperties.PromptSettings settings, List<FewShotExample> defaultExemplars) {
        this.settings = settings;
        this.defaultExemplars = defaultExemplars == null ? List.of() : List.copyOf(defaultExemplars);
    }

    /**
     * Composes with the configured reasoning mode and, when few-shot is enabled, the default exemplars.
     */
    public Prompt compose(String question, List<String> choices, RetrievalResult context) {
        List<FewShotExample> exemplars = settings.fewShotEnabled() ? defaultExemplars : List.of();
        return compose(question, choices, context, exemplars, settings.reasoningMode());
    }

    /**
     * @param question  question text
     * @param choices   answer choices in their original order
     * @param context   retrieved context, may be null or empty
     * @param exemplars worked examples, may be null or empty
     * @param mode      whether to ask for reasoning before the final answer
     */
    public Prompt compose(String question,
                          List<String> choices,
                          RetrievalResult context,
                          List<FewShotExample> exemplars,
                          ReasoningMode mode) {
        if (!ChoiceLabels.isSupportedCount(choices.size())) {
            throw new IllegalArgumentException("Unsupported number of choices: " + choices.size());
        }
        boolean reasoning = mode == ReasoningMode.CHAIN_OF_THOUGHT;
        StringBuilder sb = new StringBuilder();

        if (context != null && !context.isEmpty()) {
            sb.append(CONTEXT_HEADER).append('\n')
                    .append(context.context()).append('\n')
                    .append(CONTEXT_FOOTER).append("\n\n");
        }

        if (exemplars != null && !exemplars.isEmpty()) {
            sb.append(FEW_SHOT_INTRO).append("\n\n");
            for (int i = 0; i < exemplars.size(); i++) {
                appendExemplar(sb, i + 1, exemplars.get(i), reasoning);
                sb.append("\n\n");
            }
            sb.append(NEW_QUESTION_INTRO).append("\n\n");
        }

        sb.append("Question: ").append(question).append("\n\n")
                .append("Answer choices:\n")
                .append(ChoiceLabels.render(choices)).append("\n\n");

        if (reasoning) {
            sb.append(REASONING_INSTRUCTIONS).append("\n\n")
                    .append("Format your response as:\n")
                    .append("Reasoning: [your step-by-step analysis]\n")
                    .append(ChoiceLabels.FINAL_ANSWER_PREFIX).append(" [LETTER]\n\n");
        }
        sb.append(finalAnswerInstruction(choices.size()));

        return new Prompt(settings.systemRole(), sb.toString());
    }

    /**
     * The closing line of every prompt.
     */
    public static String finalAnswerInstruction(int choiceCount) {
        return "End your response with a line of the form \"" + ChoiceLabels.FINAL_ANSWER_PREFIX
                + " <letter>\", where <letter> is one of " + ChoiceLabels.describeRange(choiceCount) + ".";
    }

    private static void appendExemplar(StringBuilder sb, int number, FewShotExample example, boolean reasoning) {
        sb.append("Example ").append(number).append(":\n")
                .append("Question: ").append(example.question()).append('\n')
                .append("Answer choices:\n")
                .append(ChoiceLabels.render(example.choices())).append("\n\n");
        if (reasoning && example.reasoning() != null && !example.reasoning().isBlank()) {
            sb.append("Reasoning: ").append(example.reasoning()).append('\n');
        }
        sb.append(ChoiceLabels.FINAL_ANSWER_PREFIX).append(' ').append(ChoiceLabels.label(example.answerIndex()));
    }
}
