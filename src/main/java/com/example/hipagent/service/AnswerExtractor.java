package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.ExtractionResult;
import com.example.hipagent.model.NumberingConvention;
import com.example.hipagent.util.ChoiceLabels;
import com.example.hipagent.util.TextSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a free-form response onto one choice index.
 *
 * Strategies run in a fixed order and the first one that resolves an index wins:
 * <ol>
 *   <li>label: an explicit "Final answer: C"-style statement, a line holding only a label, or a
 *       standalone capital letter in prose; the last one in the text counts</li>
 *   <li>numeric: the last standalone integer that is a valid choice number under the
 *       configured {@link NumberingConvention}</li>
 *   <li>fuzzy: the choice whose normalized text best matches the response, above a threshold</li>
 * </ol>
 * If none resolves, the result is {@link ExtractionResult#NO_MATCH}. Never throws.
 */
public class AnswerExtractor {

    private static final Logger log = LoggerFactory.getLogger(AnswerExtractor.class);

    /** Explicit answer statements. Group 1 is the label. */
    private static final Pattern EXPLICIT_LABEL = Pattern.compile(
            "(?i)(?:final\\s+answer(?:\\s+is)?|\\banswer\\s*(?=:)|\\banswer\\s+is|\\bconclusion\\s*(?=:))"
                    + "\\s*[:\\-]?[\\s*(\\[]*(?:(?:option|choice)\\s+)?([a-z])(?![a-z])"
    );

    /** A line that is nothing but an upper-case label, e.g. "C", "(C)", "**C.**". */
    private static final Pattern LONE_LABEL_LINE = Pattern.compile(
            "(?m)^[\\s*(\\[]*([A-Z])[\\s*)\\].:]*$"
    );

    /** A capital letter not glued to other letters or digits, e.g. "option B." or "B because". */
    private static final Pattern STANDALONE_LABEL = Pattern.compile(
            "(?<![\\p{L}\\p{N}])([A-Z])(?![\\p{L}\\p{N}])"
    );

    /** Characters allowed right after a lower-case label for it to still count as a label. */
    private static final String LABEL_TERMINATORS = ").]:*,;!";

    /** An integer not glued to letters, digits or a decimal part. */
    private static final Pattern STANDALONE_INTEGER = Pattern.compile(
            "(?<![\\w.,])(\\d{1,3})(?![\\w]|[.,]\\d)"
    );

    /** Longest normalized text the edit-distance comparison is run on. */
    private static final int MAX_FUZZY_LENGTH = 4096;

    private static final double CONTAINED_SCORE = 1.0;

    @FunctionalInterface
    interface Strategy {
        Optional<Integer> apply(String text, List<String> choices);
    }

    private record Step(ExtractionResult.Strategy kind, Strategy strategy) {
    }

    private final NumberingConvention numbering;
    private final double fuzzyThreshold;
    private final List<Step> cascade;

    public AnswerExtractor(HipAgentProperties.Extraction settings) {
        this.numbering = settings.numbering();
        this.fuzzyThreshold = settings.fuzzyThreshold();
        this.cascade = List.of(
                new Step(ExtractionResult.Strategy.LABEL, AnswerExtractor::matchLabel),
                new Step(ExtractionResult.Strategy.NUMERIC, this::matchNumber),
                new Step(ExtractionResult.Strategy.FUZZY, this::matchText)
        );
    }

    public ExtractionResult extract(String responseText, List<String> choices) {
        if (responseText == null || responseText.isBlank() || choices == null || choices.isEmpty()) {
            return ExtractionResult.NO_MATCH;
        }
        for (Step step : cascade) {
            Optional<Integer> index;
            try {
                index = step.strategy().apply(responseText, choices);
            } catch (RuntimeException e) {
                log.warn("Answer extraction: {} strategy failed, trying next: {}", step.kind(), e.toString());
                continue;
            }
            if (index.isPresent()) {
                log.debug("Answer extraction: resolved index {} via {}", index.get(), step.kind());
                return ExtractionResult.of(index.get(), step.kind());
            }
        }
        log.debug("Answer extraction: no strategy matched for {} choices", choices.size());
        return ExtractionResult.NO_MATCH;
    }

    /**
     * Last label occurrence in the text, whether from an explicit statement or a lone label line.
     */
    static Optional<Integer> matchLabel(String text, List<String> choices) {
        int bestPosition = -1;
        Integer bestIndex = null;

        Matcher explicit = EXPLICIT_LABEL.matcher(text);
        while (explicit.find()) {
            char letter = explicit.group(1).charAt(0);
            if (Character.isLowerCase(letter) && !isTerminated(text, explicit.end(1))) {
                // "the answer is a protein": an article, not a label
                continue;
            }
            Optional<Integer> index = ChoiceLabels.indexOf(explicit.group(1), choices.size());
            if (index.isPresent() && explicit.start(1) > bestPosition) {
                bestPosition = explicit.start(1);
                bestIndex = index.get();
            }
        }

        Matcher lone = LONE_LABEL_LINE.matcher(text);
        while (lone.find()) {
            Optional<Integer> index = ChoiceLabels.indexOf(lone.group(1), choices.size());
            if (index.isPresent() && lone.start(1) > bestPosition) {
                bestPosition = lone.start(1);
                bestIndex = index.get();
            }
        }

        Matcher standalone = STANDALONE_LABEL.matcher(text);
        while (standalone.find()) {
            if (startsSentence(text, standalone)) {
                // "A cell", "I think": article or pronoun
                continue;
            }
            Optional<Integer> index = ChoiceLabels.indexOf(standalone.group(1), choices.size());
            if (index.isPresent() && standalone.start(1) > bestPosition) {
                bestPosition = standalone.start(1);
                bestIndex = index.get();
            }
        }
        return Optional.ofNullable(bestIndex);
    }

    private static boolean startsSentence(String text, Matcher label) {
        char letter = label.group(1).charAt(0);
        if (letter != 'A' && letter != 'I') {
            return false;
        }
        int i = label.end(1);
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i > label.end(1) && i < text.length() && Character.isLowerCase(text.charAt(i));
    }

    private static boolean isTerminated(String text, int position) {
        if (position >= text.length()) {
            return true;
        }
        char next = text.charAt(position);
        if (LABEL_TERMINATORS.indexOf(next) >= 0 || next == '\n' || next == '\r') {
            return true;
        }
        // trailing spaces up to the end of the line
        int i = position;
        while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t')) {
            i++;
        }
        return i >= text.length() || text.charAt(i) == '\n' || text.charAt(i) == '\r';
    }

    /**
     * Last standalone integer that names a choice under the configured numbering.
     */
    Optional<Integer> matchNumber(String text, List<String> choices) {
        Matcher matcher = STANDALONE_INTEGER.matcher(text);
        Integer last = null;
        while (matcher.find()) {
            int number = Integer.parseInt(matcher.group(1));
            Optional<Integer> index = numbering.toIndex(number, choices.size());
            if (index.isPresent()) {
                last = index.get();
            }
        }
        return Optional.ofNullable(last);
    }

    /**
     * Best-scoring choice by normalized text. A choice contained in the response as a whole
     * phrase scores 1.0, otherwise the edit-distance ratio is used. Ties at the top are
     * ambiguous and resolve to nothing, except that among contained choices the longer one wins.
     */
    Optional<Integer> matchText(String text, List<String> choices) {
        String response = TextSimilarity.normalize(text);
        if (response.isEmpty()) {
            return Optional.empty();
        }

        int bestIndex = -1;
        double bestScore = -1.0;
        int bestLength = -1;
        boolean ambiguous = false;

        for (int i = 0; i < choices.size(); i++) {
            String choice = TextSimilarity.normalize(choices.get(i));
            if (choice.isEmpty()) {
                continue;
            }
            double score = score(response, choice);
            if (score < fuzzyThreshold) {
                continue;
            }
            int length = score == CONTAINED_SCORE ? choice.length() : 0;
            if (score > bestScore || (score == bestScore && length > bestLength)) {
                bestIndex = i;
                bestScore = score;
                bestLength = length;
                ambiguous = false;
            } else if (score == bestScore && length == bestLength) {
                ambiguous = true;
            }
        }

        if (bestIndex < 0) {
            return Optional.empty();
        }
        if (ambiguous) {
            log.debug("Answer extraction: fuzzy match is ambiguous at score {}", bestScore);
            return Optional.empty();
        }
        return Optional.of(bestIndex);
    }

    private double score(String response, String choice) {
        if (TextSimilarity.containsPhrase(response, choice)) {
            return CONTAINED_SCORE;
        }
        if (TextSimilarity.maxLevenshteinRatio(response.length(), choice.length()) < fuzzyThreshold
                || response.length() > MAX_FUZZY_LENGTH
                || choice.length() > MAX_FUZZY_LENGTH) {
            return 0.0;
        }
        return TextSimilarity.levenshteinRatio(response, choice);
    }
}
