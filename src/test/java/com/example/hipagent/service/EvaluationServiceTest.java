package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.AgentAnswer;
import com.example.hipagent.model.EvaluationSummary;
import com.example.hipagent.model.ExtractionResult;
import com.example.hipagent.model.Question;
import com.example.hipagent.model.RunResult;
import com.example.hipagent.model.RunSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EvaluationServiceTest {

    private static final List<String> CHOICES = List.of("w", "x", "y", "z");

    private final EvaluationService service = new EvaluationService(
            new HipAgentProperties.Evaluation(false, "unused", 3, 0.70, 4, null));

    private static List<Question> questions(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> new Question("q" + i, "question " + i, CHOICES, i % CHOICES.size()))
                .toList();
    }

    /** Answers each question by looking up its text. */
    private static MultipleChoiceAgent byText(List<Question> questions, Function<Question, AgentAnswer> answer) {
        Map<String, Question> byText = questions.stream().collect(Collectors.toMap(Question::text, q -> q));
        return (text, choices) -> answer.apply(byText.get(text));
    }

    private static AgentAnswer answered(int index) {
        return AgentAnswer.of(ExtractionResult.of(index, ExtractionResult.Strategy.LABEL), null);
    }

    @Test
    void perfectAgentPasses() {
        List<Question> questions = questions(10);

        EvaluationSummary summary = service.evaluate(questions, byText(questions, q -> answered(q.correctIndex())), 3);

        assertThat(summary.runs()).hasSize(3);
        assertThat(summary.accuracies()).containsExactly(1.0, 1.0, 1.0);
        assertThat(summary.medianAccuracy()).isEqualTo(1.0);
        assertThat(summary.questionCount()).isEqualTo(10);
        assertThat(summary.threshold()).isEqualTo(0.70);
        assertThat(summary.passed()).isTrue();
    }

    @Test
    @DisplayName("no match and service failures are counted apart and never as correct")
    void outcomesAreCountedSeparately() {
        List<Question> questions = questions(10);
        MultipleChoiceAgent agent = byText(questions, q -> switch (q.id()) {
            case "q3" -> throw new IllegalStateException("agent crashed");
            case "q4" -> AgentAnswer.serviceFailure(null);
            case "q5" -> AgentAnswer.of(ExtractionResult.NO_MATCH, null);
            case "q6" -> answered((q.correctIndex() + 1) % CHOICES.size());
            default -> answered(q.correctIndex());
        });

        EvaluationSummary summary = service.evaluate(questions, agent, 2);

        RunSummary run = summary.runs().get(0);
        assertThat(run.correct()).isEqualTo(6);
        assertThat(run.incorrect()).isEqualTo(1);
        assertThat(run.noMatch()).isEqualTo(1);
        assertThat(run.serviceFailures()).isEqualTo(2);
        assertThat(run.accuracy()).isCloseTo(0.6, within(1e-9));
        assertThat(summary.totalNoMatch()).isEqualTo(2);
        assertThat(summary.totalServiceFailures()).isEqualTo(4);
        assertThat(summary.passed()).isFalse();
    }

    @Test
    void resultsKeepQuestionOrderUnderParallelism() {
        List<Question> questions = questions(12);
        Set<String> threads = ConcurrentHashMap.newKeySet();
        MultipleChoiceAgent agent = byText(questions, q -> {
            threads.add(Thread.currentThread().getName());
            try {
                Thread.sleep((12 - Integer.parseInt(q.id().substring(1))) * 5L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return answered(q.correctIndex());
        });

        EvaluationSummary summary = service.evaluate(questions, agent, 2);

        for (RunSummary run : summary.runs()) {
            assertThat(run.results()).extracting(RunResult::questionId)
                    .containsExactlyElementsOf(questions.stream().map(Question::id).toList());
        }
        assertThat(threads).allMatch(name -> name.startsWith("evaluation-"));
    }

    @Test
    void deterministicAgentGivesIdenticalSummaries() {
        List<Question> questions = questions(8);
        MultipleChoiceAgent agent = byText(questions, q -> q.correctIndex() == 0 ? answered(1) : answered(q.correctIndex()));

        EvaluationSummary first = service.evaluate(questions, agent, 3);
        EvaluationSummary second = service.evaluate(questions, agent, 3);

        assertThat(first).isEqualTo(second);
        assertThat(first.medianAccuracy()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    @DisplayName("verdict uses the median, so one bad run does not fail the set")
    void medianDecides() {
        List<RunSummary> runs = List.of(
                new RunSummary(1, List.of(), 9, 1, 0, 0, 0.9),
                new RunSummary(2, List.of(), 9, 1, 0, 0, 0.92),
                new RunSummary(3, List.of(), 1, 9, 0, 0, 0.1));

        EvaluationSummary summary = EvaluationService.summarize(runs, 0.70);

        assertThat(summary.medianAccuracy()).isEqualTo(0.9);
        assertThat(summary.meanAccuracy()).isCloseTo(0.64, within(1e-9));
        assertThat(summary.minAccuracy()).isEqualTo(0.1);
        assertThat(summary.maxAccuracy()).isEqualTo(0.92);
        assertThat(summary.passed()).isTrue();
    }

    @Test
    void median() {
        assertThat(EvaluationService.median(List.of(0.9, 0.92, 0.1))).isEqualTo(0.9);
        assertThat(EvaluationService.median(List.of(0.8, 0.2, 0.6, 0.4))).isCloseTo(0.5, within(1e-9));
        assertThat(EvaluationService.median(List.of(0.3))).isEqualTo(0.3);
        assertThatThrownBy(() -> EvaluationService.median(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsUnusableInput() {
        List<Question> labeled = questions(2);
        MultipleChoiceAgent agent = (q, c) -> answered(0);

        assertThatThrownBy(() -> service.evaluate(labeled, agent, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.evaluate(List.of(), agent, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.evaluate(List.of(Question.unlabeled("u", "text", CHOICES)), agent, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("u");
    }
}
