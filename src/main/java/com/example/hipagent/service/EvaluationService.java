package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.AgentAnswer;
import com.example.hipagent.model.EvaluationSummary;
import com.example.hipagent.model.Question;
import com.example.hipagent.model.RunResult;
import com.example.hipagent.model.RunSummary;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Repeated-run evaluation of an agent over a labeled question set.
 *
 * Every (run, question) pair is an independent task on a fixed worker pool. Each task returns
 * its own {@link RunResult}; results are gathered in question order only after the tasks
 * complete, so workers never share a mutable collection. The pass/fail verdict uses the
 * median of the per-run accuracies.
 */
@RequiredArgsConstructor
public class EvaluationService {

    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final HipAgentProperties.Evaluation settings;

    public EvaluationSummary evaluate(List<Question> questions, MultipleChoiceAgent agent, int runs) {
        return evaluate(questions, agent, runs, settings.passThreshold());
    }

    /**
     * @param questions labeled questions
     * @param agent     agent under test
     * @param runs      independent repetitions, at least 1
     * @param threshold minimum median accuracy to pass
     */
    public EvaluationSummary evaluate(List<Question> questions, MultipleChoiceAgent agent, int runs, double threshold) {
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be at least 1, got " + runs);
        }
        if (questions == null || questions.isEmpty()) {
            throw new IllegalArgumentException("question set is empty");
        }
        for (Question q : questions) {
            if (!q.isLabeled()) {
                throw new IllegalArgumentException("question " + q.id() + " has no correct answer");
            }
        }

        log.info("Evaluation: {} questions x {} runs on {} workers", questions.size(), runs, settings.parallelism());
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(settings.parallelism(), r -> {
            Thread t = new Thread(r, "evaluation-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<RunSummary> summaries = new ArrayList<>(runs);
        try {
            List<List<Future<RunResult>>> pending = new ArrayList<>(runs);
            for (int run = 0; run < runs; run++) {
                List<Future<RunResult>> futures = new ArrayList<>(questions.size());
                for (Question question : questions) {
                    futures.add(executor.submit(() -> answerOne(question, agent)));
                }
                pending.add(futures);
            }
            for (int run = 0; run < runs; run++) {
                List<RunResult> results = new ArrayList<>(questions.size());
                for (Future<RunResult> future : pending.get(run)) {
                    results.add(await(future));
                }
                RunSummary summary = RunSummary.of(run + 1, results);
                log.info("Evaluation: run {}/{} score {}/{} (no match: {}, service failures: {})",
                        run + 1, runs, summary.correct(), summary.total(), summary.noMatch(), summary.serviceFailures());
                summaries.add(summary);
            }
        } finally {
            executor.shutdownNow();
        }
        return summarize(summaries, threshold);
    }

    private static RunResult answerOne(Question question, MultipleChoiceAgent agent) {
        try {
            AgentAnswer answer = agent.answer(question.text(), question.choices());
            return RunResult.score(question, answer);
        } catch (RuntimeException e) {
            log.warn("Evaluation: agent failed on question {}: {}", question.id(), e.toString());
            return RunResult.failed(question);
        }
    }

    private static RunResult await(Future<RunResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Evaluation interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Evaluation task failed", e.getCause());
        }
    }

    static EvaluationSummary summarize(List<RunSummary> runs, double threshold) {
        List<Double> accuracies = runs.stream().map(RunSummary::accuracy).toList();
        double median = median(accuracies);
        double mean = accuracies.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double min = accuracies.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = accuracies.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return new EvaluationSummary(runs, accuracies, median, mean, min, max, threshold, median >= threshold);
    }

    /**
     * Middle value of the sorted values; the mean of the two middle values for an even count.
     */
    public static double median(List<Double> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("median of no values");
        }
        List<Double> sorted = values.stream().sorted().toList();
        int mid = sorted.size() / 2;
        if (sorted.size() % 2 == 1) {
            return sorted.get(mid);
        }
        return (sorted.get(mid - 1) + sorted.get(mid)) / 2.0;
    }
}
