package com.example.hipagent.model;

import java.util.List;

/**
 * Aggregate of repeated evaluation runs. Pass/fail is decided on {@link #medianAccuracy()}.
 */
public record EvaluationSummary(
        List<RunSummary> runs,
        List<Double> accuracies,
        double medianAccuracy,
        double meanAccuracy,
        double minAccuracy,
        double maxAccuracy,
        double threshold,
        boolean passed
) {
    public EvaluationSummary {
        runs = List.copyOf(runs);
        accuracies = List.copyOf(accuracies);
    }

    public int questionCount() {
        return runs.isEmpty() ? 0 : runs.get(0).total();
    }

    public int totalNoMatch() {
        return runs.stream().mapToInt(RunSummary::noMatch).sum();
    }

    public int totalServiceFailures() {
        return runs.stream().mapToInt(RunSummary::serviceFailures).sum();
    }
}
