package com.example.hipagent.model;

import java.util.List;

/**
 * Scores of one repetition over the whole question set, in question order.
 */
public record RunSummary(
        int run,
        List<RunResult> results,
        int correct,
        int incorrect,
        int noMatch,
        int serviceFailures,
        double accuracy
) {
    public static RunSummary of(int run, List<RunResult> results) {
        int correct = 0;
        int incorrect = 0;
        int noMatch = 0;
        int failures = 0;
        for (RunResult r : results) {
            switch (r.outcome()) {
                case CORRECT -> correct++;
                case INCORRECT -> incorrect++;
                case NO_MATCH -> noMatch++;
                case SERVICE_FAILURE -> failures++;
            }
        }
        double accuracy = results.isEmpty() ? 0.0 : (double) correct / results.size();
        return new RunSummary(run, List.copyOf(results), correct, incorrect, noMatch, failures, accuracy);
    }

    public int total() {
        return results.size();
    }
}
