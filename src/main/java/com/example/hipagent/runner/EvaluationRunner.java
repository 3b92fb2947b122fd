package com.example.hipagent.runner;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.model.EvaluationSummary;
import com.example.hipagent.model.Question;
import com.example.hipagent.model.RunSummary;
import com.example.hipagent.service.EvaluationService;
import com.example.hipagent.service.MultipleChoiceAgent;
import com.example.hipagent.service.QuestionSetLoader;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Runs the labeled question set through the agent at startup, logs the statistics and
 * sets the exit code: 0 when the median accuracy reaches the threshold, 1 otherwise.
 */
@Component
@ConditionalOnProperty(prefix = "hip-agent.evaluation", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class EvaluationRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(EvaluationRunner.class);

    private final HipAgentProperties properties;
    private final QuestionSetLoader questionSetLoader;
    private final EvaluationService evaluationService;
    private final MultipleChoiceAgent agent;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    private volatile int exitCode = 1;

    @Override
    public void run(ApplicationArguments args) {
        HipAgentProperties.Evaluation settings = properties.evaluation();
        List<Question> questions = questionSetLoader.load(resourceLoader.getResource(settings.questionsLocation()));
        EvaluationSummary summary = evaluationService.evaluate(questions, agent, settings.runs(), settings.passThreshold());

        logSummary(summary);
        if (settings.reportPath() != null && !settings.reportPath().isBlank()) {
            writeReport(summary, Path.of(settings.reportPath()));
        }
        exitCode = summary.passed() ? 0 : 1;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private static void logSummary(EvaluationSummary summary) {
        log.info("==== Evaluation: {} questions x {} runs ====", summary.questionCount(), summary.runs().size());
        for (RunSummary run : summary.runs()) {
            log.info("Run {}: {}/{} correct ({})", run.run(), run.correct(), run.total(), percent(run.accuracy()));
        }
        log.info("Median {} | mean {} | min {} | max {}",
                percent(summary.medianAccuracy()), percent(summary.meanAccuracy()),
                percent(summary.minAccuracy()), percent(summary.maxAccuracy()));
        log.info("No match: {} | service failures: {}", summary.totalNoMatch(), summary.totalServiceFailures());
        if (summary.passed()) {
            log.info("PASSED: median accuracy {} >= {}", percent(summary.medianAccuracy()), percent(summary.threshold()));
        } else {
            log.warn("FAILED: median accuracy {} < {}", percent(summary.medianAccuracy()), percent(summary.threshold()));
        }
    }

    private void writeReport(EvaluationSummary summary, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), summary);
            log.info("Evaluation report written to {}", path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write evaluation report " + path, e);
        }
    }

    private static String percent(double value) {
        return String.format(Locale.US, "%.1f%%", value * 100);
    }
}
