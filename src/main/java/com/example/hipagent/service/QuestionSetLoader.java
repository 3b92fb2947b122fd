package com.example.hipagent.service;

import com.example.hipagent.model.Question;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads a labeled question set from a JSON array:
 *
 * <pre>
 * [{"id": "q1", "question": "...", "choices": ["...", "..."], "answer": "exact choice text"},
 *  {"id": "q2", "question": "...", "choices": ["...", "..."], "answerIndex": 1}]
 * </pre>
 *
 * {@code answerIndex} wins when both are given.
 */
@RequiredArgsConstructor
public class QuestionSetLoader {

    private static final Logger log = LoggerFactory.getLogger(QuestionSetLoader.class);

    private final ObjectMapper objectMapper;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record QuestionRecord(
            String id,
            String question,
            List<String> choices,
            String answer,
            Integer answerIndex
    ) {
    }

    public List<Question> load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalArgumentException("Question set not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            List<QuestionRecord> records = objectMapper.readValue(in, new TypeReference<List<QuestionRecord>>() {
            });
            List<Question> questions = toQuestions(records);
            log.info("Loaded {} questions from {}", questions.size(), resource.getDescription());
            return questions;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read question set " + resource.getDescription(), e);
        }
    }

    static List<Question> toQuestions(List<QuestionRecord> records) {
        List<Question> questions = new ArrayList<>(records.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < records.size(); i++) {
            QuestionRecord r = records.get(i);
            String id = r.id() == null || r.id().isBlank() ? "q" + (i + 1) : r.id();
            if (!seen.add(id)) {
                throw new IllegalArgumentException("Duplicate question id " + id);
            }
            if (r.answerIndex() != null) {
                questions.add(new Question(id, r.question(), r.choices(), r.answerIndex()));
            } else if (r.answer() != null) {
                questions.add(Question.withAnswerText(id, r.question(), r.choices(), r.answer()));
            } else {
                questions.add(Question.unlabeled(id, r.question(), r.choices()));
            }
        }
        return questions;
    }
}
