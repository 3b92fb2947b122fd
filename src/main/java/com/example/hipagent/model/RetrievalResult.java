package com.example.hipagent.model;

import java.util.List;

/**
 * Pure retrieval result:
 * - question: original query text
 * - chunks: scored chunks in descending similarity, ties in corpus order
 * - context: formatted context string for prompts
 */
public record RetrievalResult(
        String question,
        List<ScoredChunk> chunks,
        String context
) {
    public RetrievalResult {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        context = context == null ? "" : context;
    }

    public static RetrievalResult empty(String question) {
        return new RetrievalResult(question, List.of(), "");
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }

    public int totalChars() {
        return chunks.stream().mapToInt(c -> c.chunk().length()).sum();
    }
}
