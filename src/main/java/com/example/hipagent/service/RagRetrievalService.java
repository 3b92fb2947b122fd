package com.example.hipagent.service;

import com.example.hipagent.config.HipAgentProperties;
import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.model.RetrievalQuery;
import com.example.hipagent.model.RetrievalResult;
import com.example.hipagent.model.ScoredChunk;
import com.example.hipagent.repository.CorpusIndex;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * RAG retrieval-only service:
 * - Embeds the query with the same provider that embedded the corpus
 * - Ranks every indexed chunk by cosine similarity
 * - Keeps the top K, then trims to a character budget
 * - Builds prompt-ready context text
 *
 * This service does NOT call the generation service. An empty index gives an empty result,
 * never an error. Wired as a bean in {@link com.example.hipagent.config.AgentConfig}.
 */
@RequiredArgsConstructor
public class RagRetrievalService {

    private static final Logger log = LoggerFactory.getLogger(RagRetrievalService.class);

    private static final String DIMENSION_PROBE = "dimension probe";

    private final EmbeddingModel embeddingModel;
    private final CorpusIndex corpusIndex;
    private final HipAgentProperties.Rag settings;

    /**
     * Checks once, before any question is processed, that queries embed to the index dimension.
     *
     * @throws AgentConfigurationException on a dimension mismatch
     */
    public void verifyDimensions() {
        if (corpusIndex.isEmpty()) {
            return;
        }
        float[] probe = embeddingModel.embed(DIMENSION_PROBE);
        int queryDimension = probe == null ? 0 : probe.length;
        if (queryDimension != corpusIndex.dimension()) {
            throw new AgentConfigurationException("Query embeddings have dimension " + queryDimension
                    + " but the corpus index has dimension " + corpusIndex.dimension());
        }
        log.info("RAG retrieval: embedding dimension {} verified against {} indexed chunks",
                queryDimension, corpusIndex.size());
    }

    public RetrievalResult retrieve(RetrievalQuery request) {
        return retrieve(
                request.question(),
                request.resolveTopK(settings.topK()),
                request.resolveMaxChars(settings.maxContextChars())
        );
    }

    /**
     * Core retrieval method:
     * 1. Embed the query
     * 2. Score all chunks and keep the best k (ties in corpus order)
     * 3. Drop trailing chunks once the cumulative length would pass maxChars, keeping at least one
     * 4. Build context text
     *
     * @param queryText question text
     * @param k         maximum number of chunks
     * @param maxChars  character budget over the returned chunks; 0 or less disables it
     * @throws AgentConfigurationException if the query embedding dimension differs from the index
     */
    public RetrievalResult retrieve(String queryText, int k, int maxChars) {
        if (corpusIndex.isEmpty() || k <= 0) {
            return RetrievalResult.empty(queryText);
        }
        if (queryText == null || queryText.isBlank()) {
            log.debug("RAG retrieval: blank query, returning no context");
            return RetrievalResult.empty(queryText);
        }

        float[] queryEmbedding = embeddingModel.embed(queryText);
        List<ScoredChunk> nearest = corpusIndex.findNearest(queryEmbedding, k);
        List<ScoredChunk> budgeted = applyCharBudget(nearest, maxChars);

        if (budgeted.size() < nearest.size()) {
            log.debug("RAG retrieval: char budget {} kept {}/{} chunks", maxChars, budgeted.size(), nearest.size());
        }
        return new RetrievalResult(queryText, budgeted, buildContext(budgeted));
    }

    static List<ScoredChunk> applyCharBudget(List<ScoredChunk> ranked, int maxChars) {
        if (maxChars <= 0 || ranked.isEmpty()) {
            return ranked;
        }
        List<ScoredChunk> kept = new ArrayList<>();
        int total = 0;
        for (ScoredChunk candidate : ranked) {
            int length = candidate.chunk().length();
            if (!kept.isEmpty() && total + length > maxChars) {
                break;
            }
            kept.add(candidate);
            total += length;
        }
        return List.copyOf(kept);
    }

    /**
     * Formats chunks as numbered context blocks:
     *
     *   [Context 1] (chunk 12, score=0.873)
     *   chunk text...
     */
    public static String buildContext(List<ScoredChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            ScoredChunk sc = chunks.get(i);
            if (i > 0) {
                sb.append("\n\n");
            }
            sb.append("[Context ").append(i + 1).append("] (chunk ").append(sc.chunk().index())
                    .append(", score=").append(String.format(Locale.US, "%.3f", sc.score())).append(")\n")
                    .append(sc.chunk().text());
        }
        return sb.toString();
    }
}
