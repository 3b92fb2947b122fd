package com.example.hipagent.repository;

import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.model.Chunk;
import com.example.hipagent.model.ScoredChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only in-memory vector index over the corpus chunks.
 *
 * Built once before any question is answered and never modified afterwards, so concurrent
 * reads need no locking.
 */
public final class CorpusIndex {

    /** Highest score first; equal scores keep corpus order. */
    private static final Comparator<ScoredChunk> BY_SCORE_THEN_ORDER =
            Comparator.comparingDouble(ScoredChunk::score).reversed()
                    .thenComparingInt(sc -> sc.chunk().index());

    private final List<Chunk> chunks;
    private final List<SkippedChunk> skipped;
    private final int dimension;

    /**
     * @param index  sequence number of the chunk that could not be embedded
     * @param reason why the embedding provider failed for it
     */
    public record SkippedChunk(int index, String reason) {
    }

    public CorpusIndex(List<Chunk> chunks, List<SkippedChunk> skipped) {
        this.chunks = List.copyOf(chunks);
        this.skipped = skipped == null ? List.of() : List.copyOf(skipped);
        this.dimension = this.chunks.isEmpty() ? 0 : this.chunks.get(0).dimension();
        for (Chunk chunk : this.chunks) {
            if (chunk.dimension() != dimension) {
                throw new AgentConfigurationException("Chunk " + chunk.index() + " has dimension "
                        + chunk.dimension() + " but the index dimension is " + dimension);
            }
        }
    }

    public static CorpusIndex empty() {
        return new CorpusIndex(List.of(), List.of());
    }

    /**
     * Scores every chunk against the query vector by cosine similarity and returns the best
     * {@code limit} of them.
     *
     * @throws AgentConfigurationException if the query dimension differs from the index dimension
     */
    public List<ScoredChunk> findNearest(float[] queryEmbedding, int limit) {
        if (chunks.isEmpty() || limit <= 0) {
            return List.of();
        }
        if (queryEmbedding == null || queryEmbedding.length != dimension) {
            throw new AgentConfigurationException("Query embedding dimension "
                    + (queryEmbedding == null ? "null" : queryEmbedding.length)
                    + " does not match index dimension " + dimension);
        }

        List<ScoredChunk> scored = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            scored.add(new ScoredChunk(chunk, chunk.similarityTo(queryEmbedding)));
        }
        scored.sort(BY_SCORE_THEN_ORDER);
        return List.copyOf(scored.subList(0, Math.min(limit, scored.size())));
    }

    public List<Chunk> chunks() {
        return chunks;
    }

    public List<SkippedChunk> skipped() {
        return skipped;
    }

    public int dimension() {
        return dimension;
    }

    public int size() {
        return chunks.size();
    }

    public boolean isEmpty() {
        return chunks.isEmpty();
    }
}
