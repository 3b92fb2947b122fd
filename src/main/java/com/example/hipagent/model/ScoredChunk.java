package com.example.hipagent.model;

/**
 * A chunk of the index paired with its similarity to a query.
 * The chunk is the index's own instance, never a copy.
 */
public record ScoredChunk(
        Chunk chunk,
        double score
) {
}
