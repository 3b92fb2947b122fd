package com.example.hipagent.model;

import com.example.hipagent.util.VectorMath;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Arrays;

/**
 * A contiguous slice of the reference corpus together with its embedding.
 *
 * @param index       sequence number in the corpus, stable across builds of the same text
 * @param startOffset character offset of the slice in the normalized corpus text
 * @param text        chunk text
 * @param embedding   embedding vector (copied on the way in and out)
 */
public record Chunk(
        int index,
        int startOffset,
        String text,
        float[] embedding
) {
    public Chunk {
        if (text == null) {
            throw new IllegalArgumentException("Chunk text must not be null");
        }
        if (embedding == null || embedding.length == 0) {
            throw new IllegalArgumentException("Chunk " + index + " has no embedding");
        }
        embedding = embedding.clone();
    }

    @JsonIgnore
    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    public int length() {
        return text.length();
    }

    /** Cosine similarity against a query vector, without copying the stored vector. */
    public double similarityTo(float[] query) {
        return VectorMath.cosineSimilarity(embedding, query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Chunk other)) {
            return false;
        }
        return index == other.index
                && startOffset == other.startOffset
                && text.equals(other.text)
                && Arrays.equals(embedding, other.embedding);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(index);
        result = 31 * result + Integer.hashCode(startOffset);
        result = 31 * result + text.hashCode();
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Chunk[index=" + index + ", startOffset=" + startOffset + ", length=" + text.length()
                + ", dimension=" + embedding.length + "]";
    }
}
