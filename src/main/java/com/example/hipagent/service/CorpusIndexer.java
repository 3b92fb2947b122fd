package com.example.hipagent.service;

import com.example.hipagent.exception.AgentConfigurationException;
import com.example.hipagent.model.Chunk;
import com.example.hipagent.repository.CorpusIndex;
import com.example.hipagent.util.TextChunker;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the in-memory {@link CorpusIndex}:
 * - normalize and chunk the corpus text
 * - embed chunks in batches
 * - when a batch fails, embed its chunks one by one so a single bad chunk only costs itself
 * - drop chunks the provider cannot embed and record why
 *
 * The build is one-off; there is no incremental update.
 */
@RequiredArgsConstructor
public class CorpusIndexer {

    private static final Logger log = LoggerFactory.getLogger(CorpusIndexer.class);

    private static final int EMBEDDING_BATCH_SIZE = 32;

    private final EmbeddingModel embeddingModel;

    /**
     * Reads a corpus resource as UTF-8.
     *
     * @throws AgentConfigurationException if the resource is missing or unreadable
     */
    public static String readCorpus(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new AgentConfigurationException("Corpus resource not found: " + resource);
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AgentConfigurationException("Could not read corpus " + resource, e);
        }
    }

    /**
     * @param corpusText   raw corpus text; empty or blank text yields an empty index
     * @param chunkSize    maximum chunk length in characters
     * @param chunkOverlap characters shared between consecutive chunks
     * @return the index over every chunk that could be embedded
     * @throws AgentConfigurationException if the corpus has text but no chunk could be embedded,
     *                                     or the provider returns vectors of differing dimension
     */
    public CorpusIndex build(String corpusText, int chunkSize, int chunkOverlap) {
        String normalized = TextChunker.normalize(corpusText);
        List<TextChunker.Slice> slices = TextChunker.split(normalized, chunkSize, chunkOverlap);
        if (slices.isEmpty()) {
            log.info("Corpus indexing: corpus is empty, index will be empty");
            return CorpusIndex.empty();
        }
        log.info("Corpus indexing: {} chunks (chunkSize={}, overlap={}) from {} characters",
                slices.size(), chunkSize, chunkOverlap, normalized.length());

        List<Chunk> chunks = new ArrayList<>(slices.size());
        List<CorpusIndex.SkippedChunk> skipped = new ArrayList<>();
        int[] dimension = {0};

        for (int from = 0; from < slices.size(); from += EMBEDDING_BATCH_SIZE) {
            List<TextChunker.Slice> batch = slices.subList(from, Math.min(from + EMBEDDING_BATCH_SIZE, slices.size()));
            List<float[]> vectors = embedBatch(batch);
            for (int i = 0; i < batch.size(); i++) {
                int index = from + i;
                TextChunker.Slice slice = batch.get(i);
                float[] vector;
                if (vectors != null) {
                    vector = vectors.get(i);
                    if (vector == null || vector.length == 0) {
                        skipped.add(new CorpusIndex.SkippedChunk(index, "empty embedding"));
                        continue;
                    }
                } else {
                    vector = embedSingle(index, slice, skipped);
                    if (vector == null) {
                        continue;
                    }
                }
                checkDimension(dimension, vector, index);
                chunks.add(new Chunk(index, slice.start(), slice.text(), vector));
            }
            log.debug("Corpus indexing: embedded {}/{} chunks", Math.min(from + batch.size(), slices.size()), slices.size());
        }

        if (chunks.isEmpty()) {
            throw new AgentConfigurationException(
                    "None of the " + slices.size() + " corpus chunks could be embedded");
        }
        if (!skipped.isEmpty()) {
            log.warn("Corpus indexing: {} of {} chunks skipped, first: chunk {} ({})",
                    skipped.size(), slices.size(), skipped.get(0).index(), skipped.get(0).reason());
        }
        log.info("Corpus indexing: index ready with {} chunks, dimension={}", chunks.size(), dimension[0]);
        return new CorpusIndex(chunks, skipped);
    }

    /**
     * @return one vector per slice, or null if the batch call failed or returned the wrong count
     */
    private List<float[]> embedBatch(List<TextChunker.Slice> batch) {
        try {
            List<float[]> vectors = embeddingModel.embed(batch.stream().map(TextChunker.Slice::text).toList());
            if (vectors == null || vectors.size() != batch.size()) {
                log.warn("Corpus indexing: batch returned {} vectors for {} chunks, embedding individually",
                        vectors == null ? "no" : vectors.size(), batch.size());
                return null;
            }
            return vectors;
        } catch (RuntimeException e) {
            log.warn("Corpus indexing: batch embedding failed ({}), embedding individually", e.toString());
            return null;
        }
    }

    private float[] embedSingle(int index, TextChunker.Slice slice, List<CorpusIndex.SkippedChunk> skipped) {
        try {
            float[] vector = embeddingModel.embed(slice.text());
            if (vector == null || vector.length == 0) {
                skipped.add(new CorpusIndex.SkippedChunk(index, "empty embedding"));
                return null;
            }
            return vector;
        } catch (RuntimeException e) {
            log.warn("Corpus indexing: chunk {} could not be embedded: {}", index, e.toString());
            skipped.add(new CorpusIndex.SkippedChunk(index, e.toString()));
            return null;
        }
    }

    private static void checkDimension(int[] dimension, float[] vector, int index) {
        if (dimension[0] == 0) {
            dimension[0] = vector.length;
        } else if (vector.length != dimension[0]) {
            throw new AgentConfigurationException("Embedding provider returned dimension " + vector.length
                    + " for chunk " + index + " after returning " + dimension[0]);
        }
    }
}
