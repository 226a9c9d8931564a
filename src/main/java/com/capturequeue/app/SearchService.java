package com.capturequeue.app;

import com.capturequeue.core.Item;
import com.capturequeue.core.ProcessingFailure;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.db.ItemRepository;
import com.capturequeue.spi.EmbeddingProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Semantic search over the Q&amp;A pairs derived from completed items.
 *
 * <p>The query is embedded once and compared by cosine similarity against each
 * pair's question vector and its combined question-and-answer vector. The
 * {@code topK} best matches are grouped by item; items are ranked by their
 * best match.</p>
 *
 * <p>Vectors whose dimension differs from the query's are skipped.</p>
 */
public class SearchService {
    private static final Logger logger = Logger.getLogger(SearchService.class.getName());

    private final ItemRepository itemRepository;
    private final EmbeddingProvider embeddingProvider;

    public SearchService(ItemRepository itemRepository, EmbeddingProvider embeddingProvider) {
        this.itemRepository = itemRepository;
        this.embeddingProvider = embeddingProvider;
    }

    /**
     * Embed the query text and search with its vector.
     *
     * @throws ProcessingFailure if the query could not be embedded
     */
    public List<SearchResult> search(String query, int topK) throws ProcessingFailure, StorageFailure {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        List<float[]> vectors = embeddingProvider.embed(List.of(query.trim()));
        if (vectors == null || vectors.size() != 1 || vectors.get(0) == null) {
            throw new ProcessingFailure(ProcessingFailure.Stage.EMBED, "Failed to embed search query");
        }
        return searchByVector(vectors.get(0), topK);
    }

    public List<SearchResult> searchByVector(float[] queryVector, int topK) throws StorageFailure {
        if (topK < 1) {
            throw new IllegalArgumentException("topK must be >= 1: " + topK);
        }

        List<SearchResult.ScoredPair> scored = new ArrayList<>();
        int skipped = 0;
        for (QaRecord pair : itemRepository.getAllQaPairs()) {
            double best = Double.NEGATIVE_INFINITY;
            for (float[] candidate : new float[][] {pair.getEmbeddingQuestion(), pair.getEmbeddingBoth()}) {
                if (candidate == null || candidate.length != queryVector.length) {
                    skipped++;
                    continue;
                }
                best = Math.max(best, cosineSimilarity(queryVector, candidate));
            }
            if (best != Double.NEGATIVE_INFINITY) {
                scored.add(new SearchResult.ScoredPair(pair, best));
            }
        }
        if (skipped > 0) {
            logger.fine("Skipped " + skipped + " embeddings with missing or mismatched dimensions");
        }

        scored.sort(Comparator.comparingDouble(SearchResult.ScoredPair::getScore).reversed());
        List<SearchResult.ScoredPair> top = scored.subList(0, Math.min(topK, scored.size()));

        Map<String, List<SearchResult.ScoredPair>> byItem = new LinkedHashMap<>();
        for (SearchResult.ScoredPair match : top) {
            byItem.computeIfAbsent(match.getPair().getItemId(), id -> new ArrayList<>()).add(match);
        }

        List<SearchResult> results = new ArrayList<>(byItem.size());
        for (Map.Entry<String, List<SearchResult.ScoredPair>> entry : byItem.entrySet()) {
            Item item = itemRepository.getItemById(entry.getKey());
            if (item == null) {
                continue;
            }
            List<SearchResult.ScoredPair> matches = entry.getValue();
            results.add(new SearchResult(item.getId(), item.getDisplayName(), item.getUrl(),
                    matches.get(0).getScore(), matches));
        }
        logger.fine("Search matched " + results.size() + " items from " + scored.size() + " pairs");
        return results;
    }

    /**
     * @return cosine similarity of two vectors of equal length, or 0 when either has zero magnitude
     * @throws IllegalArgumentException if the lengths differ
     */
    static double cosineSimilarity(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vectors must have the same length (got " + a.length + " and " + b.length + ")");
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double magnitude = Math.sqrt(normA * normB);
        return magnitude == 0 ? 0 : dot / magnitude;
    }
}
