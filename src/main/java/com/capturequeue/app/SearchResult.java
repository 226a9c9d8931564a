package com.capturequeue.app;

import com.capturequeue.core.QaRecord;

import java.util.List;

/**
 * One item matching a search, with the Q&amp;A pairs that matched it, best first.
 */
public class SearchResult {
    private final String itemId;
    private final String title;
    private final String url;
    private final double score;
    private final List<ScoredPair> pairs;

    public SearchResult(String itemId, String title, String url, double score, List<ScoredPair> pairs) {
        this.itemId = itemId;
        this.title = title;
        this.url = url;
        this.score = score;
        this.pairs = List.copyOf(pairs);
    }

    public String getItemId() { return itemId; }
    public String getTitle() { return title; }
    public String getUrl() { return url; }

    /**
     * @return the best score among the matching pairs
     */
    public double getScore() { return score; }

    public List<ScoredPair> getPairs() { return pairs; }

    public QaRecord getBestPair() {
        return pairs.get(0).getPair();
    }

    @Override
    public String toString() {
        return String.format("SearchResult{itemId='%s', score=%.4f, pairs=%d}", itemId, score, pairs.size());
    }

    /**
     * A stored pair and its similarity to the query.
     */
    public static class ScoredPair {
        private final QaRecord pair;
        private final double score;

        public ScoredPair(QaRecord pair, double score) {
            this.pair = pair;
            this.score = score;
        }

        public QaRecord getPair() { return pair; }
        public double getScore() { return score; }
    }
}
