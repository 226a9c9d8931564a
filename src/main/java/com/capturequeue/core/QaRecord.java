package com.capturequeue.core;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A stored question/answer pair with its three embedding vectors
 * (question, answer, and the combined "Q: ...\nA: ..." text).
 */
public class QaRecord {
    private final String id;
    private final String itemId;
    private final String question;
    private final String answer;
    private final float[] embeddingQuestion;
    private final float[] embeddingAnswer;
    private final float[] embeddingBoth;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public QaRecord(String id, String itemId, String question, String answer,
                    float[] embeddingQuestion, float[] embeddingAnswer, float[] embeddingBoth,
                    LocalDateTime createdAt, LocalDateTime updatedAt) {
        this.id = id;
        this.itemId = itemId;
        this.question = question;
        this.answer = answer;
        this.embeddingQuestion = embeddingQuestion;
        this.embeddingAnswer = embeddingAnswer;
        this.embeddingBoth = embeddingBoth;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    /**
     * Create a fresh record for a generated pair.
     */
    public static QaRecord of(String itemId, QuestionAnswer pair,
                              float[] embeddingQuestion, float[] embeddingAnswer, float[] embeddingBoth) {
        LocalDateTime now = LocalDateTime.now();
        return new QaRecord(UUID.randomUUID().toString(), itemId, pair.getQuestion(), pair.getAnswer(),
                embeddingQuestion, embeddingAnswer, embeddingBoth, now, now);
    }

    public String getId() { return id; }
    public String getItemId() { return itemId; }
    public String getQuestion() { return question; }
    public String getAnswer() { return answer; }
    public float[] getEmbeddingQuestion() { return embeddingQuestion; }
    public float[] getEmbeddingAnswer() { return embeddingAnswer; }
    public float[] getEmbeddingBoth() { return embeddingBoth; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "QaRecord{id='" + id + "', itemId='" + itemId + "', question='" + question + "'}";
    }
}
