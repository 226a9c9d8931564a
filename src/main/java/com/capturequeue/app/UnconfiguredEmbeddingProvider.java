package com.capturequeue.app;

import com.capturequeue.core.ProcessingFailure;
import com.capturequeue.spi.EmbeddingProvider;

import java.util.List;

/**
 * Stand-in used when no embedding service is wired. It only pairs with a
 * {@link com.capturequeue.spi.QaGenerator} that returns no pairs: any non-empty
 * batch fails, so every item with pairs would exhaust its retries and end in ERROR.
 */
class UnconfiguredEmbeddingProvider implements EmbeddingProvider {

    @Override
    public List<float[]> embed(List<String> texts) throws ProcessingFailure {
        if (texts.isEmpty()) {
            return List.of();
        }
        throw new ProcessingFailure(ProcessingFailure.Stage.EMBED, "No embedding provider configured for "
                + texts.size() + " texts; wire an EmbeddingProvider together with the QaGenerator");
    }
}
