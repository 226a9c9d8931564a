package com.capturequeue.spi;

import com.capturequeue.core.ProcessingFailure;

import java.util.List;

/**
 * Computes one embedding vector per input text, in input order.
 */
public interface EmbeddingProvider {

    List<float[]> embed(List<String> texts) throws ProcessingFailure;
}
