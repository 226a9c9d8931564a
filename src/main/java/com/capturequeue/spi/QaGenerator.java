package com.capturequeue.spi;

import com.capturequeue.core.ProcessingFailure;
import com.capturequeue.core.QuestionAnswer;

import java.util.List;

/**
 * Generates question/answer pairs from markdown. An empty list is a valid result.
 */
public interface QaGenerator {

    List<QuestionAnswer> generatePairs(String markdown) throws ProcessingFailure;
}
