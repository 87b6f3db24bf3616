package com.example.rfp.responderservice.ai;

/**
 * Turns text into a fixed-length vector. Implementations report every failure as
 * {@link com.example.rfp.responderservice.exception.EmbeddingUnavailableException}.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    float[] embed(String text);
}
