package com.example.rfp.responderservice.ai;

/**
 * Single capability seam over the model backend. Which vendor sits behind it is decided at
 * construction time and never visible to callers.
 */
public interface AiProvider extends EmbeddingProvider, CompletionProvider {

    boolean isConfigured();

    /**
     * Round trip to the embedding backend. False on any failure, including a missing key.
     */
    boolean testConnection();
}
