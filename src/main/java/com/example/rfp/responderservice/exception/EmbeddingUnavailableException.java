package com.example.rfp.responderservice.exception;

/**
 * The embedding provider could not produce a vector (transport, auth, model or timeout error).
 */
public class EmbeddingUnavailableException extends RfpResponderException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
