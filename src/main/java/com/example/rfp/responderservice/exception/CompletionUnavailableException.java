package com.example.rfp.responderservice.exception;

/**
 * The completion provider could not produce text (transport, auth, model or timeout error).
 */
public class CompletionUnavailableException extends RfpResponderException {

    public CompletionUnavailableException(String message) {
        super(message);
    }

    public CompletionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
