package com.example.rfp.responderservice.exception;

/**
 * Base type for failures raised by the responder pipeline.
 */
public class RfpResponderException extends RuntimeException {

    public RfpResponderException(String message) {
        super(message);
    }

    public RfpResponderException(String message, Throwable cause) {
        super(message, cause);
    }
}
