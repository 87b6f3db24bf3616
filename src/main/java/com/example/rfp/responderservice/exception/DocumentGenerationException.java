package com.example.rfp.responderservice.exception;

public class DocumentGenerationException extends RfpResponderException {

    public DocumentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
