package com.example.rfp.responderservice.exception;

public class TextExtractionException extends RfpResponderException {

    public TextExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
