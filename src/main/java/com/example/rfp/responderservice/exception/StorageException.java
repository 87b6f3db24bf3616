package com.example.rfp.responderservice.exception;

public class StorageException extends RfpResponderException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
