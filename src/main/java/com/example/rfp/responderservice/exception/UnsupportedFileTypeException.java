package com.example.rfp.responderservice.exception;

public class UnsupportedFileTypeException extends RfpResponderException {

    public UnsupportedFileTypeException(String fileName) {
        super("File type not supported: " + fileName + ". Please upload a PDF, DOCX or TXT file.");
    }
}
