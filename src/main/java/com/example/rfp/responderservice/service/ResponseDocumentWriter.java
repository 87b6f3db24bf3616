package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.model.ResponseDocument;

public interface ResponseDocumentWriter {

    String contentType();

    String fileExtension();

    byte[] write(ResponseDocument document);
}
