package com.example.rfp.responderservice.model;

public record RetrievedMatch(String chunkId, String chunkText, double score, String sourceFileName) {}
