package com.example.rfp.responderservice.model;

public record SourcedChunk(Chunk chunk, String sourceFileName) {}
