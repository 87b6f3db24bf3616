package com.example.rfp.responderservice.dto;

import com.example.rfp.responderservice.model.KnowledgeEntry;

import java.time.Instant;

public record KnowledgeEntryResponse(
        String id,
        String fileName,
        int chunkCount,
        long sizeBytes,
        Instant createdAt
) {
    public static KnowledgeEntryResponse from(KnowledgeEntry e) {
        return new KnowledgeEntryResponse(e.getId(), e.getFileName(), e.getChunks().size(), e.getSizeBytes(), e.getCreatedAt());
    }
}
