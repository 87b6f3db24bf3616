package com.example.rfp.responderservice.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One ingested reference document with its chunk vectors. Immutable: the chunk list is an
 * unmodifiable copy and the document vector is copied on the way in and out.
 */
@Value
public class KnowledgeEntry {
    String id;
    String fileName;
    String originalText;
    float[] documentEmbedding;
    List<Chunk> chunks;
    Instant createdAt;
    long sizeBytes;

    @Builder
    @Jacksonized
    KnowledgeEntry(String id, String fileName, String originalText, float[] documentEmbedding,
                   List<Chunk> chunks, Instant createdAt, long sizeBytes) {
        this.id = id;
        this.fileName = fileName;
        this.originalText = originalText;
        this.documentEmbedding = documentEmbedding != null ? documentEmbedding.clone() : null;
        this.chunks = chunks != null ? List.copyOf(chunks) : List.of();
        this.createdAt = createdAt;
        this.sizeBytes = sizeBytes;
    }

    public float[] getDocumentEmbedding() {
        return documentEmbedding != null ? documentEmbedding.clone() : null;
    }
}
