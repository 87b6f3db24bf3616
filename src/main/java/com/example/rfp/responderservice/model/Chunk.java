// src/main/java/com/example/rfp/responderservice/model/Chunk.java
package com.example.rfp.responderservice.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
public class Chunk {
    String id;
    String entryId;          // owning KnowledgeEntry
    int index;               // position within the entry
    String text;             // trimmed chunk content
    float[] embedding;       // vector embedding, copied in and out
    int startPosition;       // offset of the first sentence in the entry text
    int endPosition;         // offset just past the last sentence

    @Builder
    @Jacksonized
    Chunk(String id, String entryId, int index, String text, float[] embedding, int startPosition, int endPosition) {
        this.id = id;
        this.entryId = entryId;
        this.index = index;
        this.text = text;
        this.embedding = embedding != null ? embedding.clone() : null;
        this.startPosition = startPosition;
        this.endPosition = endPosition;
    }

    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }
}
