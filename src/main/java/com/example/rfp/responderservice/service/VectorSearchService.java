// src/main/java/com/example/rfp/responderservice/service/VectorSearchService.java
package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.exception.DimensionMismatchException;
import com.example.rfp.responderservice.model.RetrievedMatch;
import com.example.rfp.responderservice.model.SourcedChunk;
import com.example.rfp.responderservice.util.VectorMath;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Brute-force cosine ranking over every chunk in the {@link KnowledgeStore}.
 */
@Service
public class VectorSearchService {

    private final KnowledgeStore knowledgeStore;
    private final int defaultTopK;

    public VectorSearchService(KnowledgeStore knowledgeStore,
                               @Value("${app.retrieval.top-k:5}") int defaultTopK) {
        this.knowledgeStore = knowledgeStore;
        this.defaultTopK = defaultTopK;
    }

    public List<RetrievedMatch> retrieve(float[] queryEmbedding) {
        return retrieve(queryEmbedding, defaultTopK);
    }

    /**
     * Top {@code topK} chunks by descending cosine score. Equal scores keep store order.
     *
     * @throws DimensionMismatchException if the query and a stored chunk differ in length; the
     *         store is flagged as needing re-embedding before the exception propagates
     */
    public List<RetrievedMatch> retrieve(float[] queryEmbedding, int topK) {
        if (topK <= 0) {
            return List.of();
        }
        List<SourcedChunk> all = knowledgeStore.allChunksWithSource();
        List<RetrievedMatch> scored = new ArrayList<>(all.size());
        try {
            for (SourcedChunk sc : all) {
                scored.add(new RetrievedMatch(
                        sc.chunk().getId(),
                        sc.chunk().getText(),
                        VectorMath.cosine(queryEmbedding, sc.chunk().getEmbedding()),
                        sc.sourceFileName()));
            }
        } catch (DimensionMismatchException e) {
            knowledgeStore.markRequiresReembedding();
            throw e;
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(RetrievedMatch::score).reversed());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }
}
