// src/main/java/com/example/rfp/responderservice/service/IngestService.java
package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.ai.EmbeddingProvider;
import com.example.rfp.responderservice.model.DocumentKind;
import com.example.rfp.responderservice.model.KnowledgeEntry;
import com.example.rfp.responderservice.model.ProcessingProgress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Consumer;

/**
 * Uploaded reference file -> extracted text -> {@link KnowledgeStore} entry.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestService {

    private final TextExtractionService textExtractionService;
    private final KnowledgeStore knowledgeStore;
    private final EmbeddingProvider embeddingProvider;

    public KnowledgeEntry ingestFile(String fileName, byte[] content, Consumer<ProcessingProgress> progress) {
        DocumentKind kind = DocumentKind.fromFileName(fileName);

        progress.accept(ProcessingProgress.inProgress("Uploading", 0, KnowledgeStore.TOTAL_STEPS,
                "File " + fileName + " uploaded successfully."));
        progress.accept(ProcessingProgress.inProgress("Extracting Text", 1, KnowledgeStore.TOTAL_STEPS,
                "Processing " + fileName + "..."));
        String text = textExtractionService.extractText(content, kind);
        if (text.isBlank()) {
            log.warn("No text extracted from {}", fileName);
        }

        return knowledgeStore.ingest(fileName, text, content.length, embeddingProvider, progress);
    }
}
