package com.example.rfp.responderservice.service;

import com.example.rfp.responderservice.ai.EmbeddingProvider;
import com.example.rfp.responderservice.exception.EmbeddingUnavailableException;
import com.example.rfp.responderservice.exception.StorageException;
import com.example.rfp.responderservice.model.Chunk;
import com.example.rfp.responderservice.model.KnowledgeEntry;
import com.example.rfp.responderservice.model.ProcessingProgress;
import com.example.rfp.responderservice.model.ProcessingStatus;
import com.example.rfp.responderservice.model.SourcedChunk;
import com.example.rfp.responderservice.repo.KeyValueStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Owns the ingested reference documents and their chunk vectors.
 *
 * <p>Writers (ingest, delete) are serialized by a write lock held only for the insert and
 * persist step; all remote embedding calls happen before it is taken, so readers never see a
 * partially built entry. Readers copy a snapshot under the read lock.
 */
@Slf4j
@Service
public class KnowledgeStore {

    static final String STORAGE_KEY = "knowledgebase";
    static final int TOTAL_STEPS = 5;

    private static final TypeReference<List<KnowledgeEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;
    private final TextChunker chunker;
    private final Clock clock;
    private final int documentEmbeddingChars;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, KnowledgeEntry> entries = new LinkedHashMap<>();
    private volatile boolean loaded;
    private volatile boolean requiresReembedding;

    public KnowledgeStore(KeyValueStore keyValueStore,
                          ObjectMapper objectMapper,
                          TextChunker chunker,
                          Clock clock,
                          @Value("${app.knowledge.document-embedding-chars:8000}") int documentEmbeddingChars) {
        this.keyValueStore = keyValueStore;
        this.objectMapper = objectMapper;
        this.chunker = chunker;
        this.clock = clock;
        this.documentEmbeddingChars = documentEmbeddingChars;
    }

    /**
     * Embeds and stores one document. Nothing is recorded unless every embedding call succeeds.
     *
     * @throws EmbeddingUnavailableException if the document or any chunk cannot be embedded
     * @throws StorageException if the updated store cannot be persisted
     */
    public KnowledgeEntry ingest(String fileName,
                                 String rawText,
                                 long sizeBytes,
                                 EmbeddingProvider embedder,
                                 Consumer<ProcessingProgress> progress) {
        String text = rawText == null ? "" : rawText;
        String entryId = UUID.randomUUID().toString();

        progress.accept(ProcessingProgress.inProgress("Generating Embeddings", 2, TOTAL_STEPS,
                "Creating document embedding..."));
        String head = text.length() > documentEmbeddingChars ? text.substring(0, documentEmbeddingChars) : text;
        float[] documentEmbedding = embed(embedder, head);

        List<TextChunker.ChunkSpan> spans = chunker.chunkWithOffsets(text);
        progress.accept(ProcessingProgress.inProgress("Indexing", 3, TOTAL_STEPS,
                "Generating embeddings for " + spans.size() + " chunks..."));

        List<Chunk> chunks = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            progress.accept(ProcessingProgress.inProgress("Indexing", 3, TOTAL_STEPS,
                    "Processing chunk " + (i + 1) + " of " + spans.size() + "..."));
            TextChunker.ChunkSpan span = spans.get(i);
            chunks.add(Chunk.builder()
                    .id(UUID.randomUUID().toString())
                    .entryId(entryId)
                    .index(i)
                    .text(span.text())
                    .embedding(embed(embedder, span.text()))
                    .startPosition(span.start())
                    .endPosition(span.end())
                    .build());
        }

        progress.accept(ProcessingProgress.inProgress("Finalizing", 4, TOTAL_STEPS,
                "Saving to knowledgebase..."));
        KnowledgeEntry entry = KnowledgeEntry.builder()
                .id(entryId)
                .fileName(fileName)
                .originalText(text)
                .documentEmbedding(documentEmbedding)
                .chunks(chunks)
                .createdAt(clock.instant())
                .sizeBytes(sizeBytes)
                .build();

        ensureLoaded();
        lock.writeLock().lock();
        try {
            entries.put(entryId, entry);
            try {
                persist();
            } catch (StorageException e) {
                entries.remove(entryId);
                throw e;
            }
        } finally {
            lock.writeLock().unlock();
        }

        log.info("Added {} with {} chunks to knowledgebase", fileName, chunks.size());
        progress.accept(ProcessingProgress.completed(TOTAL_STEPS,
                "Added " + fileName + " with " + chunks.size() + " chunks to knowledgebase."));
        return entry;
    }

    public List<KnowledgeEntry> listEntries() {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<KnowledgeEntry> findEntry(String entryId) {
        ensureLoaded();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(entryId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Removes an entry and its chunks. Unknown ids are ignored.
     */
    public void delete(String entryId) {
        ensureLoaded();
        lock.writeLock().lock();
        try {
            if (!entries.containsKey(entryId)) {
                return;
            }
            Map<String, KnowledgeEntry> before = new LinkedHashMap<>(entries);
            entries.remove(entryId);
            try {
                persist();
            } catch (StorageException e) {
                entries.clear();
                entries.putAll(before);
                throw e;
            }
            if (entries.isEmpty()) {
                requiresReembedding = false;
            }
            log.info("Deleted knowledgebase entry {}", entryId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Every chunk in the store paired with its source file name, in entry then chunk order.
     */
    public List<SourcedChunk> allChunksWithSource() {
        ensureLoaded();
        lock.readLock().lock();
        try {
            List<SourcedChunk> out = new ArrayList<>();
            for (KnowledgeEntry e : entries.values()) {
                for (Chunk c : e.getChunks()) {
                    out.add(new SourcedChunk(c, e.getFileName()));
                }
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void markRequiresReembedding() {
        if (!requiresReembedding) {
            log.error("Stored chunk embeddings no longer match the embedding model; re-ingest the knowledgebase");
        }
        requiresReembedding = true;
    }

    public boolean requiresReembedding() {
        return requiresReembedding;
    }

    private static float[] embed(EmbeddingProvider embedder, String text) {
        float[] vector;
        try {
            vector = embedder.embed(text);
        } catch (EmbeddingUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding request failed: " + e.getMessage(), e);
        }
        if (vector == null) {
            throw new EmbeddingUnavailableException("Embedding provider returned no vector");
        }
        return vector;
    }

    private void ensureLoaded() {
        if (loaded) {
            return;
        }
        lock.writeLock().lock();
        try {
            if (loaded) {
                return;
            }
            Optional<byte[]> stored = keyValueStore.get(STORAGE_KEY);
            if (stored.isPresent()) {
                try {
                    for (KnowledgeEntry e : objectMapper.readValue(stored.get(), ENTRY_LIST)) {
                        entries.put(e.getId(), e);
                    }
                    log.info("Loaded {} knowledgebase entries", entries.size());
                } catch (IOException e) {
                    log.warn("Stored knowledgebase is unreadable, starting empty: {}", e.getMessage());
                    entries.clear();
                }
            }
            loaded = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void persist() {
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(new ArrayList<>(entries.values()));
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize knowledgebase", e);
        }
        try {
            keyValueStore.set(STORAGE_KEY, bytes);
        } catch (StorageException e) {
            log.error("Failed to save knowledgebase: {}", e.getMessage());
            throw e;
        }
    }
}
