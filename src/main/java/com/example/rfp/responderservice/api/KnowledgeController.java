package com.example.rfp.responderservice.api;

import com.example.rfp.responderservice.dto.KnowledgeEntryResponse;
import com.example.rfp.responderservice.service.IngestService;
import com.example.rfp.responderservice.service.KnowledgeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.NoSuchElementException;

@Slf4j
@RestController
@RequestMapping("/api/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final IngestService ingestService;
    private final KnowledgeStore knowledgeStore;

    @PostMapping(consumes = "multipart/form-data")
    public ResponseEntity<KnowledgeEntryResponse> upload(@RequestParam("file") MultipartFile file) throws IOException {
        var entry = ingestService.ingestFile(file.getOriginalFilename(), file.getBytes(),
                p -> log.debug("[{}] {}", p.stage(), p.message()));
        return ResponseEntity.status(HttpStatus.CREATED).body(KnowledgeEntryResponse.from(entry));
    }

    @GetMapping
    public List<KnowledgeEntryResponse> list() {
        return knowledgeStore.listEntries().stream().map(KnowledgeEntryResponse::from).toList();
    }

    @GetMapping("/{id}")
    public KnowledgeEntryResponse get(@PathVariable String id) {
        return knowledgeStore.findEntry(id)
                .map(KnowledgeEntryResponse::from)
                .orElseThrow(() -> new NoSuchElementException("No knowledgebase entry with id " + id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        knowledgeStore.delete(id);
        return ResponseEntity.noContent().build();
    }
}
