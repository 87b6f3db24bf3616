package com.example.rfp.responderservice.api;

import com.example.rfp.responderservice.ai.AiProvider;
import com.example.rfp.responderservice.service.KnowledgeStore;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AiStatusController {

    private final AiProvider aiProvider;
    private final KnowledgeStore knowledgeStore;

    @GetMapping("/api/ai/status")
    public Map<String, Object> status() {
        return Map.of(
                "configured", aiProvider.isConfigured(),
                "connected", aiProvider.testConnection(),
                "requiresReembedding", knowledgeStore.requiresReembedding());
    }
}
