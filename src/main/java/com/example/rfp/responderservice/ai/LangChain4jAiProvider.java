package com.example.rfp.responderservice.ai;

import com.example.rfp.responderservice.exception.CompletionUnavailableException;
import com.example.rfp.responderservice.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link AiProvider} backed by LangChain4j models. Either model may be null when no API key
 * is configured; calls then fail with the "not configured" reason instead of a transport error.
 */
@Slf4j
public class LangChain4jAiProvider implements AiProvider {

    static final String NOT_CONFIGURED =
            "AI service not configured. Please configure your AI provider in settings.";

    static final String CONNECTION_TEST_TEXT = "test connection";

    private final ChatLanguageModel chatModel;
    private final EmbeddingModel embeddingModel;

    public LangChain4jAiProvider(ChatLanguageModel chatModel, EmbeddingModel embeddingModel) {
        this.chatModel = chatModel;
        this.embeddingModel = embeddingModel;
        if (!isConfigured()) {
            log.warn("No AI provider configured; embeddings and completions will be unavailable");
        }
    }

    @Override
    public boolean isConfigured() {
        return chatModel != null && embeddingModel != null;
    }

    @Override
    public boolean testConnection() {
        try {
            embed(CONNECTION_TEST_TEXT);
            return true;
        } catch (EmbeddingUnavailableException e) {
            log.warn("AI connection test failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public float[] embed(String text) {
        if (embeddingModel == null) {
            throw new EmbeddingUnavailableException(NOT_CONFIGURED);
        }
        Response<Embedding> response;
        try {
            response = embeddingModel.embed(text);
        } catch (RuntimeException e) {
            throw new EmbeddingUnavailableException("Embedding request failed: " + e.getMessage(), e);
        }
        if (response == null || response.content() == null || response.content().vector() == null) {
            throw new EmbeddingUnavailableException("Embedding provider returned no vector");
        }
        return response.content().vector();
    }

    @Override
    public String complete(String prompt) {
        if (chatModel == null) {
            throw new CompletionUnavailableException(NOT_CONFIGURED);
        }
        String text;
        try {
            text = chatModel.generate(prompt);
        } catch (RuntimeException e) {
            throw new CompletionUnavailableException("Completion request failed: " + e.getMessage(), e);
        }
        return text != null ? text : "";
    }
}
