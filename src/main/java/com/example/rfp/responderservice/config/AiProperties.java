// src/main/java/com/example/rfp/responderservice/config/AiProperties.java
package com.example.rfp.responderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.ai")
public class AiProperties {

    public static final String OPENAI = "openai";
    public static final String AZURE_OPENAI = "azure-openai";

    /**
     * Either {@code openai} or {@code azure-openai}.
     */
    private String provider = OPENAI;

    /**
     * API key for the provider. Leave empty to run without an AI backend; every embedding
     * and completion call then fails and the pipeline falls back to its notices.
     */
    private String apiKey;

    /**
     * Base URL for OpenAI compatible endpoints, or the resource endpoint for Azure OpenAI.
     */
    private String endpoint;

    /**
     * Chat model name (deployment name on Azure).
     */
    private String completionModel = "gpt-4o-mini";

    /**
     * Embedding model name (deployment name on Azure).
     */
    private String embeddingModel = "text-embedding-3-small";

    private Double temperature = 0.2;

    private Duration timeout = Duration.ofSeconds(60);

    public boolean isAzure() {
        return AZURE_OPENAI.equalsIgnoreCase(provider);
    }
}
