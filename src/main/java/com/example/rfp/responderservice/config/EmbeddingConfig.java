// src/main/java/com/example/rfp/responderservice/config/EmbeddingConfig.java
package com.example.rfp.responderservice.config;

import dev.langchain4j.model.azure.AzureOpenAiEmbeddingModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EmbeddingConfig {

    @Bean
    @ConditionalOnExpression("'${app.ai.api-key:}' != ''")
    EmbeddingModel embeddingModel(AiProperties props) {
        if (props.isAzure()) {
            return AzureOpenAiEmbeddingModel.builder()
                    .endpoint(props.getEndpoint())
                    .apiKey(props.getApiKey())
                    .deploymentName(props.getEmbeddingModel())
                    .timeout(props.getTimeout())
                    .build();
        }
        var builder = OpenAiEmbeddingModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getEmbeddingModel())
                .timeout(props.getTimeout());
        if (props.getEndpoint() != null && !props.getEndpoint().isBlank()) {
            builder.baseUrl(props.getEndpoint());
        }
        return builder.build();
    }
}
