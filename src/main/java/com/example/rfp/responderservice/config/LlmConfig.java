// src/main/java/com/example/rfp/responderservice/config/LlmConfig.java
package com.example.rfp.responderservice.config;

import com.example.rfp.responderservice.ai.AiProvider;
import com.example.rfp.responderservice.ai.LangChain4jAiProvider;
import dev.langchain4j.model.azure.AzureOpenAiChatModel;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    @Bean
    @ConditionalOnExpression("'${app.ai.api-key:}' != ''")
    ChatLanguageModel chatModel(AiProperties props) {
        if (props.isAzure()) {
            return AzureOpenAiChatModel.builder()
                    .endpoint(props.getEndpoint())
                    .apiKey(props.getApiKey())
                    .deploymentName(props.getCompletionModel())
                    .temperature(props.getTemperature())
                    .timeout(props.getTimeout())
                    .build();
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(props.getApiKey())
                .modelName(props.getCompletionModel())
                .temperature(props.getTemperature())
                .timeout(props.getTimeout());
        if (props.getEndpoint() != null && !props.getEndpoint().isBlank()) {
            builder.baseUrl(props.getEndpoint());
        }
        return builder.build();
    }

    // Models are absent when no key is configured; the provider then reports itself as unconfigured.
    @Bean
    AiProvider aiProvider(ObjectProvider<ChatLanguageModel> chatModel,
                          ObjectProvider<EmbeddingModel> embeddingModel) {
        return new LangChain4jAiProvider(chatModel.getIfAvailable(), embeddingModel.getIfAvailable());
    }
}
