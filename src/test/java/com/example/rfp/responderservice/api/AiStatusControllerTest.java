package com.example.rfp.responderservice.api;

import com.example.rfp.responderservice.ai.AiProvider;
import com.example.rfp.responderservice.ai.LangChain4jAiProvider;
import com.example.rfp.responderservice.service.KnowledgeStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AiStatusControllerTest {

    private final KnowledgeStore store = mock(KnowledgeStore.class);

    @Test
    void reportsUnconfiguredProviderAndReembeddingFlag() {
        when(store.requiresReembedding()).thenReturn(true);

        AiStatusController controller = new AiStatusController(new LangChain4jAiProvider(null, null), store);

        assertThat(controller.status())
                .containsEntry("configured", false)
                .containsEntry("connected", false)
                .containsEntry("requiresReembedding", true);
    }

    @Test
    void configuredKeyThatCannotConnectIsReportedSeparately() {
        AiProvider provider = mock(AiProvider.class);
        when(provider.isConfigured()).thenReturn(true);
        when(provider.testConnection()).thenReturn(false);

        assertThat(new AiStatusController(provider, store).status())
                .containsEntry("configured", true)
                .containsEntry("connected", false);
    }

    @Test
    void reachableProviderIsConnected() {
        AiProvider provider = mock(AiProvider.class);
        when(provider.isConfigured()).thenReturn(true);
        when(provider.testConnection()).thenReturn(true);

        assertThat(new AiStatusController(provider, store).status()).containsEntry("connected", true);
    }
}
