package com.example.rfp.responderservice;

import com.example.rfp.responderservice.ai.AiProvider;
import com.example.rfp.responderservice.repo.InMemoryKeyValueStore;
import com.example.rfp.responderservice.repo.KeyValueStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {"app.store.type=memory", "app.ai.api-key="})
class RfpResponderApplicationTest {

    @Autowired
    private AiProvider aiProvider;

    @Autowired
    private KeyValueStore keyValueStore;

    @Test
    void contextLoadsWithoutAiKeyOrDatabase() {
        assertThat(aiProvider.isConfigured()).isFalse();
        assertThat(keyValueStore).isInstanceOf(InMemoryKeyValueStore.class);
    }
}
