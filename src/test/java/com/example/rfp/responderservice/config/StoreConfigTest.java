package com.example.rfp.responderservice.config;

import com.example.rfp.responderservice.repo.InMemoryKeyValueStore;
import com.example.rfp.responderservice.repo.KeyValueStore;
import com.example.rfp.responderservice.repo.MongoKeyValueStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class StoreConfigTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(StoreConfig.class)
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class));

    @Test
    void mongoIsTheDefaultStore() {
        runner.run(context -> assertThat(context.getBean(KeyValueStore.class)).isInstanceOf(MongoKeyValueStore.class));
    }

    @Test
    void memoryStoreOnRequest() {
        runner.withPropertyValues("app.store.type=memory").run(context ->
                assertThat(context.getBean(KeyValueStore.class)).isInstanceOf(InMemoryKeyValueStore.class));
    }
}
