package com.example.rfp.responderservice.config;

import com.example.rfp.responderservice.repo.InMemoryKeyValueStore;
import com.example.rfp.responderservice.repo.KeyValueStore;
import com.example.rfp.responderservice.repo.MongoKeyValueStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

@Configuration
public class StoreConfig {

    @Bean
    @ConditionalOnProperty(name = "app.store.type", havingValue = "mongo", matchIfMissing = true)
    KeyValueStore mongoKeyValueStore(MongoTemplate mongoTemplate,
                                     @Value("${app.store.collection:kv_store}") String collection) {
        return new MongoKeyValueStore(mongoTemplate, collection);
    }

    @Bean
    @ConditionalOnProperty(name = "app.store.type", havingValue = "memory")
    KeyValueStore inMemoryKeyValueStore() {
        return new InMemoryKeyValueStore();
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }
}
