package com.example.rfp.responderservice.repo;

import com.example.rfp.responderservice.exception.StorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.Optional;

/**
 * Stores each key as one document in a single collection. Values are opaque bytes.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoKeyValueStore implements KeyValueStore {

    private final MongoTemplate mongoTemplate;
    private final String collection;

    @Override
    public Optional<byte[]> get(String key) {
        try {
            KeyValueRecord record = mongoTemplate.findById(key, KeyValueRecord.class, collection);
            return Optional.ofNullable(record).map(KeyValueRecord::getValue);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read key " + key + " from " + collection, e);
        }
    }

    @Override
    public void set(String key, byte[] value) {
        try {
            mongoTemplate.save(KeyValueRecord.builder()
                    .key(key)
                    .value(value)
                    .updatedAt(Instant.now())
                    .build(), collection);
            log.debug("Stored {} bytes under {}", value.length, key);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to write key " + key + " to " + collection, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            mongoTemplate.remove(Query.query(Criteria.where("_id").is(key)), collection);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to delete key " + key + " from " + collection, e);
        }
    }
}
