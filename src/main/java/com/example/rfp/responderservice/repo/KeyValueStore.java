package com.example.rfp.responderservice.repo;

import java.util.Optional;

/**
 * Durable byte storage addressed by key. Failures surface as
 * {@link com.example.rfp.responderservice.exception.StorageException}.
 */
public interface KeyValueStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    void delete(String key);
}
