package com.example.rfp.responderservice.repo;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, byte[]> values = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = values.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void set(String key, byte[] value) {
        values.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }
}
