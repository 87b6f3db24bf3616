package com.example.rfp.responderservice.repo;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    void storesDefensiveCopies() {
        byte[] value = {1, 2, 3};
        store.set("k", value);
        value[0] = 9;

        byte[] read = store.get("k").orElseThrow();
        read[1] = 9;

        assertThat(store.get("k")).hasValueSatisfying(v -> assertThat(v).containsExactly(1, 2, 3));
    }

    @Test
    void deleteIsSafeForMissingKeys() {
        store.delete("missing");
        store.set("k", new byte[]{1});
        store.delete("k");

        assertThat(store.get("k")).isEmpty();
    }
}
