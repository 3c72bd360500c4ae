package com.starksync.common.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PrefixedKeyValueStore Tests")
class PrefixedKeyValueStoreTest {

    @Test
    @DisplayName("Should isolate namespaces sharing one engine")
    void shouldIsolateNamespaces() {
        InMemoryKeyValueStore engine = new InMemoryKeyValueStore();
        PrefixedKeyValueStore code = new PrefixedKeyValueStore(engine, "code");
        PrefixedKeyValueStore hashes = new PrefixedKeyValueStore(engine, "contract_hash");

        code.put("0x1", new byte[]{1});
        hashes.put("0x1", new byte[]{2});

        assertThat(code.get("0x1")).hasValueSatisfying(v -> assertThat(v).containsExactly(1));
        assertThat(hashes.get("0x1")).hasValueSatisfying(v -> assertThat(v).containsExactly(2));
        assertThat(engine.get("code:0x1".getBytes(StandardCharsets.UTF_8))).isPresent();
        assertThat(engine.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should delete only within its own namespace")
    void shouldDeleteWithinNamespace() {
        InMemoryKeyValueStore engine = new InMemoryKeyValueStore();
        PrefixedKeyValueStore pages = new PrefixedKeyValueStore(engine, "fact_pages");
        PrefixedKeyValueStore queue = new PrefixedKeyValueStore(engine, "fact_queue");
        pages.put("0xa", new byte[]{1});
        queue.put("0xa", new byte[]{2});

        pages.delete("0xa");
        pages.delete("0xmissing");

        assertThat(pages.get("0xa")).isEmpty();
        assertThat(queue.get("0xa")).isPresent();
        assertThat(engine.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return defensive copies")
    void shouldCopyValues() {
        InMemoryKeyValueStore engine = new InMemoryKeyValueStore();
        byte[] value = {9};
        engine.put(new byte[]{1}, value);
        value[0] = 0;

        byte[] read = engine.get(new byte[]{1}).orElseThrow();
        read[0] = 5;

        assertThat(engine.get(new byte[]{1}).orElseThrow()).containsExactly(9);
    }
}
