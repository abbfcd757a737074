package com.hrkey.rvl.embedding;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class HashEmbeddingProviderTest {

    private final HashEmbeddingProvider provider = new HashEmbeddingProvider(1536);

    @Test
    @DisplayName("produces a vector of the configured size in [-1, 1]")
    void shape() {
        double[] v = provider.embed("Maria is a dependable and thoughtful engineer.");
        assertThat(v).hasSize(1536);
        assertThat(Arrays.stream(v).allMatch(x -> x >= -1.0 && x <= 1.0)).isTrue();
    }

    @Test
    @DisplayName("is deterministic for identical text")
    void deterministic() {
        String text = "Maria is a dependable and thoughtful engineer.";
        assertThat(provider.embed(text)).containsExactly(provider.embed(text));
    }

    @Test
    @DisplayName("differs for different text")
    void differs() {
        assertThat(provider.embed("Maria is a dependable engineer."))
                .isNotEqualTo(provider.embed("Maria is a dependable manager."));
    }

    @Test
    @DisplayName("reports itself ready without an api key")
    void status() {
        assertThat(provider.name()).isEqualTo("hash");
        assertThat(provider.ready()).isTrue();
        assertThat(provider.apiKeyConfigured()).isFalse();
        assertThat(provider.semantic()).isFalse();
    }
}
