package com.hrkey.rvl;

import com.hrkey.rvl.embedding.EmbeddingProvider;
import com.hrkey.rvl.embedding.HashEmbeddingProvider;
import com.hrkey.rvl.service.ReferenceValidationOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ReferenceValidationApplicationTests {

    @Autowired private ReferenceValidationOrchestrator orchestrator;
    @Autowired private EmbeddingProvider embeddingProvider;

    @Test
    void contextLoads() {
        assertThat(embeddingProvider).isInstanceOf(HashEmbeddingProvider.class);
        assertThat(orchestrator.getInfo().thresholds()).containsEntry("min_text_length", 20);
    }
}
