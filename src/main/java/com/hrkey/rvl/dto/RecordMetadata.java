package com.hrkey.rvl.dto;

import java.time.Instant;
import java.util.List;

public record RecordMetadata(
        String validationVersion,
        Instant validatedAt,
        int textLength,
        int kpiCount,
        boolean hasEmbedding,
        EmbeddingStatus embeddingStatus,
        List<String> keyPhrases,
        long processingTimeMs    // orchestrator 가 채움 (generator 단독 호출 시 0)
) {
    public RecordMetadata {
        keyPhrases = keyPhrases == null ? List.of() : List.copyOf(keyPhrases);
    }

    public RecordMetadata withProcessingTime(long millis) {
        return new RecordMetadata(validationVersion, validatedAt, textLength, kpiCount,
                hasEmbedding, embeddingStatus, keyPhrases, millis);
    }
}
