package com.hrkey.rvl.dto;

public record EmbeddingServiceStatus(
        String provider,       // "hash" | "openai"
        String model,
        int dimensions,
        boolean apiKeyConfigured,
        boolean ready,
        boolean semantic       // 벡터가 의미 유사도를 반영하는지
) {}
