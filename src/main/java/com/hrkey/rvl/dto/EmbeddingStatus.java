package com.hrkey.rvl.dto;

public enum EmbeddingStatus {
    GENERATED,
    SKIPPED,      // 호출자가 skipEmbeddings 지정
    UNAVAILABLE   // provider 장애 → fail-soft
}
