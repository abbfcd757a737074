package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 공개 API 응답. 임베딩 벡터는 어떤 경우에도 포함하지 않는다.
 * internal 은 includeInternal=true 일 때만 채워진다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublicReferenceView(
        ValidationStatus status,
        double confidence,
        int fraudScore,
        double consistencyScore,
        Map<String, StructuredDimension> dimensions,
        List<FlagView> flags,
        Meta metadata,
        Boolean embeddingAvailable,
        InternalSignals internal
) {
    public record FlagView(ValidationFlag.FlagType type, ValidationFlag.Severity severity, String message) {}

    public record Meta(Instant validatedAt, String version) {}
}
