package com.hrkey.rvl.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RVL 최종 산출물. 저장 계층이 그대로 보관하고 점수 엔진 등 하위 시스템이 소비한다.
 * 한 번 생성되면 변경하지 않는다(정정은 새 레코드로).
 */
public record ValidatedReferenceRecord(
        String standardizedText,
        Map<String, StructuredDimension> structuredDimensions,
        double consistencyScore,       // 0.0~1.0
        int fraudScore,                // 0~100
        double confidence,             // 0.0~1.0
        List<Double> embeddingVector,  // nullable
        ValidationStatus validationStatus,
        List<ValidationFlag> flags,
        InternalSignals internalSignals,
        RecordMetadata metadata
) {
    public ValidatedReferenceRecord {
        structuredDimensions = Collections.unmodifiableMap(new LinkedHashMap<>(structuredDimensions));
        embeddingVector = embeddingVector == null ? null : List.copyOf(embeddingVector);
        flags = List.copyOf(flags);
    }

    public ValidatedReferenceRecord withMetadata(RecordMetadata newMetadata) {
        return new ValidatedReferenceRecord(standardizedText, structuredDimensions, consistencyScore,
                fraudScore, confidence, embeddingVector, validationStatus, flags, internalSignals, newMetadata);
    }
}
