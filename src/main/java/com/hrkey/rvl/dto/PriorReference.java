package com.hrkey.rvl.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 같은 후보자의 이전 추천서 스냅샷 (읽기 전용).
 *
 * @param kpiRatings      그 추천서의 KPI 평점
 * @param embeddingVector 저장된 임베딩 (없으면 null)
 * @param status          검증 상태. 검증을 거치지 않은 추천서는 null
 */
public record PriorReference(
        Map<String, Double> kpiRatings,
        List<Double> embeddingVector,
        ValidationStatus status
) {
    public PriorReference {
        kpiRatings = kpiRatings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(kpiRatings));
        embeddingVector = embeddingVector == null ? null : List.copyOf(embeddingVector);
    }

    public static PriorReference ofRatings(Map<String, Double> kpiRatings) {
        return new PriorReference(kpiRatings, null, null);
    }

    public static PriorReference from(ValidatedReferenceRecord record) {
        Map<String, Double> ratings = new LinkedHashMap<>();
        record.structuredDimensions().forEach((kpi, dim) -> ratings.put(kpi, dim.rating()));
        return new PriorReference(ratings, record.embeddingVector(), record.validationStatus());
    }

    public boolean hasEmbedding() {
        return embeddingVector != null && !embeddingVector.isEmpty();
    }
}
