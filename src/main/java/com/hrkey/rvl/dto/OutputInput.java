package com.hrkey.rvl.dto;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 구조화 출력 생성기 입력: 앞선 단계들의 결과를 모은 것 */
@Builder
public record OutputInput(
        String standardizedText,
        Map<String, Double> kpiRatings,
        Map<String, String> detailedFeedback,
        double consistencyScore,
        FraudAssessment fraud,
        double[] embeddingVector,
        EmbeddingStatus embeddingStatus,
        List<ValidationFlag> flags,
        List<KpiComparison> kpiComparisons,
        List<String> qualityIssues,   // 비어있지 않으면 upstream 품질 실패
        List<String> keyPhrases
) {
    public OutputInput {
        kpiRatings = finiteRatings(kpiRatings);
        detailedFeedback = detailedFeedback == null ? Map.of() : detailedFeedback;
        embeddingStatus = embeddingStatus == null
                ? (embeddingVector == null ? EmbeddingStatus.SKIPPED : EmbeddingStatus.GENERATED)
                : embeddingStatus;
        flags = flags == null ? List.of() : List.copyOf(flags);
        kpiComparisons = kpiComparisons == null ? List.of() : List.copyOf(kpiComparisons);
        qualityIssues = qualityIssues == null ? List.of() : List.copyOf(qualityIssues);
        keyPhrases = keyPhrases == null ? List.of() : List.copyOf(keyPhrases);
    }

    // null/NaN/무한대 평점은 출력 대상에서 제외 (입력 순서 유지)
    private static Map<String, Double> finiteRatings(Map<String, Double> ratings) {
        if (ratings == null) return Map.of();
        Map<String, Double> out = new LinkedHashMap<>();
        ratings.forEach((kpi, r) -> {
            if (kpi != null && r != null && Double.isFinite(r)) out.put(kpi, r);
        });
        return Collections.unmodifiableMap(out);
    }

    public int fraudScore() {
        return fraud == null ? 0 : fraud.overallScore();
    }
}
