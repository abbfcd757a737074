package com.hrkey.rvl.config;

import com.hrkey.rvl.dto.RiskLevel;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RVL 전체가 공유하는 가중치/임계값 테이블.
 * Fraud Detector 와 상태 판정 규칙이 같은 값을 참조해야 하므로 한 곳에서만 정의한다.
 *
 * @param minTextLength          본문 최소 길이(문자). 품질 검증/임베딩/키워드/모순 탐지 공통
 * @param minWordCount           본문 최소 단어 수
 * @param maxTextLength          본문 최대 길이(문자)
 * @param ratingMin              KPI 평점 하한
 * @param ratingMax              KPI 평점 상한
 * @param kpiDeviationThreshold  이 이상 벌어지면 KPI_DEVIATION
 * @param deviationTolerance     이 이하 편차는 일관성 감점 없음
 * @param deviationFlagPenalty   KPI_DEVIATION 1건당 일관성 감점
 * @param lowConsistencyScore    이 미만이면 LOW_CONSISTENCY 경고 + 승인 경고
 * @param semanticSimilarityMin  이전 추천서와의 평균 코사인 유사도 하한
 * @param contradictionWindow    모순 탐지 시 두 표현 사이 최대 거리(문자)
 * @param textQualityWeight      fraud: 본문 품질 가중치
 * @param ratingPatternWeight    fraud: 평점 패턴 가중치
 * @param consistencyWeight      fraud: 일관성 가중치
 * @param referrerWeight         fraud: 추천인 이메일 평판 가중치
 * @param rejectFraudScore       이 이상이면 REJECTED_HIGH_FRAUD_RISK (저장 계층 auto-flag 와 동일)
 * @param warnFraudScore         이 이상이면 APPROVED_WITH_WARNINGS
 * @param rejectConsistencyScore 이 미만이면 REJECTED_INCONSISTENT
 * @param mediumRiskFrom         risk level MEDIUM 시작 점수
 * @param highRiskFrom           risk level HIGH 시작 점수
 */
@Builder(toBuilder = true)
public record ValidationThresholds(
        int minTextLength,
        int minWordCount,
        int maxTextLength,
        double ratingMin,
        double ratingMax,
        double kpiDeviationThreshold,
        double deviationTolerance,
        double deviationFlagPenalty,
        double lowConsistencyScore,
        double semanticSimilarityMin,
        int contradictionWindow,
        double textQualityWeight,
        double ratingPatternWeight,
        double consistencyWeight,
        double referrerWeight,
        int rejectFraudScore,
        int warnFraudScore,
        double rejectConsistencyScore,
        int mediumRiskFrom,
        int highRiskFrom
) {
    public static final String VERSION = "1.0.0";

    public static final ValidationThresholds DEFAULT = ValidationThresholds.builder()
            .minTextLength(20)
            .minWordCount(5)
            .maxTextLength(10_000)
            .ratingMin(1.0)
            .ratingMax(5.0)
            .kpiDeviationThreshold(2.0)
            .deviationTolerance(0.5)
            .deviationFlagPenalty(0.15)
            .lowConsistencyScore(0.6)
            .semanticSimilarityMin(0.6)
            .contradictionWindow(160)
            .textQualityWeight(0.30)
            .ratingPatternWeight(0.30)
            .consistencyWeight(0.20)
            .referrerWeight(0.20)
            .rejectFraudScore(70)
            .warnFraudScore(30)
            .rejectConsistencyScore(0.4)
            .mediumRiskFrom(20)
            .highRiskFrom(40)
            .build();

    public double ratingSpan() {
        return ratingMax - ratingMin;
    }

    public boolean isRatingInRange(Double rating) {
        return rating != null && Double.isFinite(rating) && rating >= ratingMin && rating <= ratingMax;
    }

    /** 저장 계층 주석과 동일한 구간: 0-20 low, 20-40 medium, 40-70 high, 70+ critical */
    public RiskLevel riskLevel(int fraudScore) {
        if (fraudScore < mediumRiskFrom) return RiskLevel.LOW;
        if (fraudScore < highRiskFrom) return RiskLevel.MEDIUM;
        if (fraudScore < rejectFraudScore) return RiskLevel.HIGH;
        return RiskLevel.CRITICAL;
    }

    /** getInfo() 노출용 */
    public Map<String, Object> asMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("min_text_length", minTextLength);
        m.put("min_word_count", minWordCount);
        m.put("max_text_length", maxTextLength);
        m.put("rating_range", new double[]{ratingMin, ratingMax});
        m.put("kpi_deviation_threshold", kpiDeviationThreshold);
        m.put("consistency_threshold", lowConsistencyScore);
        m.put("reject_consistency_score", rejectConsistencyScore);
        m.put("semantic_similarity_min", semanticSimilarityMin);
        m.put("max_fraud_score", 100);
        m.put("reject_fraud_score", rejectFraudScore);
        m.put("warn_fraud_score", warnFraudScore);
        m.put("fraud_weights", Map.of(
                "text_quality", textQualityWeight,
                "rating_patterns", ratingPatternWeight,
                "consistency", consistencyWeight,
                "referrer_reputation", referrerWeight));
        return m;
    }
}
