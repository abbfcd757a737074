package com.hrkey.rvl.service;

import com.hrkey.rvl.config.ValidationThresholds;
import com.hrkey.rvl.dto.*;
import com.hrkey.rvl.dto.ValidationFlag.Severity;
import com.hrkey.rvl.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * 앞 단계 결과를 모아 최종 레코드를 만들고, 소비처별 형태(점수 엔진/공개 API/저장 계층)로 변환한다.
 */
@Service
@RequiredArgsConstructor
public class StructuredOutputGenerator {

    /** KPI 키 직접 매칭이 없을 때 KPI 이름 언급을 찾아볼 일반 코멘트 필드 */
    private static final List<String> GENERAL_FEEDBACK_FIELDS =
            List.of("recommendation", "strengths", "improvements", "summary");

    private final ValidationThresholds thresholds;
    private final Clock clock;

    public ValidatedReferenceRecord generate(OutputInput in) {
        double consistency = TextUtils.clamp(in.consistencyScore(), 0, 1);
        int fraudScore = in.fraudScore();

        Set<String> flaggedKpis = new HashSet<>();
        for (ValidationFlag f : in.flags()) {
            if (f.kpi() != null) flaggedKpis.add(f.kpi());
        }

        Map<String, StructuredDimension> dimensions = new LinkedHashMap<>();
        in.kpiRatings().forEach((kpi, rating) -> {
            String feedback = relevantFeedback(kpi, in.detailedFeedback());
            dimensions.put(kpi, new StructuredDimension(
                    TextUtils.round(rating, 2),
                    dimensionConfidence(rating, consistency, flaggedKpis.contains(kpi), feedback != null),
                    TextUtils.round(rating / thresholds.ratingMax(), 4),
                    feedback));
        });

        String text = in.standardizedText() == null ? "" : in.standardizedText();
        double confidence = overallConfidence(consistency, fraudScore, dimensions.size(), text.length(),
                in.embeddingStatus());
        ValidationStatus status = deriveStatus(fraudScore, in.qualityIssues(), consistency, in.flags());

        List<Double> vector = null;
        if (in.embeddingVector() != null) {
            vector = Arrays.stream(in.embeddingVector()).boxed().toList();
        }

        RecordMetadata metadata = new RecordMetadata(
                ValidationThresholds.VERSION,
                Instant.now(clock),
                text.length(),
                dimensions.size(),
                vector != null,
                in.embeddingStatus(),
                in.keyPhrases(),
                0L);

        return new ValidatedReferenceRecord(
                text,
                dimensions,
                TextUtils.round(consistency, 4),
                fraudScore,
                confidence,
                vector,
                status,
                in.flags(),
                new InternalSignals(in.fraud(), in.kpiComparisons(), in.qualityIssues()),
                metadata);
    }

    /**
     * 상태 판정 (위에서부터 먼저 걸리는 것):
     * 1) fraud >= reject → REJECTED_HIGH_FRAUD_RISK
     * 2) 품질 이슈 존재 → REJECTED_CRITICAL_ISSUES
     * 3) 일관성 < reject 또는 CRITICAL 일관성 신호 → REJECTED_INCONSISTENT
     * 4) fraud >= warn, WARNING 플래그, 일관성 < low → APPROVED_WITH_WARNINGS
     * 5) 그 외 APPROVED
     */
    public ValidationStatus deriveStatus(int fraudScore, List<String> qualityIssues, double consistency,
                                         List<ValidationFlag> flags) {
        List<ValidationFlag> fs = flags == null ? List.of() : flags;

        if (fraudScore >= thresholds.rejectFraudScore()) {
            return ValidationStatus.REJECTED_HIGH_FRAUD_RISK;
        }
        if (qualityIssues != null && !qualityIssues.isEmpty()) {
            return ValidationStatus.REJECTED_CRITICAL_ISSUES;
        }
        boolean criticalConsistency = fs.stream()
                .anyMatch(f -> f.severity() == Severity.CRITICAL && f.isConsistencySignal());
        if (consistency < thresholds.rejectConsistencyScore() || criticalConsistency) {
            return ValidationStatus.REJECTED_INCONSISTENT;
        }
        boolean warning = fs.stream().anyMatch(f -> f.severity() == Severity.WARNING);
        if (fraudScore >= thresholds.warnFraudScore() || warning || consistency < thresholds.lowConsistencyScore()) {
            return ValidationStatus.APPROVED_WITH_WARNINGS;
        }
        return ValidationStatus.APPROVED;
    }

    // ------------------------ 소비처별 변환 ------------------------

    public ScoringEngineView forScoringEngine(ValidatedReferenceRecord record) {
        Map<String, Double> ratings = new LinkedHashMap<>();
        record.structuredDimensions().forEach((kpi, dim) -> ratings.put(kpi, dim.rating()));
        return new ScoringEngineView(
                Collections.unmodifiableMap(ratings),
                record.standardizedText(),
                record.confidence(),
                record.validationStatus().isPassed());
    }

    /** 임베딩 벡터는 includeInternal 여부와 관계없이 절대 포함하지 않는다. */
    public PublicReferenceView forPublicApi(ValidatedReferenceRecord record, boolean includeInternal) {
        List<PublicReferenceView.FlagView> flags = record.flags().stream()
                .map(f -> new PublicReferenceView.FlagView(f.type(), f.severity(), f.message()))
                .toList();
        RecordMetadata meta = record.metadata();

        return new PublicReferenceView(
                record.validationStatus(),
                record.confidence(),
                record.fraudScore(),
                record.consistencyScore(),
                record.structuredDimensions(),
                flags,
                new PublicReferenceView.Meta(meta == null ? null : meta.validatedAt(),
                        meta == null ? ValidationThresholds.VERSION : meta.validationVersion()),
                includeInternal ? record.embeddingVector() != null : null,
                includeInternal ? record.internalSignals() : null);
    }

    /**
     * 저장 계층 컬럼 형태. is_flagged/flag_reason 은 저장 계층 자동 플래그 규칙과 같다:
     * fraud >= 70, consistency < 0.4, REJECTED* 상태.
     */
    public PersistedValidation forPersistence(ValidatedReferenceRecord record) {
        List<String> reasons = new ArrayList<>();
        if (record.fraudScore() >= thresholds.rejectFraudScore()) {
            reasons.add("Automatic flag: High fraud score (" + record.fraudScore() + ")");
        }
        if (record.consistencyScore() < thresholds.rejectConsistencyScore()) {
            reasons.add("Automatic flag: Low consistency score (" + record.consistencyScore() + ")");
        }
        if (record.validationStatus().isRejected()) {
            reasons.add("Automatic flag: " + record.validationStatus().name());
        }

        Instant validatedAt = record.metadata() == null ? Instant.now(clock) : record.metadata().validatedAt();
        return new PersistedValidation(
                record,
                record.validationStatus(),
                record.fraudScore(),
                record.consistencyScore(),
                validatedAt,
                !reasons.isEmpty(),
                reasons.isEmpty() ? null : String.join("; ", reasons));
    }

    // ------------------------ 내부 계산 ------------------------

    double dimensionConfidence(double rating, double consistency, boolean flagged, boolean hasFeedback) {
        double c = extremityConfidence(rating) * (0.7 + 0.3 * consistency);
        if (flagged) c *= 0.8;
        if (hasFeedback) c += 0.05;
        return TextUtils.round(TextUtils.clamp(c, 0, 1), 2);
    }

    // 양 끝 평점일수록 확신, 중간(3점대)은 불확실
    private static double extremityConfidence(double rating) {
        if (rating >= 4.5 || rating <= 1.5) return 0.95;
        if (rating >= 4.0 || rating <= 2.0) return 0.85;
        if (rating >= 3.5 || rating <= 2.5) return 0.75;
        return 0.60;
    }

    double overallConfidence(double consistency, int fraudScore, int kpiCount, int textLength,
                             EmbeddingStatus embeddingStatus) {
        double c = consistency;
        c *= 1 - fraudScore / 200.0; // fraud 는 최대 50% 감점

        if (kpiCount >= 5) c *= 1.1;
        else if (kpiCount <= 2) c *= 0.9;

        if (textLength > 500) c *= 1.05;
        else if (textLength < 100) c *= 0.9;

        if (embeddingStatus == EmbeddingStatus.UNAVAILABLE) c *= 0.95;

        return TextUtils.round(TextUtils.clamp(c, 0, 1), 4);
    }

    private static String relevantFeedback(String kpi, Map<String, String> feedback) {
        if (feedback == null || feedback.isEmpty()) return null;

        String direct = feedback.get(kpi);
        if (direct != null && !direct.isBlank()) return direct;

        String needle = kpi.toLowerCase(Locale.ROOT);
        for (String field : GENERAL_FEEDBACK_FIELDS) {
            String v = feedback.get(field);
            if (v != null && v.toLowerCase(Locale.ROOT).contains(needle)) return v;
        }
        return null;
    }
}
