package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 검증 중 발견된 신호 1건.
 *
 * @param type     신호 종류
 * @param severity INFO 는 참고용, WARNING 은 APPROVED_WITH_WARNINGS 로 강등,
 *                 일관성 신호가 CRITICAL 이면 REJECTED_INCONSISTENT
 * @param message  사람이 읽는 설명
 * @param kpi      관련 KPI (없으면 null)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationFlag(
        FlagType type,
        Severity severity,
        String message,
        String kpi
) {
    public enum FlagType {
        KPI_DEVIATION,
        LOW_CONSISTENCY,
        POTENTIAL_CONTRADICTION,
        SEMANTIC_DIVERGENCE,
        INVALID_RATING
    }

    public enum Severity {
        INFO,
        WARNING,
        CRITICAL
    }

    public static ValidationFlag warning(FlagType type, String message) {
        return new ValidationFlag(type, Severity.WARNING, message, null);
    }

    public static ValidationFlag warning(FlagType type, String message, String kpi) {
        return new ValidationFlag(type, Severity.WARNING, message, kpi);
    }

    public boolean isConsistencySignal() {
        return type == FlagType.KPI_DEVIATION
                || type == FlagType.LOW_CONSISTENCY
                || type == FlagType.POTENTIAL_CONTRADICTION
                || type == FlagType.SEMANTIC_DIVERGENCE;
    }
}
