package com.hrkey.rvl.dto;

import java.util.List;

/** 운영자용 내부 신호 (공개 API 기본 응답에서는 제거) */
public record InternalSignals(
        FraudAssessment fraud,
        List<KpiComparison> kpiComparisons,
        List<String> qualityIssues
) {
    public InternalSignals {
        kpiComparisons = kpiComparisons == null ? List.of() : List.copyOf(kpiComparisons);
        qualityIssues = qualityIssues == null ? List.of() : List.copyOf(qualityIssues);
    }
}
