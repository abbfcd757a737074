package com.hrkey.rvl.dto;

public enum ValidationStatus {
    APPROVED,
    APPROVED_WITH_WARNINGS,
    REJECTED_HIGH_FRAUD_RISK,
    REJECTED_CRITICAL_ISSUES,
    REJECTED_INCONSISTENT;

    /** 점수 엔진에 전달 가능한 상태인지 (APPROVED*) */
    public boolean isPassed() {
        return name().startsWith("APPROVED");
    }

    public boolean isRejected() {
        return name().startsWith("REJECTED");
    }
}
