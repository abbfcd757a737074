package com.hrkey.rvl.dto;

import java.util.Map;

public record FraudAssessment(
        int overallScore,                       // 0~100, 낮을수록 안전
        Map<String, FraudComponent> components, // signal name → sub-score
        RiskLevel riskLevel
) {
    public static final String TEXT_QUALITY = "text_quality";
    public static final String RATING_PATTERNS = "rating_patterns";
    public static final String CONSISTENCY = "consistency";
    public static final String REFERRER = "referrer_reputation";
}
