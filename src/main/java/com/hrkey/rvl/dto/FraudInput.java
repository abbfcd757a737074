package com.hrkey.rvl.dto;

import java.util.Map;

public record FraudInput(
        String text,
        Map<String, Double> kpiRatings,
        double consistencyScore,
        String referrerEmail
) {
    public FraudInput {
        kpiRatings = kpiRatings == null ? Map.of() : kpiRatings;
    }
}
