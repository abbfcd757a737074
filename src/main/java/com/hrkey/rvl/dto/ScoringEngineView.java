package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** HR 점수 엔진이 받는 최소 형태 */
public record ScoringEngineView(
        @JsonProperty("kpi_ratings")       Map<String, Double> kpiRatings,
        @JsonProperty("narrative")         String narrative,
        @JsonProperty("confidence_score")  double confidenceScore,
        @JsonProperty("validation_passed") boolean validationPassed
) {}
