package com.hrkey.rvl.dto;

import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ReferenceSubmission(
        @NotNull String summary,              // 추천서 본문(raw)
        Map<String, Double> kpiRatings,       // KPI → 평점 (입력 순서 유지)
        Map<String, String> detailedFeedback, // 선택: KPI별/항목별 코멘트
        String ownerId,                       // 후보자 식별자
        String referrerEmail                  // 추천인 이메일
) {
    public ReferenceSubmission {
        kpiRatings = kpiRatings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(kpiRatings));
        detailedFeedback = detailedFeedback == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(detailedFeedback));
    }
}
