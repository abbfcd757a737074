package com.hrkey.rvl.dto;

public record KpiComparison(
        String kpi,
        double currentRating,
        double historicalMean,  // 이전 추천서들의 평균
        double deviation,       // |current - mean|
        int sampleSize,         // 비교에 쓰인 이전 추천서 수
        double score            // 0.0~1.0 KPI별 일관성
) {}
