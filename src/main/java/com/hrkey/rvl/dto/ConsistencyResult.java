package com.hrkey.rvl.dto;

import java.util.List;

public record ConsistencyResult(
        double consistencyScore,          // 0.0~1.0
        List<ValidationFlag> flags,       // 발견 순서 유지
        List<KpiComparison> comparisons   // KPI별 근거
) {
    public ConsistencyResult {
        flags = List.copyOf(flags);
        comparisons = List.copyOf(comparisons);
    }

    public static ConsistencyResult noHistory() {
        return new ConsistencyResult(1.0, List.of(), List.of());
    }
}
