package com.hrkey.rvl.dto;

import java.util.List;

/**
 * @param score   신호 하나의 점수 0~100
 * @param weight  전체 점수에서의 가중치
 * @param reasons 점수를 올린 사유들
 */
public record FraudComponent(
        double score,
        double weight,
        List<String> reasons
) {
    public FraudComponent {
        reasons = List.copyOf(reasons);
    }

    public double weighted() {
        return score * weight;
    }
}
