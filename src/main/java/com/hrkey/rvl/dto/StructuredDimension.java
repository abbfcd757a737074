package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record StructuredDimension(
        double rating,      // 원 평점 (소수 2자리)
        double confidence,  // 0.0~1.0
        double normalized,  // rating / scale max
        String feedback     // 관련 코멘트(없으면 null)
) {}
