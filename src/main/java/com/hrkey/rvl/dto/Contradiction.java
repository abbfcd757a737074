package com.hrkey.rvl.dto;

/**
 * @param span   두 표현을 포함한 본문 구간
 * @param reason 어떤 속성에서 어떤 표현끼리 충돌하는지
 */
public record Contradiction(
        String span,
        String reason
) {}
