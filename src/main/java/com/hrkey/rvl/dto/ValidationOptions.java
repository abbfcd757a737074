package com.hrkey.rvl.dto;

import lombok.Builder;

import java.util.List;

/**
 * validateReference 호출 단위 옵션.
 *
 * @param skipEmbeddings       임베딩 생성 생략 (레코드에 벡터 없음)
 * @param skipConsistencyCheck 이전 추천서가 없는 것으로 취급
 * @param previousReferences   비교 대상 이전 추천서들
 */
@Builder
public record ValidationOptions(
        boolean skipEmbeddings,
        boolean skipConsistencyCheck,
        List<PriorReference> previousReferences
) {
    public ValidationOptions {
        previousReferences = previousReferences == null ? List.of() : List.copyOf(previousReferences);
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(false, false, List.of());
    }
}
