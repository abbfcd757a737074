package com.hrkey.rvl.exception;

public enum ValidationErrorCode {
    TEXT_TOO_SHORT,       // 본문/임베딩 입력 최소 길이 미달 → 호출자에게 노출, 재시도 X
    INVALID_VECTORS,      // 벡터 차원 불일치 (프로그래밍 오류)
    PROVIDER_UNAVAILABLE  // 임베딩 provider 장애 → orchestrator 가 fail-soft 처리
}
