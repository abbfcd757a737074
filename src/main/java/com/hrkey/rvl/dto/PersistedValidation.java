package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 저장 계층(references 테이블) 컬럼에 그대로 들어가는 값.
 * 컬럼 이름은 저장 계층이 정의한 것을 따른다.
 */
public record PersistedValidation(
        @JsonProperty("validated_data")    ValidatedReferenceRecord validatedData,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("fraud_score")       int fraudScore,
        @JsonProperty("consistency_score") double consistencyScore,
        @JsonProperty("validated_at")      Instant validatedAt,
        @JsonProperty("is_flagged")        boolean flagged,
        @JsonProperty("flag_reason")       String flagReason
) {}
