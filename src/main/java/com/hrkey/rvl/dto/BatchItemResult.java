package com.hrkey.rvl.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(
        int index,                        // 입력 목록에서의 위치
        boolean success,
        ValidatedReferenceRecord record,  // 실패 시 null
        String errorCode,                 // 성공 시 null
        String error
) {
    public static BatchItemResult ok(int index, ValidatedReferenceRecord record) {
        return new BatchItemResult(index, true, record, null, null);
    }

    public static BatchItemResult failed(int index, String errorCode, String error) {
        return new BatchItemResult(index, false, null, errorCode, error);
    }
}
