package com.hrkey.rvl.exception;

import lombok.Getter;

@Getter
public class ReferenceValidationException extends RuntimeException {

    private final ValidationErrorCode code;

    public ReferenceValidationException(ValidationErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ReferenceValidationException(ValidationErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
