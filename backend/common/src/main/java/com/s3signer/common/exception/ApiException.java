package com.s3signer.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외
 * ErrorCode에 정의된 HTTP 상태로 응답된다.
 */
@Getter
public class ApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
