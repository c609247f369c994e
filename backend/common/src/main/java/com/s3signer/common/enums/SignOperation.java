package com.s3signer.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 서명 대상 S3 작업
 */
@Getter
@RequiredArgsConstructor
public enum SignOperation {

    GET("GET", "객체 다운로드"),
    PUT("PUT", "객체 업로드"),
    UPLOAD_PART("PUT", "멀티파트 파트 업로드");

    private final String httpMethod;
    private final String description;

    public boolean requiresUpload() {
        return this == UPLOAD_PART;
    }
}
