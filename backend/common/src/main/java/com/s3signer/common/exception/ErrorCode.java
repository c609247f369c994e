package com.s3signer.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "서버 내부 오류가 발생했습니다."),
    INVALID_PARAMETER(HttpStatus.UNPROCESSABLE_ENTITY, "C002", "요청 파라미터가 올바르지 않습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C005", "리소스를 찾을 수 없습니다."),

    // Configuration - 배포 설정 오류 (재시도 대상 아님)
    S3_CONFIGURATION_INVALID(HttpStatus.INTERNAL_SERVER_ERROR, "S001", "S3 설정이 올바르지 않습니다."),
    S3_CLIENT_CREATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S002", "S3 클라이언트를 생성할 수 없습니다."),

    // Signing
    SIGNATURE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S011", "서명 URL 생성에 실패했습니다."),

    // Listing
    OBJECT_LISTING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "S021", "객체 목록 조회에 실패했습니다."),

    // Multipart upload
    MULTIPART_CREATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M001", "멀티파트 업로드 생성에 실패했습니다."),
    MULTIPART_COMPLETION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M002", "멀티파트 업로드 완료에 실패했습니다."),
    MULTIPART_ABORTION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "M003", "멀티파트 업로드 중단에 실패했습니다."),
    MULTIPART_PROTOCOL_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR, "M004", "S3 응답에 업로드 ID가 없습니다.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
