package com.s3signer.api.util;

import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;

/**
 * 요청 파라미터 검증 유틸리티
 * - 누락 / 공백 파라미터는 S3 호출 전에 422로 거부
 * - 키 경로는 정규화하지 않는다 (S3가 해석)
 */
@Slf4j
public class RequestValidator {

    private RequestValidator() {
    }

    /**
     * 필수 문자열 파라미터 검증
     * @param value 파라미터 값
     * @param name 파라미터 이름 (에러 메시지용)
     * @return 검증된 값
     * @throws ApiException INVALID_PARAMETER
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            log.debug("[RequestValidator] Missing parameter: {}", name);
            throw new ApiException(ErrorCode.INVALID_PARAMETER, "Missing required parameter: " + name);
        }
        return value;
    }

    /**
     * 파트 번호 검증 (1 이상)
     */
    public static int requirePartNumber(Integer partNumber) {
        if (partNumber == null || partNumber < 1) {
            log.debug("[RequestValidator] Invalid part number: {}", partNumber);
            throw new ApiException(ErrorCode.INVALID_PARAMETER, "Invalid part number: " + partNumber);
        }
        return partNumber;
    }
}
