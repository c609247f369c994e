package com.s3signer.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 객체 조회 / 서명 관련 DTO
 */
public class ObjectDto {

    /**
     * 목록 항목 - 요청 prefix를 제거한 상대 경로
     */
    @Getter
    @Builder
    @ToString
    @EqualsAndHashCode
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ObjectEntry {
        private String path;
        private Boolean isDirectory;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignResponse {
        private String url;
        private long expiresIn;
    }
}
