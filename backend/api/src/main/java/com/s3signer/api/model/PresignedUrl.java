package com.s3signer.api.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * 요청마다 새로 생성되는 서명 URL (캐시하지 않음)
 */
@Getter
@ToString
@AllArgsConstructor
public class PresignedUrl {

    private final String url;
    private final Duration expiresIn;
}
