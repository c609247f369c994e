package com.s3signer.api.service.storage;

import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.s3.S3Client;

import java.util.function.Function;

/**
 * S3 작업 실행 템플릿
 * - 작업마다 새 S3Client를 열고, 결과와 관계없이 항상 닫는다
 * - 클라이언트 생성 실패는 배포 설정 오류로 보고 (재시도 없음)
 * - 작업 자체의 예외는 호출한 서비스가 작업 문맥에 맞게 매핑한다
 */
@Slf4j
public class S3ClientTemplate {

    private final S3ClientProvider clientProvider;

    public S3ClientTemplate(S3ClientProvider clientProvider) {
        this.clientProvider = clientProvider;
    }

    public <T> T execute(String operation, Function<S3Client, T> action) {
        S3Client client;
        try {
            client = clientProvider.open();
        } catch (RuntimeException e) {
            log.error("[S3] Cannot create S3 client - operation: {}", operation, e);
            throw new ApiException(ErrorCode.S3_CLIENT_CREATION_FAILED,
                    "Cannot create S3 client: " + e.getMessage(), e);
        }

        try (client) {
            log.trace("[S3] Executing {}", operation);
            return action.apply(client);
        }
    }
}
