package com.s3signer.api.service.storage;

import software.amazon.awssdk.services.s3.S3Client;

/**
 * S3 클라이언트 공급자
 * 호출할 때마다 새 클라이언트를 반환하며, 닫는 책임은 호출자({@link S3ClientTemplate})에 있다.
 */
@FunctionalInterface
public interface S3ClientProvider {

    S3Client open();
}
