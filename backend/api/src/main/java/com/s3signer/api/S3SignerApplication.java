package com.s3signer.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * S3 Signer - AWS 및 S3 호환 스토리지용 서명 게이트웨이
 */
@SpringBootApplication
public class S3SignerApplication {

    public static void main(String[] args) {
        SpringApplication.run(S3SignerApplication.class, args);
    }
}
