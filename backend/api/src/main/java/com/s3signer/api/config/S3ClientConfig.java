package com.s3signer.api.config;

import com.s3signer.api.service.storage.S3ClientProvider;
import com.s3signer.api.service.storage.S3ClientTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * S3 SDK 설정
 * - S3Presigner: 네트워크 호출 없이 서명만 수행하므로 싱글톤으로 공유
 * - S3Client: 작업 단위로 새로 생성 (S3ClientTemplate 참고)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(S3Config.class)
public class S3ClientConfig {

    @Bean
    public S3Presigner s3Presigner(S3Config s3Config) {
        s3Config.validate();

        S3Presigner.Builder builder = S3Presigner.builder()
                .region(s3Config.awsRegion())
                .credentialsProvider(credentialsProvider(s3Config))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .build());
        s3Config.endpoint().ifPresent(builder::endpointOverride);

        log.info("S3Presigner initialized - {}", s3Config);
        return builder.build();
    }

    @Bean
    public S3ClientProvider s3ClientProvider(S3Config s3Config) {
        s3Config.validate();

        return () -> {
            S3ClientBuilder builder = S3Client.builder()
                    .region(s3Config.awsRegion())
                    .credentialsProvider(credentialsProvider(s3Config))
                    .forcePathStyle(true);
            s3Config.endpoint().ifPresent(builder::endpointOverride);
            return builder.build();
        };
    }

    @Bean
    public S3ClientTemplate s3ClientTemplate(S3ClientProvider s3ClientProvider) {
        return new S3ClientTemplate(s3ClientProvider);
    }

    private StaticCredentialsProvider credentialsProvider(S3Config s3Config) {
        return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(s3Config.getAccessKeyId(), s3Config.getSecretAccessKey()));
    }
}
