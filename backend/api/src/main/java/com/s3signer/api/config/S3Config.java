package com.s3signer.api.config;

import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import software.amazon.awssdk.regions.Region;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

/**
 * S3 접속 설정 (불변)
 * - 모든 요청이 공유하는 자격 증명 / 리전 / 엔드포인트
 * - hostname 지정 시 region은 커스텀 엔드포인트의 논리적 이름으로만 사용
 */
@Getter
@ConfigurationProperties(prefix = "aws.s3")
public class S3Config {

    private final String accessKeyId;
    private final String secretAccessKey;
    private final String region;
    private final String hostname;
    private final Duration presignedUrlExpiration;
    private final boolean partUrlRedirect;

    public S3Config(String accessKeyId,
                    String secretAccessKey,
                    @DefaultValue("us-east-1") String region,
                    String hostname,
                    @DefaultValue("1h") Duration presignedUrlExpiration,
                    @DefaultValue("false") boolean partUrlRedirect) {
        this.accessKeyId = accessKeyId;
        this.secretAccessKey = secretAccessKey;
        this.region = region;
        this.hostname = hostname;
        this.presignedUrlExpiration = presignedUrlExpiration;
        this.partUrlRedirect = partUrlRedirect;
    }

    public boolean hasCustomEndpoint() {
        return hostname != null && !hostname.isBlank();
    }

    public Region awsRegion() {
        return Region.of(region);
    }

    /**
     * 커스텀 엔드포인트 URI (스킴이 없으면 https 로 간주)
     */
    public Optional<URI> endpoint() {
        if (!hasCustomEndpoint()) {
            return Optional.empty();
        }
        String value = hostname.trim();
        if (!value.contains("://")) {
            value = "https://" + value;
        }
        return Optional.of(URI.create(value));
    }

    /**
     * 설정 검증 - 실패 시 기동 단계에서 중단
     * @throws ApiException S3_CONFIGURATION_INVALID
     */
    public void validate() {
        if (isBlank(accessKeyId) || isBlank(secretAccessKey)) {
            throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID,
                    "AWS access key id and secret access key are required");
        }
        if (isBlank(region)) {
            throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID, "AWS region is required");
        }
        if (presignedUrlExpiration == null || presignedUrlExpiration.isZero() || presignedUrlExpiration.isNegative()) {
            throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID,
                    "Presigned URL expiration must be positive: " + presignedUrlExpiration);
        }

        if (hasCustomEndpoint()) {
            try {
                URI uri = endpoint().orElseThrow();
                if (uri.getHost() == null) {
                    throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID, "Invalid AWS hostname: " + hostname);
                }
            } catch (IllegalArgumentException e) {
                throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID, "Invalid AWS hostname: " + hostname, e);
            }
        } else if (!Region.regions().contains(awsRegion())) {
            throw new ApiException(ErrorCode.S3_CONFIGURATION_INVALID, "Unknown AWS region: " + region);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public String toString() {
        // 시크릿은 로그에 남기지 않는다
        return "S3Config{region=" + region
                + ", hostname=" + hostname
                + ", presignedUrlExpiration=" + presignedUrlExpiration
                + ", partUrlRedirect=" + partUrlRedirect + "}";
    }
}
