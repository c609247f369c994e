package com.s3signer.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API 문서 설정 (springdoc)
 * 문서: /api-doc.json, UI: /swagger-ui/index.html
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI s3SignerOpenApi(@Value("${s3-signer.version:unknown}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("S3 Signer")
                        .description("S3 Signer for AWS and other S3 compatible storage systems")
                        .version(version));
    }
}
