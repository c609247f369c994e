package com.s3signer.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Server", description = "S3 Signer server API")
public class ServerController {

    private final String version;

    public ServerController(@Value("${s3-signer.version:unknown}") String version) {
        this.version = version;
    }

    @GetMapping(value = "/", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "서버 정보", description = "버전과 API 문서 위치를 반환합니다.")
    public String root() {
        return String.format("S3 Signer (version %s)\nAPI documentation on: /swagger-ui/index.html", version);
    }
}
