package com.s3signer.api.controller;

import com.s3signer.api.dto.ObjectDto;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.api.service.listing.ObjectListingService;
import com.s3signer.api.service.sign.PresignService;
import com.s3signer.api.util.RequestValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 단일 서명 API (레거시 클라이언트 호환)
 * 리다이렉트 대신 서명 URL을 JSON으로 내려준다.
 * list=true 이면 path를 prefix로 목록을 반환한다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/sign")
@Tag(name = "Objects", description = "Objects-related API")
public class SignController {

    private final PresignService presignService;
    private final ObjectListingService objectListingService;

    @GetMapping
    @Operation(summary = "서명 URL 조회", description = "GET 또는 PUT(create=true) 서명 URL을 JSON으로 반환합니다.")
    public Object sign(
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object, or prefix when listing") @RequestParam String path,
            @Parameter(description = "List the directory instead of signing") @RequestParam(defaultValue = "false") boolean list,
            @Parameter(description = "Sign an object creation") @RequestParam(defaultValue = "false") boolean create) {
        if (list) {
            // 빈 path 는 버킷 루트 목록
            RequestValidator.requireNonBlank(bucket, "bucket");
            log.info("[Sign] List - bucket: {}, prefix: {}", bucket, path);
            return objectListingService.list(bucket, path);
        }

        ObjectRef objectRef = ObjectController.objectRef(bucket, path);
        log.info("[Sign] {} - {}", create ? "Create" : "Get", objectRef);
        PresignedUrl presignedUrl = create
                ? presignService.signPut(objectRef)
                : presignService.signGet(objectRef);
        return ObjectDto.SignResponse.builder()
                .url(presignedUrl.getUrl())
                .expiresIn(presignedUrl.getExpiresIn().toSeconds())
                .build();
    }
}
