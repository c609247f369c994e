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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 객체 API 컨트롤러
 * 인증 불필요 - 서명 URL로 리다이렉트하거나 목록을 JSON으로 반환
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Objects", description = "Objects-related API")
public class ObjectController {

    private final PresignService presignService;
    private final ObjectListingService objectListingService;

    @GetMapping("/object")
    @Operation(summary = "객체 조회 URL", description = "서명된 GET URL로 리다이렉트합니다.")
    public ResponseEntity<Void> getObject(
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object to get") @RequestParam String path) {
        ObjectRef objectRef = objectRef(bucket, path);
        log.info("[Objects] Get object - {}", objectRef);
        return redirect(presignService.signGet(objectRef));
    }

    @PostMapping("/objects")
    @Operation(summary = "객체 생성 URL", description = "서명된 PUT URL로 리다이렉트합니다.")
    public ResponseEntity<Void> createObject(
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object to create") @RequestParam String path) {
        ObjectRef objectRef = objectRef(bucket, path);
        log.info("[Objects] Create object - {}", objectRef);
        return redirect(presignService.signPut(objectRef));
    }

    @GetMapping("/objects")
    @Operation(summary = "객체 목록 조회", description = "prefix 바로 아래의 객체와 디렉토리를 조회합니다.")
    public List<ObjectDto.ObjectEntry> listObjects(
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Prefix of the directory to list") @RequestParam(required = false) String prefix) {
        RequestValidator.requireNonBlank(bucket, "bucket");
        log.info("[Objects] List objects - bucket: {}, prefix: {}", bucket, prefix);
        return objectListingService.list(bucket, prefix);
    }

    static ObjectRef objectRef(String bucket, String path) {
        return ObjectRef.of(
                RequestValidator.requireNonBlank(bucket, "bucket"),
                RequestValidator.requireNonBlank(path, "path"));
    }

    static ResponseEntity<Void> redirect(PresignedUrl presignedUrl) {
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, presignedUrl.getUrl())
                .build();
    }
}
