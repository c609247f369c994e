package com.s3signer.api.controller;

import com.s3signer.api.config.S3Config;
import com.s3signer.api.dto.MultipartUploadDto;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.api.service.multipart.MultipartUploadService;
import com.s3signer.api.util.RequestValidator;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 멀티파트 업로드 API 컨트롤러
 * uploadId 와 파트 ETag 목록은 클라이언트가 보관하고 매 요청마다 전달한다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/multipart-upload")
@Tag(name = "Multipart upload", description = "Multipart upload API")
public class MultipartUploadController {

    private final MultipartUploadService multipartUploadService;
    private final S3Config s3Config;

    @PostMapping
    @Operation(summary = "멀티파트 업로드 생성", description = "S3 멀티파트 업로드를 생성하고 uploadId를 반환합니다.")
    public MultipartUploadDto.CreateUploadResponse createUpload(
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object to upload") @RequestParam String path) {
        ObjectRef objectRef = ObjectController.objectRef(bucket, path);
        String uploadId = multipartUploadService.createUpload(objectRef);
        return MultipartUploadDto.CreateUploadResponse.builder()
                .uploadId(uploadId)
                .build();
    }

    @GetMapping("/{uploadId}/part/{partNumber}")
    @Operation(summary = "파트 업로드 URL", description = "파트 업로드용 서명 URL을 반환합니다.")
    public ResponseEntity<?> partUploadUrl(
            @Parameter(description = "ID of the upload") @PathVariable String uploadId,
            @Parameter(description = "Index number of the part to upload") @PathVariable Integer partNumber,
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object to upload") @RequestParam String path) {
        ObjectRef objectRef = ObjectController.objectRef(bucket, path);
        RequestValidator.requireNonBlank(uploadId, "uploadId");
        int validPartNumber = RequestValidator.requirePartNumber(partNumber);

        PresignedUrl presignedUrl = multipartUploadService.partUploadUrl(objectRef, uploadId, validPartNumber);
        if (s3Config.isPartUrlRedirect()) {
            return ObjectController.redirect(presignedUrl);
        }
        return ResponseEntity.ok(MultipartUploadDto.PartUploadResponse.builder()
                .presignedUrl(presignedUrl.getUrl())
                .build());
    }

    @PostMapping("/{uploadId}")
    @Operation(summary = "멀티파트 업로드 완료 / 중단", description = "action 값에 따라 업로드를 완료하거나 중단합니다.")
    public ResponseEntity<Void> abortOrComplete(
            @Parameter(description = "ID of the upload to abort or complete") @PathVariable String uploadId,
            @Parameter(description = "Name of the bucket") @RequestParam String bucket,
            @Parameter(description = "Key of the object to upload") @RequestParam String path,
            @RequestBody MultipartUploadDto.AbortOrCompleteRequest request) {
        ObjectRef objectRef = ObjectController.objectRef(bucket, path);
        RequestValidator.requireNonBlank(uploadId, "uploadId");

        if (request instanceof MultipartUploadDto.CompleteRequest complete) {
            validateParts(complete);
            multipartUploadService.complete(objectRef, uploadId, complete.getParts());
        } else {
            // action 누락 / 알 수 없는 값은 역직렬화 단계에서 422 처리됨
            multipartUploadService.abort(objectRef, uploadId);
        }
        return ResponseEntity.ok().build();
    }

    private void validateParts(MultipartUploadDto.CompleteRequest complete) {
        if (complete.getParts() == null) {
            throw new ApiException(ErrorCode.INVALID_PARAMETER, "Missing required parameter: parts");
        }
        for (MultipartUploadDto.CompletedUploadPart part : complete.getParts()) {
            if (part == null || part.getNumber() == null || part.getEtag() == null) {
                throw new ApiException(ErrorCode.INVALID_PARAMETER, "Each part requires number and etag");
            }
        }
    }
}
