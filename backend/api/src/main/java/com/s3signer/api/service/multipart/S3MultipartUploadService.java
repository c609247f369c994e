package com.s3signer.api.service.multipart;

import com.s3signer.api.dto.MultipartUploadDto;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.api.service.sign.PresignService;
import com.s3signer.api.service.storage.S3ClientTemplate;
import com.s3signer.api.util.RequestValidator;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedMultipartUpload;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class S3MultipartUploadService implements MultipartUploadService {

    private final S3ClientTemplate s3ClientTemplate;
    private final PresignService presignService;

    @Override
    public String createUpload(ObjectRef objectRef) {
        validate(objectRef);
        log.info("[Multipart] Create upload - {}", objectRef);

        CreateMultipartUploadResponse response = s3ClientTemplate.execute("CreateMultipartUpload", client -> {
            try {
                return client.createMultipartUpload(CreateMultipartUploadRequest.builder()
                        .bucket(objectRef.getBucket())
                        .key(objectRef.getKey())
                        .build());
            } catch (SdkException e) {
                log.error("[Multipart] Failed to create upload - {}", objectRef, e);
                throw new ApiException(ErrorCode.MULTIPART_CREATION_FAILED,
                        "Multipart upload creation failed: " + e.getMessage(), e);
            }
        });

        String uploadId = response.uploadId();
        if (uploadId == null || uploadId.isEmpty()) {
            log.error("[Multipart] Invalid multipart upload creation response - {}", objectRef);
            throw new ApiException(ErrorCode.MULTIPART_PROTOCOL_VIOLATION,
                    "Invalid multipart upload creation response");
        }

        log.info("[Multipart] Upload created - {}, uploadId: {}", objectRef, uploadId);
        return uploadId;
    }

    @Override
    public PresignedUrl partUploadUrl(ObjectRef objectRef, String uploadId, int partNumber) {
        log.info("[Multipart] Upload part - uploadId: {}, partNumber: {}", uploadId, partNumber);
        return presignService.signUploadPart(objectRef, uploadId, partNumber);
    }

    @Override
    public void complete(ObjectRef objectRef, String uploadId, List<MultipartUploadDto.CompletedUploadPart> parts) {
        validate(objectRef);
        RequestValidator.requireNonBlank(uploadId, "uploadId");
        if (parts == null) {
            throw new ApiException(ErrorCode.INVALID_PARAMETER, "Missing required parameter: parts");
        }
        log.info("[Multipart] Complete upload - {}, uploadId: {}, parts: {}", objectRef, uploadId, parts.size());

        List<CompletedPart> completedParts = parts.stream()
                .map(part -> CompletedPart.builder()
                        .partNumber(part.getNumber())
                        .eTag(part.getEtag())
                        .build())
                .collect(Collectors.toList());

        s3ClientTemplate.execute("CompleteMultipartUpload", client -> {
            try {
                return client.completeMultipartUpload(CompleteMultipartUploadRequest.builder()
                        .bucket(objectRef.getBucket())
                        .key(objectRef.getKey())
                        .uploadId(uploadId)
                        .multipartUpload(CompletedMultipartUpload.builder()
                                .parts(completedParts)
                                .build())
                        .build());
            } catch (SdkException e) {
                log.error("[Multipart] Failed to complete upload - {}, uploadId: {}", objectRef, uploadId, e);
                throw new ApiException(ErrorCode.MULTIPART_COMPLETION_FAILED,
                        "Multipart upload completion failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void abort(ObjectRef objectRef, String uploadId) {
        validate(objectRef);
        RequestValidator.requireNonBlank(uploadId, "uploadId");
        log.info("[Multipart] Abort upload - {}, uploadId: {}", objectRef, uploadId);

        s3ClientTemplate.execute("AbortMultipartUpload", client -> {
            try {
                return client.abortMultipartUpload(AbortMultipartUploadRequest.builder()
                        .bucket(objectRef.getBucket())
                        .key(objectRef.getKey())
                        .uploadId(uploadId)
                        .build());
            } catch (SdkException e) {
                log.error("[Multipart] Failed to abort upload - {}, uploadId: {}", objectRef, uploadId, e);
                throw new ApiException(ErrorCode.MULTIPART_ABORTION_FAILED,
                        "Multipart upload abortion failed: " + e.getMessage(), e);
            }
        });
    }

    private void validate(ObjectRef objectRef) {
        RequestValidator.requireNonBlank(objectRef.getBucket(), "bucket");
        RequestValidator.requireNonBlank(objectRef.getKey(), "path");
    }
}
