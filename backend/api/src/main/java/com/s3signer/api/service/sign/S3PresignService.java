package com.s3signer.api.service.sign;

import com.s3signer.api.config.S3Config;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.api.util.RequestValidator;
import com.s3signer.common.enums.SignOperation;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.awscore.presigner.PresignedRequest;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.UploadPartRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PutObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.UploadPartPresignRequest;

import java.time.Duration;

/**
 * AWS SDK S3Presigner 기반 서명 서비스
 */
@Slf4j
@Service
public class S3PresignService implements PresignService {

    private final S3Presigner s3Presigner;
    private final S3Config s3Config;

    public S3PresignService(S3Presigner s3Presigner, S3Config s3Config) {
        this.s3Presigner = s3Presigner;
        this.s3Config = s3Config;
    }

    @Override
    public PresignedUrl sign(SignOperation operation, ObjectRef objectRef, String uploadId, Integer partNumber) {
        RequestValidator.requireNonBlank(objectRef.getBucket(), "bucket");
        RequestValidator.requireNonBlank(objectRef.getKey(), "path");
        if (operation.requiresUpload()) {
            RequestValidator.requireNonBlank(uploadId, "uploadId");
            RequestValidator.requirePartNumber(partNumber);
        }

        Duration expiration = s3Config.getPresignedUrlExpiration();
        try {
            PresignedRequest presigned = switch (operation) {
                case GET -> s3Presigner.presignGetObject(GetObjectPresignRequest.builder()
                        .signatureDuration(expiration)
                        .getObjectRequest(GetObjectRequest.builder()
                                .bucket(objectRef.getBucket())
                                .key(objectRef.getKey())
                                .build())
                        .build());
                case PUT -> s3Presigner.presignPutObject(PutObjectPresignRequest.builder()
                        .signatureDuration(expiration)
                        .putObjectRequest(PutObjectRequest.builder()
                                .bucket(objectRef.getBucket())
                                .key(objectRef.getKey())
                                .build())
                        .build());
                case UPLOAD_PART -> s3Presigner.presignUploadPart(UploadPartPresignRequest.builder()
                        .signatureDuration(expiration)
                        .uploadPartRequest(UploadPartRequest.builder()
                                .bucket(objectRef.getBucket())
                                .key(objectRef.getKey())
                                .uploadId(uploadId)
                                .partNumber(partNumber)
                                .build())
                        .build());
            };

            log.debug("[Sign] {} ({}) {} {} (expires in {} seconds)",
                    operation, operation.getDescription(), operation.getHttpMethod(), objectRef, expiration.toSeconds());
            return new PresignedUrl(presigned.url().toString(), expiration);
        } catch (SdkException e) {
            log.error("[Sign] Failed to presign {} for: {}", operation, objectRef, e);
            throw new ApiException(ErrorCode.SIGNATURE_FAILED,
                    "Failed to generate presigned URL: " + e.getMessage(), e);
        }
    }
}
