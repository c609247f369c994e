package com.s3signer.api.service.multipart;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.s3signer.api.TestFixtures;
import com.s3signer.api.config.S3Config;
import com.s3signer.api.dto.MultipartUploadDto;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.api.service.sign.S3PresignService;
import com.s3signer.api.service.storage.S3ClientTemplate;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.AbortMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.CompleteMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CompletedPart;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadRequest;
import software.amazon.awssdk.services.s3.model.CreateMultipartUploadResponse;
import software.amazon.awssdk.services.s3.model.NoSuchUploadException;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

class S3MultipartUploadServiceTest {

    private static final ObjectRef OBJECT = ObjectRef.of("media", "videos/large.mp4");

    private S3Client s3Client;
    private S3Presigner presigner;
    private S3MultipartUploadService multipartUploadService;

    @BeforeEach
    void setUp() {
        S3Config s3Config = TestFixtures.s3Config();
        s3Client = mock(S3Client.class);
        presigner = TestFixtures.presigner(s3Config);
        multipartUploadService = new S3MultipartUploadService(
                new S3ClientTemplate(() -> s3Client), new S3PresignService(presigner, s3Config));
    }

    @AfterEach
    void tearDown() {
        presigner.close();
    }

    @Test
    void createReturnsBackendUploadIdAndPartUrlEmbedsIt() {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().uploadId("U1").build());

        String uploadId = multipartUploadService.createUpload(OBJECT);
        PresignedUrl partUrl = multipartUploadService.partUploadUrl(OBJECT, uploadId, 1);

        assertThat(uploadId).isEqualTo("U1");
        assertThat(partUrl.getUrl()).contains("uploadId=U1", "partNumber=1", "/media/videos/large.mp4");

        ArgumentCaptor<CreateMultipartUploadRequest> captor = ArgumentCaptor.forClass(CreateMultipartUploadRequest.class);
        verify(s3Client).createMultipartUpload(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("media");
        assertThat(captor.getValue().key()).isEqualTo("videos/large.mp4");
        verify(s3Client).close();
    }

    @Test
    void createWithoutUploadIdIsProtocolViolation() {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenReturn(CreateMultipartUploadResponse.builder().build());

        assertThatThrownBy(() -> multipartUploadService.createUpload(OBJECT))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.MULTIPART_PROTOCOL_VIOLATION);
    }

    @Test
    void createFailureIsReported() {
        when(s3Client.createMultipartUpload(any(CreateMultipartUploadRequest.class)))
                .thenThrow(S3Exception.builder().message("Access Denied").statusCode(403).build());

        assertThatThrownBy(() -> multipartUploadService.createUpload(OBJECT))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.MULTIPART_CREATION_FAILED);
    }

    @Test
    void completeForwardsPartsInClientOrder() {
        multipartUploadService.complete(OBJECT, "U1", List.of(
                new MultipartUploadDto.CompletedUploadPart(2, "\"etag-2\""),
                new MultipartUploadDto.CompletedUploadPart(1, "\"etag-1\"")));

        ArgumentCaptor<CompleteMultipartUploadRequest> captor =
                ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3Client).completeMultipartUpload(captor.capture());
        CompleteMultipartUploadRequest request = captor.getValue();
        assertThat(request.uploadId()).isEqualTo("U1");
        assertThat(request.multipartUpload().parts())
                .extracting(CompletedPart::partNumber, CompletedPart::eTag)
                .containsExactly(
                        tuple(2, "\"etag-2\""),
                        tuple(1, "\"etag-1\""));
        verify(s3Client).close();
    }

    @Test
    void completeWithEmptyPartsIsForwardedAndBackendRejectionSurfaces() {
        when(s3Client.completeMultipartUpload(any(CompleteMultipartUploadRequest.class)))
                .thenThrow(S3Exception.builder().message("You must specify at least one part").statusCode(400).build());

        assertThatThrownBy(() -> multipartUploadService.complete(OBJECT, "U1", List.of()))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.MULTIPART_COMPLETION_FAILED);

        ArgumentCaptor<CompleteMultipartUploadRequest> captor =
                ArgumentCaptor.forClass(CompleteMultipartUploadRequest.class);
        verify(s3Client).completeMultipartUpload(captor.capture());
        assertThat(captor.getValue().multipartUpload().parts()).isEmpty();
    }

    @Test
    void completeWithoutPartsIsRejectedBeforeBackendCall() {
        assertThatThrownBy(() -> multipartUploadService.complete(OBJECT, "U1", null))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PARAMETER);
        verifyNoInteractions(s3Client);
    }

    @Test
    void abortIsForwardedAndCanBeRepeatedAfterCompletion() {
        when(s3Client.abortMultipartUpload(any(AbortMultipartUploadRequest.class)))
                .thenReturn(AbortMultipartUploadResponse.builder().build());

        multipartUploadService.abort(OBJECT, "U1");

        ArgumentCaptor<AbortMultipartUploadRequest> captor = ArgumentCaptor.forClass(AbortMultipartUploadRequest.class);
        verify(s3Client).abortMultipartUpload(captor.capture());
        assertThat(captor.getValue().uploadId()).isEqualTo("U1");
        assertThat(captor.getValue().bucket()).isEqualTo("media");

        when(s3Client.abortMultipartUpload(any(AbortMultipartUploadRequest.class)))
                .thenThrow(NoSuchUploadException.builder().message("The specified upload does not exist").build());

        assertThatThrownBy(() -> multipartUploadService.abort(OBJECT, "U1"))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.MULTIPART_ABORTION_FAILED);
        verify(s3Client, times(2)).close();
    }
}
