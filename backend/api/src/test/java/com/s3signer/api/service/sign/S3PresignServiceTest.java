package com.s3signer.api.service.sign;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.s3signer.api.TestFixtures;
import com.s3signer.api.config.S3Config;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.common.enums.SignOperation;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

class S3PresignServiceTest {

    private static final ObjectRef OBJECT = ObjectRef.of("media", "videos/intro.mp4");

    private S3Presigner presigner;
    private S3PresignService presignService;

    @BeforeEach
    void setUp() {
        S3Config s3Config = TestFixtures.s3Config();
        presigner = TestFixtures.presigner(s3Config);
        presignService = new S3PresignService(presigner, s3Config);
    }

    @AfterEach
    void tearDown() {
        presigner.close();
    }

    @Test
    void getAndPutUrlsAreDistinctAndPointAtTheObject() {
        PresignedUrl get = presignService.signGet(OBJECT);
        PresignedUrl put = presignService.signPut(OBJECT);

        assertThat(get.getUrl()).isNotEqualTo(put.getUrl());
        for (PresignedUrl presignedUrl : List.of(get, put)) {
            URI uri = URI.create(presignedUrl.getUrl());
            assertThat(uri.getScheme()).isEqualTo("http");
            assertThat(uri.getHost()).isEqualTo("localhost");
            assertThat(uri.getPath()).isEqualTo("/media/videos/intro.mp4");
            assertThat(uri.getQuery()).contains("X-Amz-Signature=", "X-Amz-Expires=900");
        }
        assertThat(get.getExpiresIn()).isEqualTo(Duration.ofMinutes(15));
    }

    @Test
    void uploadPartUrlEmbedsUploadIdAndPartNumber() {
        PresignedUrl part = presignService.signUploadPart(OBJECT, "upload-42", 3);

        String query = URI.create(part.getUrl()).getQuery();
        assertThat(query).contains("uploadId=upload-42", "partNumber=3");
    }

    @Test
    void rejectsBlankBucketOrKey() {
        assertThatThrownBy(() -> presignService.signGet(ObjectRef.of("", "key")))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_PARAMETER);
        assertThatThrownBy(() -> presignService.signPut(ObjectRef.of("bucket", null)))
                .isInstanceOf(ApiException.class);
    }

    @Test
    void uploadPartRequiresUploadIdAndPositivePartNumber() {
        assertThatThrownBy(() -> presignService.sign(SignOperation.UPLOAD_PART, OBJECT, null, 1))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("uploadId");
        assertThatThrownBy(() -> presignService.sign(SignOperation.UPLOAD_PART, OBJECT, "upload-42", 0))
                .isInstanceOf(ApiException.class)
                .hasMessageContaining("part number");
    }

    @Test
    void concurrentPartUrlsDoNotBlockEachOther() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<PresignedUrl> first = () -> {
                start.await();
                return presignService.signUploadPart(OBJECT, "upload-42", 1);
            };
            Callable<PresignedUrl> second = () -> {
                start.await();
                return presignService.signUploadPart(OBJECT, "upload-42", 2);
            };
            Future<PresignedUrl> firstResult = executor.submit(first);
            Future<PresignedUrl> secondResult = executor.submit(second);
            start.countDown();

            assertThat(firstResult.get(10, TimeUnit.SECONDS).getUrl()).contains("partNumber=1");
            assertThat(secondResult.get(10, TimeUnit.SECONDS).getUrl()).contains("partNumber=2");
        } finally {
            executor.shutdownNow();
        }
    }
}
