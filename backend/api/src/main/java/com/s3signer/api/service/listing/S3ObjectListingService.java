package com.s3signer.api.service.listing;

import com.s3signer.api.dto.ObjectDto;
import com.s3signer.api.service.storage.S3ClientTemplate;
import com.s3signer.api.util.RequestValidator;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * ListObjectsV2 (delimiter '/') 기반 목록 조회
 *
 * prefix 제거는 경로 단위가 아닌 UTF-8 바이트 길이 기준이다.
 * 구분자로 끝나지 않는 prefix를 넘기면 세그먼트 일부가 잘린 이름이 나올 수 있다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectListingService implements ObjectListingService {

    static final String DELIMITER = "/";

    private final S3ClientTemplate s3ClientTemplate;

    @Override
    public List<ObjectDto.ObjectEntry> list(String bucket, String prefix) {
        RequestValidator.requireNonBlank(bucket, "bucket");
        String sourcePrefix = prefix == null ? "" : prefix;

        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder()
                .bucket(bucket)
                .delimiter(DELIMITER);
        if (!sourcePrefix.isEmpty()) {
            request.prefix(sourcePrefix);
        }

        ListObjectsV2Response response = s3ClientTemplate.execute("ListObjectsV2", client -> {
            try {
                return client.listObjectsV2(request.build());
            } catch (SdkException e) {
                log.error("[Objects] Failed to list objects - bucket: {}, prefix: {}", bucket, sourcePrefix, e);
                throw new ApiException(ErrorCode.OBJECT_LISTING_FAILED,
                        "Objects listing failed: " + e.getMessage(), e);
            }
        });

        List<ObjectDto.ObjectEntry> entries = new ArrayList<>();
        if (response.hasContents()) {
            for (S3Object content : response.contents()) {
                addEntry(entries, content.key(), sourcePrefix, false);
            }
        }
        if (response.hasCommonPrefixes()) {
            for (CommonPrefix commonPrefix : response.commonPrefixes()) {
                addEntry(entries, commonPrefix.prefix(), sourcePrefix, true);
            }
        }

        log.debug("[Objects] Listed {} entries - bucket: {}, prefix: {}", entries.size(), bucket, sourcePrefix);
        return entries;
    }

    private void addEntry(List<ObjectDto.ObjectEntry> entries, String key, String prefix, boolean directory) {
        String path = stripPrefix(key, prefix);
        // prefix 자체 (디렉토리 마커) 는 제외
        if (path.isEmpty()) {
            return;
        }
        entries.add(ObjectDto.ObjectEntry.builder()
                .path(path)
                .isDirectory(directory)
                .build());
    }

    static String stripPrefix(String key, String prefix) {
        if (key == null) {
            return "";
        }
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        int prefixLength = prefix.getBytes(StandardCharsets.UTF_8).length;
        if (prefixLength >= keyBytes.length) {
            return "";
        }
        return new String(keyBytes, prefixLength, keyBytes.length - prefixLength, StandardCharsets.UTF_8);
    }
}
