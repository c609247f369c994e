package com.s3signer.api.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 멀티파트 업로드 DTO
 * 서버는 업로드 상태를 저장하지 않으므로 uploadId / 파트 목록은 항상 클라이언트가 전달한다.
 */
public class MultipartUploadDto {

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CreateUploadResponse {
        private String uploadId;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartUploadResponse {
        private String presignedUrl;
    }

    /**
     * 중단 / 완료 요청 본문 - action 필드로 구분
     * {"action": "Abort"} 또는 {"action": "Complete", "parts": [...]}
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = AbortRequest.class, name = "Abort"),
            @JsonSubTypes.Type(value = CompleteRequest.class, name = "Complete")
    })
    public abstract static class AbortOrCompleteRequest {
    }

    @NoArgsConstructor
    public static class AbortRequest extends AbortOrCompleteRequest {
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompleteRequest extends AbortOrCompleteRequest {
        private List<CompletedUploadPart> parts;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CompletedUploadPart {
        private Integer number;
        private String etag;
    }
}
