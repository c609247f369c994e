package com.s3signer.api.service.multipart;

import com.s3signer.api.dto.MultipartUploadDto;
import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;

import java.util.List;

/**
 * 멀티파트 업로드 3단계 (생성 → 파트 URL 발급 → 완료 또는 중단)
 *
 * 각 단계는 독립된 요청이며 서버는 업로드 상태를 보관하지 않는다.
 * 업로드의 유일한 진실 공급원은 S3 이고, 단계 순서는 클라이언트가 결정한다.
 */
public interface MultipartUploadService {

    /**
     * 업로드 생성
     * @return S3가 발급한 uploadId
     */
    String createUpload(ObjectRef objectRef);

    /**
     * 파트 업로드용 서명 URL (순서 / 중복 검증 없음)
     */
    PresignedUrl partUploadUrl(ObjectRef objectRef, String uploadId, int partNumber);

    /**
     * 업로드 완료 - 파트 목록을 그대로 S3에 전달 (빈 목록 포함)
     */
    void complete(ObjectRef objectRef, String uploadId, List<MultipartUploadDto.CompletedUploadPart> parts);

    /**
     * 업로드 중단 - 이미 완료 / 중단된 업로드 처리는 S3 동작을 따른다
     */
    void abort(ObjectRef objectRef, String uploadId);
}
