package com.s3signer.api.service.sign;

import com.s3signer.api.model.ObjectRef;
import com.s3signer.api.model.PresignedUrl;
import com.s3signer.common.enums.SignOperation;

/**
 * 서명 URL 생성 서비스
 * 네트워크 호출 없이 S3 설정과 입력값만으로 URL을 생성한다.
 */
public interface PresignService {

    /**
     * 서명 URL 생성
     * @param operation GET / PUT / UPLOAD_PART
     * @param objectRef 대상 객체
     * @param uploadId 멀티파트 업로드 ID (UPLOAD_PART 전용)
     * @param partNumber 파트 번호, 1 이상 (UPLOAD_PART 전용)
     * @return 설정된 만료 시간 동안 유효한 URL
     */
    PresignedUrl sign(SignOperation operation, ObjectRef objectRef, String uploadId, Integer partNumber);

    default PresignedUrl signGet(ObjectRef objectRef) {
        return sign(SignOperation.GET, objectRef, null, null);
    }

    default PresignedUrl signPut(ObjectRef objectRef) {
        return sign(SignOperation.PUT, objectRef, null, null);
    }

    default PresignedUrl signUploadPart(ObjectRef objectRef, String uploadId, int partNumber) {
        return sign(SignOperation.UPLOAD_PART, objectRef, uploadId, partNumber);
    }
}
