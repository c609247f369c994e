package com.s3signer.api.service.listing;

import com.s3signer.api.dto.ObjectDto;

import java.util.List;

/**
 * 버킷의 평면 키 공간을 디렉토리 형태로 조회
 */
public interface ObjectListingService {

    /**
     * prefix 바로 아래의 객체와 하위 디렉토리 조회
     * @param bucket 버킷 이름
     * @param prefix 조회 prefix (null 이면 루트), 보통 '/'로 끝나야 한다
     * @return 객체 항목 다음에 디렉토리 항목 순서
     */
    List<ObjectDto.ObjectEntry> list(String bucket, String prefix);
}
