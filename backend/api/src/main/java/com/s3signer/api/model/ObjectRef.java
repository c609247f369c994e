package com.s3signer.api.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 대상 객체 식별자 (bucket + key)
 * 키는 정규화하지 않고 그대로 전달한다.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(staticName = "of")
public class ObjectRef {

    private final String bucket;
    private final String key;

    @Override
    public String toString() {
        return bucket + "/" + key;
    }
}
