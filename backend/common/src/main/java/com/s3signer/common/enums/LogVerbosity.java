package com.s3signer.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 실행 옵션 verbose 단계 (0~4) 와 로그 레벨 매핑
 */
@Getter
@RequiredArgsConstructor
public enum LogVerbosity {

    ERROR(0, "ERROR"),
    WARN(1, "WARN"),
    INFO(2, "INFO"),
    DEBUG(3, "DEBUG"),
    TRACE(4, "TRACE");

    private final int level;
    private final String levelName;

    /**
     * 범위를 벗어난 값은 가장 가까운 단계로 맞춘다 (음수는 ERROR, 4 이상은 TRACE)
     */
    public static LogVerbosity fromLevel(int level) {
        for (LogVerbosity verbosity : values()) {
            if (verbosity.level == level) {
                return verbosity;
            }
        }
        return level < 0 ? ERROR : TRACE;
    }
}
