package com.s3signer.api.config;

import com.s3signer.common.enums.LogVerbosity;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Configuration;

/**
 * 실행 옵션 verbose (0~4) 를 루트 로그 레벨에 적용
 * 0=ERROR, 1=WARN, 2=INFO, 3=DEBUG, 4 이상=TRACE
 */
@Slf4j
@Configuration
public class LoggingConfig {

    private final LoggingSystem loggingSystem;
    private final LogVerbosity verbosity;

    public LoggingConfig(LoggingSystem loggingSystem, @Value("${s3-signer.verbose:0}") int verbose) {
        this.loggingSystem = loggingSystem;
        this.verbosity = LogVerbosity.fromLevel(verbose);
    }

    @PostConstruct
    public void applyVerbosity() {
        loggingSystem.setLogLevel(LoggingSystem.ROOT_LOGGER_NAME, LogLevel.valueOf(verbosity.getLevelName()));
        log.info("Log level set to {} (verbose: {})", verbosity.getLevelName(), verbosity.getLevel());
    }

    public LogVerbosity getVerbosity() {
        return verbosity;
    }
}
