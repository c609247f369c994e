package com.s3signer.api.config;

import com.s3signer.common.dto.ApiResponse;
import com.s3signer.common.exception.ApiException;
import com.s3signer.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.UUID;

/**
 * 전역 예외 처리기
 * - 422: 파라미터 누락 / 형식 오류 (S3 호출 전 단계)
 * - 404: 등록되지 않은 경로 또는 메서드
 * - 500: S3 작업 실패 / 설정 오류
 * 재시도는 하지 않으며, 어떤 예외도 프로세스를 중단시키지 않는다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException 처리 - 비즈니스 로직 예외
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] {} ({}) - {} - {}", requestId, errorCode.getCode(), errorCode.name(),
                    e.getMessage(), request.getDescription(false), e);
        } else {
            log.warn("[{}] {} ({}) - {} - {}", requestId, errorCode.getCode(), errorCode.name(),
                    e.getMessage(), request.getDescription(false));
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * 요청 파라미터 / 본문 오류 - 422
     */
    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleInvalidRequest(Exception e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Invalid request - {} - {}", requestId, e.getMessage(), request.getDescription(false));

        return ResponseEntity
                .status(ErrorCode.INVALID_PARAMETER.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_PARAMETER,
                        buildUserMessage(ErrorCode.INVALID_PARAMETER, invalidRequestMessage(e), requestId)));
    }

    /**
     * 등록되지 않은 경로 / 메서드 - 404
     */
    @ExceptionHandler({
            NoHandlerFoundException.class,
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleNotFound(Exception e, WebRequest request) {
        log.debug("Route not found - {}", request.getDescription(false));
        return ResponseEntity
                .status(ErrorCode.NOT_FOUND.getStatus())
                .body(ApiResponse.error(ErrorCode.NOT_FOUND));
    }

    /**
     * 일반 Exception 처리 - 예상치 못한 예외
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e, WebRequest request) {
        String requestId = generateRequestId();

        log.error("=== Unexpected Exception ===");
        log.error("Request ID: {}", requestId);
        log.error("Exception Type: {}", e.getClass().getName());
        log.error("Message: {}", e.getMessage());
        log.error("Request URI: {}", request.getDescription(false));
        log.error("Stack Trace: ", e);
        log.error("============================");

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR,
                        String.format("%s [%s]", ErrorCode.INTERNAL_SERVER_ERROR.getMessage(), requestId)));
    }

    /**
     * 요청 ID 생성 (오류 추적용)
     */
    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }

    private String invalidRequestMessage(Exception e) {
        if (e instanceof MissingServletRequestParameterException missing) {
            return "Missing required parameter: " + missing.getParameterName();
        }
        if (e instanceof MethodArgumentTypeMismatchException mismatch) {
            return "Invalid parameter: " + mismatch.getName();
        }
        if (e instanceof HttpMessageNotReadableException) {
            return "Malformed request body";
        }
        return ErrorCode.INVALID_PARAMETER.getMessage();
    }
}
