package com.thumbstudio.api.config;

import com.thumbstudio.common.dto.ApiResponse;
import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.UUID;

/**
 * Global exception handler.
 * - every error is answered with an {@link ApiResponse} envelope
 * - a short request ID is logged and returned for correlation
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * ApiException: decode/encode failures and rejected overlay configs
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e, WebRequest request) {
        String requestId = generateRequestId();
        ErrorCode errorCode = e.getErrorCode();

        if (errorCode.getStatus().is5xxServerError()) {
            log.error("[{}] API Exception {} ({}) on {}: {}", requestId, errorCode.getCode(), errorCode.name(),
                    request.getDescription(false), e.getMessage(), e);
        } else {
            log.warn("[{}] API Exception {} ({}) on {}: {}", requestId, errorCode.getCode(), errorCode.name(),
                    request.getDescription(false), e.getMessage());
        }

        return ResponseEntity
                .status(errorCode.getStatus())
                .body(ApiResponse.error(errorCode, buildUserMessage(errorCode, e.getMessage(), requestId)));
    }

    /**
     * Unreadable JSON body
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException e, WebRequest request) {
        String requestId = generateRequestId();
        log.warn("[{}] Unreadable request body on {}: {}", requestId, request.getDescription(false), e.getMessage());

        return ResponseEntity
                .status(ErrorCode.INVALID_REQUEST.getStatus())
                .body(ApiResponse.error(ErrorCode.INVALID_REQUEST,
                        buildUserMessage(ErrorCode.INVALID_REQUEST, null, requestId)));
    }

    /**
     * Anything else
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

        String userMessage = String.format(
            "An unexpected error occurred. [Request ID: %s]",
            requestId
        );

        return ResponseEntity
                .status(ErrorCode.INTERNAL_SERVER_ERROR.getStatus())
                .body(ApiResponse.error(ErrorCode.INTERNAL_SERVER_ERROR, userMessage));
    }

    private String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }

    private String buildUserMessage(ErrorCode errorCode, String message, String requestId) {
        if (message != null && !message.equals(errorCode.getMessage())) {
            return String.format("%s [%s]", message, requestId);
        }
        return String.format("%s [%s]", errorCode.getMessage(), requestId);
    }
}
