package com.thumbstudio.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // Common
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C001", "An internal server error occurred."),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "C002", "Invalid request."),

    // Image codec
    IMAGE_DECODE_FAILED(HttpStatus.BAD_REQUEST, "I001", "The input is not a decodable image."),
    IMAGE_ENCODE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "I002", "Failed to encode the output image."),

    // Text overlay
    INVALID_OVERLAY_CONFIG(HttpStatus.BAD_REQUEST, "T001", "Invalid text overlay configuration.");

    private final HttpStatus status;
    private final String code;
    private final String message;
}
