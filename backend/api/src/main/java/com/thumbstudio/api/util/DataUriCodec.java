package com.thumbstudio.api.util;

import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;

import java.util.Base64;

/**
 * Converts between raw image bytes and base64 strings or {@code data:} URIs.
 */
public final class DataUriCodec {

    private static final String DATA_PREFIX = "data:";

    private DataUriCodec() {
    }

    /**
     * Accepts plain base64 or {@code data:<mime>;base64,<payload>}.
     *
     * @throws ApiException IMAGE_DECODE_FAILED when the payload is missing or not base64
     */
    public static byte[] decode(String imageData) {
        if (imageData == null || imageData.isBlank()) {
            throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "imageData is empty");
        }
        String payload = imageData.trim();
        if (payload.startsWith(DATA_PREFIX)) {
            int comma = payload.indexOf(',');
            if (comma < 0) {
                throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "Malformed data URI: missing ','");
            }
            payload = payload.substring(comma + 1);
        }
        try {
            return Base64.getMimeDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "imageData is not valid base64", e);
        }
    }

    public static String encode(byte[] data, String contentType) {
        return DATA_PREFIX + contentType + ";base64," + Base64.getEncoder().encodeToString(data);
    }
}
