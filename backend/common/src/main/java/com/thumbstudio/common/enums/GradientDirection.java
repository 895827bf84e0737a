package com.thumbstudio.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Image edge a contrast gradient is anchored to.
 */
@Getter
@RequiredArgsConstructor
public enum GradientDirection {

    TOP("top"),
    BOTTOM("bottom");

    public static final GradientDirection DEFAULT = BOTTOM;

    private final String code;

    public static GradientDirection fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        return "top".equals(code.trim().toLowerCase(Locale.ROOT)) ? TOP : DEFAULT;
    }
}
