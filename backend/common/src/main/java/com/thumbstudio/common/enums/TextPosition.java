package com.thumbstudio.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Named anchor points for the center of a text block, as image-relative ratios.
 */
@Getter
@RequiredArgsConstructor
public enum TextPosition {

    TOP_LEFT("top_left", 0.05, 0.1),
    TOP_CENTER("top_center", 0.5, 0.1),
    TOP_RIGHT("top_right", 0.95, 0.1),
    CENTER("center", 0.5, 0.5),
    BOTTOM_LEFT("bottom_left", 0.05, 0.85),
    BOTTOM_CENTER("bottom_center", 0.5, 0.85),
    BOTTOM_RIGHT("bottom_right", 0.95, 0.85);

    public static final TextPosition DEFAULT = BOTTOM_CENTER;

    private final String code;
    private final double xRatio;
    private final double yRatio;

    /**
     * Unknown or missing codes resolve to {@link #DEFAULT}.
     */
    public static TextPosition fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (TextPosition position : values()) {
            if (position.code.equals(normalized)) {
                return position;
            }
        }
        return DEFAULT;
    }
}
