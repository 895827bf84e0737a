package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.TextPosition;

/**
 * Anchor for the center of a text block, as ratios of the canvas size.
 * Either a named preset or a custom pair; custom ratios are clamped to [0, 1].
 *
 * @param preset named preset, {@code null} for a custom pair
 */
public record PositionSpec(TextPosition preset, double xRatio, double yRatio) {

    public static PositionSpec preset(TextPosition position) {
        TextPosition effective = position != null ? position : TextPosition.DEFAULT;
        return new PositionSpec(effective, effective.getXRatio(), effective.getYRatio());
    }

    public static PositionSpec custom(double xRatio, double yRatio) {
        return new PositionSpec(null,
                clamp(xRatio, TextPosition.DEFAULT.getXRatio()),
                clamp(yRatio, TextPosition.DEFAULT.getYRatio()));
    }

    public static PositionSpec defaults() {
        return preset(TextPosition.DEFAULT);
    }

    public boolean isCustom() {
        return preset == null;
    }

    private static double clamp(double ratio, double fallback) {
        if (Double.isNaN(ratio)) {
            return fallback;
        }
        return Math.max(0.0, Math.min(1.0, ratio));
    }
}
