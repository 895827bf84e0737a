package com.thumbstudio.common.enums;

import com.thumbstudio.common.color.RgbColor;
import lombok.Getter;

import java.util.Locale;

/**
 * Text color schemes (fill, stroke, shadow).
 */
@Getter
public enum ColorScheme {

    WHITE_SHADOW("white_shadow", "#FFFFFF", "#000000", "#000000"),
    YELLOW_POP("yellow_pop", "#FFFF00", "#000000", "#000000"),
    RED_ALERT("red_alert", "#FF0000", "#FFFFFF", "#000000"),
    BLUE_TRUST("blue_trust", "#00BFFF", "#000000", "#000000"),
    GREEN_SUCCESS("green_success", "#00FF00", "#000000", "#000000");

    public static final ColorScheme DEFAULT = WHITE_SHADOW;

    private final String code;
    private final String fillHex;
    private final String strokeHex;
    private final String shadowHex;
    private final RgbColor fill;
    private final RgbColor stroke;
    private final RgbColor shadow;

    ColorScheme(String code, String fillHex, String strokeHex, String shadowHex) {
        this.code = code;
        this.fillHex = fillHex;
        this.strokeHex = strokeHex;
        this.shadowHex = shadowHex;
        this.fill = RgbColor.fromHex(fillHex);
        this.stroke = RgbColor.fromHex(strokeHex);
        this.shadow = RgbColor.fromHex(shadowHex);
    }

    /**
     * Unknown or missing codes resolve to {@link #DEFAULT}.
     */
    public static ColorScheme fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (ColorScheme scheme : values()) {
            if (scheme.code.equals(normalized)) {
                return scheme;
            }
        }
        return DEFAULT;
    }
}
