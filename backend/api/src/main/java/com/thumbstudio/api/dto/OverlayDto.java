package com.thumbstudio.api.dto;

import lombok.*;

import java.util.List;

/**
 * Text overlay API DTOs
 */
public class OverlayDto {

    // ========== Requests ==========

    /**
     * Styling for one text layer. Preset codes are case-insensitive; unknown codes fall back to defaults.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TextLayer {
        private String text;
        private String position;             // preset code, default bottom_center
        private PositionRatio customPosition; // overrides position when set
        private String fontPreset;           // impact, modern, dramatic, clean
        private String colorScheme;          // white_shadow, yellow_pop, red_alert, blue_trust, green_success
        private ColorOverride customColors;  // overrides colorScheme when set
        private Integer fontSize;            // null = dynamic
        private Integer strokeWidth;         // default 4
        private Integer shadowOffset;        // default 5
        private Double maxWidthRatio;        // default 0.9
        private Boolean uppercase;           // default true
    }

    /**
     * Single-layer overlay, optionally on top of the default bottom gradient
     */
    @Getter
    @Setter
    @NoArgsConstructor
    public static class TextOverlayRequest extends TextLayer {
        private String imageData;            // base64 or data URI
        private Boolean addGradient;         // default true
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchOverlayRequest {
        private String imageData;
        private List<TextLayer> layers;
        private Boolean addGradient;         // default false
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GradientRequest {
        private String imageData;
        private String direction;            // top or bottom, default bottom
        private Double peakOpacity;          // default 0.5
        private Double bandHeightRatio;      // default 0.35
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionRatio {
        private double x;
        private double y;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColorOverride {
        private String fill;                 // #RRGGBB
        private String stroke;
        private String shadow;
    }

    // ========== Responses ==========

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageResponse {
        private String image;                // data URI
        private String contentType;
        private long elapsedMs;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PresetsResponse {
        private List<FontPresetInfo> fontPresets;
        private List<ColorSchemeInfo> colorSchemes;
        private List<PositionInfo> positions;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FontPresetInfo {
        private String code;
        private String primaryFamily;
        private List<String> fallbackFamilies;
        private boolean bold;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ColorSchemeInfo {
        private String code;
        private String fill;
        private String stroke;
        private String shadow;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PositionInfo {
        private String code;
        private double x;
        private double y;
    }
}
