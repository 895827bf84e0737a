package com.thumbstudio.api.controller;

import com.thumbstudio.api.dto.OverlayDto;
import com.thumbstudio.api.service.TextOverlayService;
import com.thumbstudio.api.service.image.ImageCodec;
import com.thumbstudio.api.service.overlay.GradientCompositor;
import com.thumbstudio.api.service.overlay.PositionSpec;
import com.thumbstudio.api.service.overlay.TextColors;
import com.thumbstudio.api.service.overlay.TextLayoutEngine;
import com.thumbstudio.api.service.overlay.TextStyleConfig;
import com.thumbstudio.api.util.DataUriCodec;
import com.thumbstudio.common.color.RgbColor;
import com.thumbstudio.common.dto.ApiResponse;
import com.thumbstudio.common.enums.ColorScheme;
import com.thumbstudio.common.enums.FontPreset;
import com.thumbstudio.common.enums.GradientDirection;
import com.thumbstudio.common.enums.TextPosition;
import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Text overlay API controller.
 * Images travel as base64 or data URIs; results are returned as data URIs.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/text-overlay")
@Tag(name = "TextOverlay", description = "Thumbnail text overlay API")
public class TextOverlayController {

    private final TextOverlayService textOverlayService;
    private final ImageCodec imageCodec;

    @PostMapping
    @Operation(summary = "Add text overlay", description = "Draws styled text onto the image, on top of a bottom gradient unless addGradient=false.")
    public ApiResponse<OverlayDto.ImageResponse> addTextOverlay(@RequestBody OverlayDto.TextOverlayRequest request) {
        long startedAt = System.currentTimeMillis();
        log.info("[TextOverlay] Compose - font: {}, colors: {}, position: {}, gradient: {}",
                request.getFontPreset(), request.getColorScheme(), request.getPosition(), request.getAddGradient());

        byte[] image = DataUriCodec.decode(request.getImageData());
        TextStyleConfig config = toStyleConfig(request);
        byte[] result = Boolean.FALSE.equals(request.getAddGradient())
                ? textOverlayService.composeTextOverlay(image, config)
                : textOverlayService.composeWithGradient(image, config, GradientDirection.BOTTOM,
                        GradientCompositor.DEFAULT_PEAK_OPACITY, GradientCompositor.DEFAULT_BAND_HEIGHT_RATIO);

        return ApiResponse.success(toImageResponse(result, startedAt));
    }

    @PostMapping("/batch")
    @Operation(summary = "Add several text layers", description = "Applies text layers in order, each on the previous result.")
    public ApiResponse<OverlayDto.ImageResponse> addTextLayers(@RequestBody OverlayDto.BatchOverlayRequest request) {
        long startedAt = System.currentTimeMillis();
        if (request.getLayers() == null || request.getLayers().isEmpty()) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG, "layers must contain at least one entry");
        }
        log.info("[TextOverlay] Batch - layers: {}, gradient: {}", request.getLayers().size(), request.getAddGradient());

        byte[] image = DataUriCodec.decode(request.getImageData());
        List<TextStyleConfig> layers = request.getLayers().stream()
                .map(layer -> layer == null ? null : toStyleConfig(layer))
                .collect(Collectors.toList());
        byte[] result = Boolean.TRUE.equals(request.getAddGradient())
                ? textOverlayService.composeBatchWithGradient(image, layers, GradientDirection.BOTTOM,
                        GradientCompositor.DEFAULT_PEAK_OPACITY, GradientCompositor.DEFAULT_BAND_HEIGHT_RATIO)
                : textOverlayService.composeBatch(image, layers);

        return ApiResponse.success(toImageResponse(result, startedAt));
    }

    @PostMapping("/gradient")
    @Operation(summary = "Add contrast gradient", description = "Darkens the top or bottom edge with a black alpha ramp.")
    public ApiResponse<OverlayDto.ImageResponse> addGradient(@RequestBody OverlayDto.GradientRequest request) {
        long startedAt = System.currentTimeMillis();
        GradientDirection direction = GradientDirection.fromCode(request.getDirection());
        double peakOpacity = request.getPeakOpacity() != null
                ? request.getPeakOpacity() : GradientCompositor.DEFAULT_PEAK_OPACITY;
        double bandHeightRatio = request.getBandHeightRatio() != null
                ? request.getBandHeightRatio() : GradientCompositor.DEFAULT_BAND_HEIGHT_RATIO;
        log.info("[TextOverlay] Gradient - direction: {}, peakOpacity: {}, bandHeightRatio: {}",
                direction.getCode(), peakOpacity, bandHeightRatio);

        byte[] result = textOverlayService.applyGradient(
                DataUriCodec.decode(request.getImageData()), direction, peakOpacity, bandHeightRatio);
        return ApiResponse.success(toImageResponse(result, startedAt));
    }

    @GetMapping("/presets")
    @Operation(summary = "List presets", description = "Font presets, color schemes and position presets.")
    public ApiResponse<OverlayDto.PresetsResponse> getPresets() {
        List<OverlayDto.FontPresetInfo> fonts = Arrays.stream(FontPreset.values())
                .map(preset -> OverlayDto.FontPresetInfo.builder()
                        .code(preset.getCode())
                        .primaryFamily(preset.getPrimaryFamily())
                        .fallbackFamilies(preset.getFallbackFamilies())
                        .bold(preset.isBold())
                        .build())
                .collect(Collectors.toList());
        List<OverlayDto.ColorSchemeInfo> colors = Arrays.stream(ColorScheme.values())
                .map(scheme -> OverlayDto.ColorSchemeInfo.builder()
                        .code(scheme.getCode())
                        .fill(scheme.getFillHex())
                        .stroke(scheme.getStrokeHex())
                        .shadow(scheme.getShadowHex())
                        .build())
                .collect(Collectors.toList());
        List<OverlayDto.PositionInfo> positions = Arrays.stream(TextPosition.values())
                .map(position -> OverlayDto.PositionInfo.builder()
                        .code(position.getCode())
                        .x(position.getXRatio())
                        .y(position.getYRatio())
                        .build())
                .collect(Collectors.toList());

        return ApiResponse.success(OverlayDto.PresetsResponse.builder()
                .fontPresets(fonts)
                .colorSchemes(colors)
                .positions(positions)
                .build());
    }

    private TextStyleConfig toStyleConfig(OverlayDto.TextLayer layer) {
        String text = layer.getText() == null ? "" : layer.getText();
        if (!Boolean.FALSE.equals(layer.getUppercase())) {
            text = text.toUpperCase(Locale.ROOT);
        }

        PositionSpec position = layer.getCustomPosition() != null
                ? PositionSpec.custom(layer.getCustomPosition().getX(), layer.getCustomPosition().getY())
                : PositionSpec.preset(TextPosition.fromCode(layer.getPosition()));

        return TextStyleConfig.builder()
                .text(text)
                .position(position)
                .fontPreset(FontPreset.fromCode(layer.getFontPreset()))
                .colorScheme(ColorScheme.fromCode(layer.getColorScheme()))
                .customColors(toCustomColors(layer.getCustomColors(), ColorScheme.fromCode(layer.getColorScheme())))
                .fontSize(layer.getFontSize())
                .strokeWidth(layer.getStrokeWidth() != null ? layer.getStrokeWidth() : TextStyleConfig.DEFAULT_STROKE_WIDTH)
                .shadowOffset(layer.getShadowOffset() != null ? layer.getShadowOffset() : TextStyleConfig.DEFAULT_SHADOW_OFFSET)
                .maxWidthRatio(layer.getMaxWidthRatio() != null ? layer.getMaxWidthRatio() : TextLayoutEngine.DEFAULT_MAX_WIDTH_RATIO)
                .build();
    }

    /**
     * Missing entries in the override keep the scheme's color.
     */
    private TextColors toCustomColors(OverlayDto.ColorOverride override, ColorScheme scheme) {
        if (override == null) {
            return null;
        }
        try {
            return new TextColors(
                    override.getFill() != null ? RgbColor.fromHex(override.getFill()) : scheme.getFill(),
                    override.getStroke() != null ? RgbColor.fromHex(override.getStroke()) : scheme.getStroke(),
                    override.getShadow() != null ? RgbColor.fromHex(override.getShadow()) : scheme.getShadow());
        } catch (IllegalArgumentException e) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG, "Invalid custom color: " + e.getMessage(), e);
        }
    }

    private OverlayDto.ImageResponse toImageResponse(byte[] image, long startedAt) {
        return OverlayDto.ImageResponse.builder()
                .image(DataUriCodec.encode(image, imageCodec.getContentType()))
                .contentType(imageCodec.getContentType())
                .elapsedMs(System.currentTimeMillis() - startedAt)
                .build();
    }
}
