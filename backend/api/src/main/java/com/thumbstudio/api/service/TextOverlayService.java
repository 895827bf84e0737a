package com.thumbstudio.api.service;

import com.thumbstudio.api.service.image.ImageCodec;
import com.thumbstudio.api.service.overlay.FontResolver;
import com.thumbstudio.api.service.overlay.GlyphCompositor;
import com.thumbstudio.api.service.overlay.GradientCompositor;
import com.thumbstudio.api.service.overlay.LaidOutText;
import com.thumbstudio.api.service.overlay.Rasters;
import com.thumbstudio.api.service.overlay.ResolvedFont;
import com.thumbstudio.api.service.overlay.TextLayoutEngine;
import com.thumbstudio.api.service.overlay.TextPlacement;
import com.thumbstudio.api.service.overlay.TextRenderResult;
import com.thumbstudio.api.service.overlay.TextStyleConfig;
import com.thumbstudio.common.enums.GradientDirection;
import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Thumbnail text compositing.
 * Per request: decode, optional gradient, resolve font, wrap, draw shadow/stroke/fill, flatten, encode.
 * Stateless apart from the shared font cache behind {@link FontResolver}; safe to call concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextOverlayService {

    private final FontResolver fontResolver;
    private final TextLayoutEngine layoutEngine;
    private final GlyphCompositor glyphCompositor;
    private final GradientCompositor gradientCompositor;
    private final ImageCodec imageCodec;

    /**
     * Draws {@code text} onto the image. Empty text draws nothing and returns the re-encoded input.
     *
     * @throws ApiException INVALID_OVERLAY_CONFIG, IMAGE_DECODE_FAILED or IMAGE_ENCODE_FAILED
     */
    public byte[] composeTextOverlay(byte[] image, String text, TextStyleConfig config) {
        TextStyleConfig effective = (config != null ? config.toBuilder() : TextStyleConfig.builder())
                .text(text)
                .build();
        return composeTextOverlay(image, effective);
    }

    public byte[] composeTextOverlay(byte[] image, TextStyleConfig config) {
        validate(config);
        BufferedImage base = imageCodec.decode(image);
        TextRenderResult result = renderText(base, config);
        return imageCodec.encode(result.image());
    }

    /**
     * Applies several text passes in order, each drawn on the previous pass's output.
     */
    public byte[] composeBatch(byte[] image, List<TextStyleConfig> layers) {
        validateLayers(layers);
        BufferedImage base = imageCodec.decode(image);
        return imageCodec.encode(renderLayers(base, layers));
    }

    /**
     * Gradient then every text pass, decoded and encoded once.
     */
    public byte[] composeBatchWithGradient(byte[] image, List<TextStyleConfig> layers,
                                           GradientDirection direction, double peakOpacity, double bandHeightRatio) {
        validateLayers(layers);
        validateGradient(peakOpacity, bandHeightRatio);
        BufferedImage base = imageCodec.decode(image);
        gradientCompositor.apply(base, direction, peakOpacity, bandHeightRatio);
        return imageCodec.encode(renderLayers(base, layers));
    }

    private BufferedImage renderLayers(BufferedImage argbBase, List<TextStyleConfig> layers) {
        BufferedImage current = argbBase;
        for (TextStyleConfig layer : layers) {
            current = Rasters.toArgb(renderText(current, layer).image());
        }
        log.info("[Overlay] Batch complete - layers: {}", layers.size());
        return Rasters.flatten(current);
    }

    /**
     * Darkens the top or bottom band of the image with a black alpha ramp.
     *
     * @throws ApiException INVALID_OVERLAY_CONFIG, IMAGE_DECODE_FAILED or IMAGE_ENCODE_FAILED
     */
    public byte[] applyGradient(byte[] image, GradientDirection direction, double peakOpacity, double bandHeightRatio) {
        validateGradient(peakOpacity, bandHeightRatio);
        BufferedImage base = imageCodec.decode(image);
        gradientCompositor.apply(base, direction, peakOpacity, bandHeightRatio);
        return imageCodec.encode(Rasters.flatten(base));
    }

    /**
     * Gradient then text, decoded and encoded once.
     */
    public byte[] composeWithGradient(byte[] image, TextStyleConfig config,
                                      GradientDirection direction, double peakOpacity, double bandHeightRatio) {
        validate(config);
        validateGradient(peakOpacity, bandHeightRatio);
        BufferedImage base = imageCodec.decode(image);
        gradientCompositor.apply(base, direction, peakOpacity, bandHeightRatio);
        return imageCodec.encode(renderText(base, config).image());
    }

    /**
     * Draws one text pass onto an ARGB base (modified in place) and returns the opaque result.
     */
    public TextRenderResult renderText(BufferedImage argbBase, TextStyleConfig config) {
        String text = config.getText();
        if (text == null || text.isEmpty()) {
            return new TextRenderResult(Rasters.flatten(argbBase), null, null);
        }

        int width = argbBase.getWidth();
        int height = argbBase.getHeight();
        int fontSize = config.getFontSize() != null
                ? config.getFontSize()
                : layoutEngine.computeFontSize(text, height);

        ResolvedFont font = fontResolver.resolve(config.getFontPreset(), fontSize);
        int maxWidth = layoutEngine.maxLineWidth(width, config.getMaxWidthRatio());
        LaidOutText layout = layoutEngine.layout(text, font, maxWidth);

        BufferedImage overlay = Rasters.transparent(width, height);
        TextPlacement placement = glyphCompositor.render(overlay, layout.text(), font.face(),
                config.resolveColors(), config.getStrokeWidth(), config.getShadowOffset(), config.resolvePosition());
        BufferedImage output = glyphCompositor.compositeAndFlatten(argbBase, overlay);

        log.info("[Overlay] {}x{} fontSize={} family='{}' ({}) lines={} placement=({},{} {}x{})",
                width, height, fontSize, font.family(), font.source(), layout.text().lineCount(),
                placement.x(), placement.y(), placement.width(), placement.height());
        return new TextRenderResult(output, layout, placement);
    }

    private void validateLayers(List<TextStyleConfig> layers) {
        if (layers == null) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG, "layers must not be null");
        }
        for (int i = 0; i < layers.size(); i++) {
            if (layers.get(i) == null) {
                throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG, "layers[" + i + "] must not be null");
            }
            validate(layers.get(i));
        }
    }

    private void validate(TextStyleConfig config) {
        if (config == null) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG, "config must not be null");
        }
        if (config.getFontSize() != null && config.getFontSize() <= 0) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG,
                    "fontSize must be a positive number of pixels: " + config.getFontSize());
        }
        double ratio = config.getMaxWidthRatio();
        if (Double.isNaN(ratio) || ratio <= 0.0 || ratio > 1.0) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG,
                    "maxWidthRatio must be in (0, 1]: " + ratio);
        }
    }

    private void validateGradient(double peakOpacity, double bandHeightRatio) {
        if (Double.isNaN(peakOpacity) || peakOpacity < 0.0 || peakOpacity > 1.0) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG,
                    "peakOpacity must be in [0, 1]: " + peakOpacity);
        }
        if (Double.isNaN(bandHeightRatio) || bandHeightRatio <= 0.0 || bandHeightRatio > 1.0) {
            throw new ApiException(ErrorCode.INVALID_OVERLAY_CONFIG,
                    "bandHeightRatio must be in (0, 1]: " + bandHeightRatio);
        }
    }
}
