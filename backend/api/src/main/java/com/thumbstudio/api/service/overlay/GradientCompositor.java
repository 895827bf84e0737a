package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.GradientDirection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Darkens the top or bottom edge with a linear alpha ramp to lift contrast under text.
 */
@Slf4j
@Component
public class GradientCompositor {

    public static final double DEFAULT_PEAK_OPACITY = 0.5;
    public static final double DEFAULT_BAND_HEIGHT_RATIO = 0.35;

    public GradientBand band(int canvasHeight, GradientDirection direction, double peakOpacity, double bandHeightRatio) {
        GradientDirection effective = direction != null ? direction : GradientDirection.DEFAULT;
        int height = (int) Math.min(canvasHeight, Math.round(canvasHeight * bandHeightRatio));
        int startRow = effective == GradientDirection.BOTTOM ? canvasHeight - height : 0;
        return new GradientBand(effective, startRow, height, peakOpacity);
    }

    /**
     * Blends the band over an ARGB base in place.
     */
    public BufferedImage apply(BufferedImage argbBase, GradientBand band) {
        if (band.height() <= 0) {
            return argbBase;
        }
        int width = argbBase.getWidth();
        BufferedImage layer = Rasters.transparent(width, band.height());
        int[] row = new int[width];
        for (int y = 0; y < band.height(); y++) {
            Arrays.fill(row, band.alphaAt(y) << 24);
            layer.setRGB(0, y, width, 1, row, 0, width);
        }
        Rasters.compositeOver(argbBase, layer, 0, band.startRow());

        log.debug("[Gradient] direction={} rows={}..{} peakOpacity={}",
                band.direction().getCode(), band.startRow(), band.endRow(), band.peakOpacity());
        return argbBase;
    }

    public BufferedImage apply(BufferedImage argbBase, GradientDirection direction, double peakOpacity, double bandHeightRatio) {
        return apply(argbBase, band(argbBase.getHeight(), direction, peakOpacity, bandHeightRatio));
    }
}
