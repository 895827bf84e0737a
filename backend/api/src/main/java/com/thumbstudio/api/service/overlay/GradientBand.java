package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.GradientDirection;

/**
 * Black band along the top or bottom edge whose alpha ramps row by row.
 *
 * @param direction   edge the band sits on
 * @param startRow    first image row covered by the band
 * @param height      band height in rows
 * @param peakOpacity opacity at the edge, in [0, 1]
 */
public record GradientBand(GradientDirection direction, int startRow, int height, double peakOpacity) {

    /**
     * Alpha for a row counted from the band's top edge.
     * Bottom bands go from 0 up to the peak at the image edge; top bands are the mirror.
     */
    public int alphaAt(int bandRow) {
        double progress = (double) bandRow / height;
        double fraction = direction == GradientDirection.BOTTOM ? progress : 1.0 - progress;
        return (int) Math.round(255 * peakOpacity * fraction);
    }

    /**
     * Alpha for an image row, 0 outside the band.
     */
    public int alphaAtImageRow(int imageRow) {
        if (height <= 0 || imageRow < startRow || imageRow >= startRow + height) {
            return 0;
        }
        return alphaAt(imageRow - startRow);
    }

    public int endRow() {
        return startRow + height - 1;
    }
}
