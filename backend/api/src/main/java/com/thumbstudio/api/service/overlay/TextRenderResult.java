package com.thumbstudio.api.service.overlay;

import java.awt.image.BufferedImage;

/**
 * Opaque output of one text pass plus what was drawn. {@code layout} and {@code placement}
 * are {@code null} when there was no text to draw.
 */
public record TextRenderResult(BufferedImage image, LaidOutText layout, TextPlacement placement) {

    public boolean drewText() {
        return placement != null;
    }
}
