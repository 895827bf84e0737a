package com.thumbstudio.api.service.overlay;

import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Raster conversions and "over" compositing shared by the compositors.
 */
public final class Rasters {

    private Rasters() {
    }

    /**
     * Copy of the image as {@code TYPE_INT_ARGB}.
     */
    public static BufferedImage toArgb(BufferedImage source) {
        BufferedImage argb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2d = argb.createGraphics();
        try {
            g2d.setComposite(AlphaComposite.Src);
            g2d.drawImage(source, 0, 0, null);
        } finally {
            g2d.dispose();
        }
        return argb;
    }

    /**
     * Fully transparent canvas of the given size.
     */
    public static BufferedImage transparent(int width, int height) {
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    /**
     * Draws {@code layer} over {@code base} at (x, y) using the layer's per-pixel alpha.
     */
    public static void compositeOver(BufferedImage base, BufferedImage layer, int x, int y) {
        Graphics2D g2d = base.createGraphics();
        try {
            g2d.setComposite(AlphaComposite.SrcOver);
            g2d.drawImage(layer, x, y, null);
        } finally {
            g2d.dispose();
        }
    }

    /**
     * Opaque 3-channel copy: color channels are kept and alpha is dropped.
     */
    public static BufferedImage flatten(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            source.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0x00FFFFFF;
            }
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }
}
