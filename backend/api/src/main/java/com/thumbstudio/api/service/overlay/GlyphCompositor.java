package com.thumbstudio.api.service.overlay;

import org.springframework.stereotype.Component;

import java.awt.Graphics2D;
import java.awt.Point;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Draws text onto a transparent overlay in three passes: drop shadow, round outline, fill.
 * Every pass draws the whole (possibly multi-line) block.
 */
@Component
public class GlyphCompositor {

    public static final int MIN_MARGIN = 10;
    public static final int SHADOW_ALPHA = 128;
    // wider outlines are treated as disabled
    public static final int MAX_STROKE_WIDTH = 32;

    /**
     * Top-left origin for a block of the given size centered on the anchor, clamped so the
     * block keeps a {@value #MIN_MARGIN}px margin. On a canvas too small for both margins
     * the origin falls back to the minimum margin.
     */
    public TextPlacement place(TextBounds bounds, int canvasWidth, int canvasHeight, PositionSpec position) {
        double anchorX = canvasWidth * position.xRatio();
        double anchorY = canvasHeight * position.yRatio();

        int x = (int) (anchorX - bounds.width() / 2.0);
        int y = (int) (anchorY - bounds.height() / 2.0);

        x = Math.max(MIN_MARGIN, Math.min(x, canvasWidth - bounds.width() - MIN_MARGIN));
        y = Math.max(MIN_MARGIN, Math.min(y, canvasHeight - bounds.height() - MIN_MARGIN));
        return new TextPlacement(x, y, bounds.width(), bounds.height());
    }

    /**
     * Renders the wrapped text onto {@code overlay}.
     * A non-positive shadow offset or stroke width skips that pass, and so does a stroke width
     * above {@value #MAX_STROKE_WIDTH}.
     *
     * @return where the fill pass was drawn
     */
    public TextPlacement render(BufferedImage overlay, WrappedText text, FontFace face, TextColors colors,
                                int strokeWidth, int shadowOffset, PositionSpec position) {
        String block = text.text();
        TextPlacement placement = place(text.bounds(), overlay.getWidth(), overlay.getHeight(), position);
        int x = placement.x();
        int y = placement.y();

        Graphics2D g2d = overlay.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);

            // 1. Drop shadow
            if (shadowOffset > 0) {
                face.draw(g2d, x + shadowOffset, y + shadowOffset, block, colors.shadowColor(SHADOW_ALPHA));
            }

            // 2. Outline, one pass per offset in the disc
            if (isStrokeEnabled(strokeWidth)) {
                for (Point offset : strokeOffsets(strokeWidth)) {
                    face.draw(g2d, x + offset.x, y + offset.y, block, colors.strokeColor());
                }
            }

            // 3. Fill
            face.draw(g2d, x, y, block, colors.fillColor());
        } finally {
            g2d.dispose();
        }
        return placement;
    }

    /**
     * Composites the overlay onto an ARGB base in place and returns the opaque RGB result.
     */
    public BufferedImage compositeAndFlatten(BufferedImage argbBase, BufferedImage overlay) {
        Rasters.compositeOver(argbBase, overlay, 0, 0);
        return Rasters.flatten(argbBase);
    }

    public static boolean isStrokeEnabled(int strokeWidth) {
        return strokeWidth > 0 && strokeWidth <= MAX_STROKE_WIDTH;
    }

    /**
     * Integer offsets (dx, dy) with {@code dx*dx + dy*dy <= strokeWidth^2}, row by row.
     * Empty for a disabled stroke width.
     */
    public static List<Point> strokeOffsets(int strokeWidth) {
        if (!isStrokeEnabled(strokeWidth)) {
            return Collections.emptyList();
        }
        long radiusSquared = (long) strokeWidth * strokeWidth;
        List<Point> offsets = new ArrayList<>();
        for (int dx = -strokeWidth; dx <= strokeWidth; dx++) {
            for (int dy = -strokeWidth; dy <= strokeWidth; dy++) {
                if ((long) dx * dx + (long) dy * dy <= radiusSquared) {
                    offsets.add(new Point(dx, dy));
                }
            }
        }
        return offsets;
    }
}
