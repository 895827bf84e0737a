package com.thumbstudio.api.service.overlay;

import java.awt.Color;
import java.awt.Graphics2D;

/**
 * A font bound to a concrete pixel size that can measure and draw text.
 * Text passed to {@link #measure} and {@link #draw} may span several lines separated by {@code '\n'}.
 */
public interface FontFace {

    /**
     * Advance width of a single line in pixels.
     */
    int lineWidth(String line);

    /**
     * Bounding box of a (possibly multi-line) block: widest line by total block height.
     */
    TextBounds measure(String text);

    /**
     * Draws the block with its top-left corner at (x, y), each line centered within the block width.
     */
    void draw(Graphics2D surface, int x, int y, String text, Color color);
}
