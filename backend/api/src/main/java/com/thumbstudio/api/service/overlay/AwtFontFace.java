package com.thumbstudio.api.service.overlay;

import lombok.Getter;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.font.FontRenderContext;
import java.awt.font.LineMetrics;

/**
 * {@link FontFace} backed by a Java2D {@link Font}.
 * Measurement uses the same antialiased, fractional-metrics context that {@link GlyphCompositor} draws with.
 */
@Getter
public class AwtFontFace implements FontFace {

    public static final int LINE_SPACING = 4;

    static final FontRenderContext RENDER_CONTEXT = new FontRenderContext(null, true, true);

    private final Font font;
    private final int ascent;
    private final int descent;

    public AwtFontFace(Font font) {
        this.font = font;
        LineMetrics metrics = font.getLineMetrics("Ag", RENDER_CONTEXT);
        this.ascent = (int) Math.ceil(metrics.getAscent());
        this.descent = (int) Math.ceil(metrics.getDescent());
    }

    @Override
    public int lineWidth(String line) {
        if (line == null || line.isEmpty()) {
            return 0;
        }
        return (int) Math.ceil(font.getStringBounds(line, RENDER_CONTEXT).getWidth());
    }

    @Override
    public TextBounds measure(String text) {
        String[] lines = text.split("\n", -1);
        int width = 0;
        for (String line : lines) {
            width = Math.max(width, lineWidth(line));
        }
        int height = lines.length * (ascent + descent) + (lines.length - 1) * LINE_SPACING;
        return new TextBounds(width, height);
    }

    @Override
    public void draw(Graphics2D surface, int x, int y, String text, Color color) {
        String[] lines = text.split("\n", -1);
        int blockWidth = 0;
        for (String line : lines) {
            blockWidth = Math.max(blockWidth, lineWidth(line));
        }

        surface.setFont(font);
        surface.setColor(color);
        int lineHeight = ascent + descent + LINE_SPACING;
        for (int i = 0; i < lines.length; i++) {
            int lineX = x + (blockWidth - lineWidth(lines[i])) / 2;
            int baseline = y + ascent + i * lineHeight;
            surface.drawString(lines[i], (float) lineX, (float) baseline);
        }
    }

    @Override
    public String toString() {
        return "AwtFontFace[" + font.getFontName() + ", " + font.getSize() + "px]";
    }
}
