package com.thumbstudio.api.service.overlay;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Font sizing and greedy word wrapping against measured glyph widths.
 */
@Component
public class TextLayoutEngine {

    public static final double BASE_SIZE_RATIO = 0.12;
    public static final int LONG_TEXT_LENGTH = 20;
    public static final double LONG_TEXT_FACTOR = 0.8;
    public static final int VERY_LONG_TEXT_LENGTH = 30;
    public static final double VERY_LONG_TEXT_FACTOR = 0.7;
    public static final int MIN_FONT_SIZE = 24;
    public static final double DEFAULT_MAX_WIDTH_RATIO = 0.9;

    /**
     * Point size used when the caller gives none: 12% of the canvas height, shrunk for long text.
     * Both length reductions apply when the text is longer than 30 characters. Never below 24px.
     *
     * @param text         text to size, length counted in code points
     * @param canvasHeight canvas height in pixels
     */
    public int computeFontSize(String text, int canvasHeight) {
        int length = text == null ? 0 : text.codePointCount(0, text.length());
        long size = Math.round(canvasHeight * BASE_SIZE_RATIO);
        if (length > LONG_TEXT_LENGTH) {
            size = Math.round(size * LONG_TEXT_FACTOR);
        }
        if (length > VERY_LONG_TEXT_LENGTH) {
            size = Math.round(size * VERY_LONG_TEXT_FACTOR);
        }
        return (int) Math.max(size, MIN_FONT_SIZE);
    }

    /**
     * Maximum line width for a canvas: {@code round(maxWidthRatio * canvasWidth)}.
     */
    public int maxLineWidth(int canvasWidth, double maxWidthRatio) {
        return (int) Math.round(canvasWidth * maxWidthRatio);
    }

    public LaidOutText layout(String text, ResolvedFont font, int maxWidthPx) {
        return new LaidOutText(wrap(text, font.face(), maxWidthPx), font);
    }

    /**
     * Leaves text that already fits as is. Otherwise wraps each {@code '\n'}-separated paragraph on its
     * own, building lines word by word and closing a line when the next word would push it past
     * {@code maxWidthPx}. Explicit line breaks are kept. A word wider than the limit gets a line of
     * its own and is not split.
     */
    public WrappedText wrap(String text, FontFace face, int maxWidthPx) {
        TextBounds bounds = face.measure(text);
        if (bounds.width() <= maxWidthPx) {
            return new WrappedText(List.of(text.split("\n", -1)), bounds);
        }

        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\n", -1)) {
            wrapParagraph(paragraph, face, maxWidthPx, lines);
        }

        String wrapped = String.join("\n", lines);
        return new WrappedText(lines, face.measure(wrapped));
    }

    private void wrapParagraph(String paragraph, FontFace face, int maxWidthPx, List<String> lines) {
        String trimmed = paragraph.trim();
        if (trimmed.isEmpty()) {
            lines.add("");
            return;
        }
        StringBuilder current = new StringBuilder();
        for (String word : trimmed.split("\\s+")) {
            String candidate = current.length() == 0 ? word : current + " " + word;
            if (face.lineWidth(candidate) <= maxWidthPx) {
                current.setLength(0);
                current.append(candidate);
            } else {
                if (current.length() > 0) {
                    lines.add(current.toString());
                }
                current.setLength(0);
                current.append(word);
            }
        }
        lines.add(current.toString());
    }
}
