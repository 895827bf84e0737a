package com.thumbstudio.api.service.overlay;

import java.util.List;

/**
 * Text broken into lines for drawing, with the measured block bounds.
 */
public record WrappedText(List<String> lines, TextBounds bounds) {

    public WrappedText {
        lines = List.copyOf(lines);
    }

    public String text() {
        return String.join("\n", lines);
    }

    public int lineCount() {
        return lines.size();
    }
}
