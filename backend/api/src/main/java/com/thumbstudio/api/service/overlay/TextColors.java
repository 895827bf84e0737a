package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.color.RgbColor;
import com.thumbstudio.common.enums.ColorScheme;

import java.awt.Color;

/**
 * Fill, stroke and shadow colors for one text pass set.
 */
public record TextColors(RgbColor fill, RgbColor stroke, RgbColor shadow) {

    public static TextColors of(ColorScheme scheme) {
        ColorScheme effective = scheme != null ? scheme : ColorScheme.DEFAULT;
        return new TextColors(effective.getFill(), effective.getStroke(), effective.getShadow());
    }

    public Color fillColor() {
        return new Color(fill.toRgbInt());
    }

    public Color strokeColor() {
        return new Color(stroke.toRgbInt());
    }

    public Color shadowColor(int alpha) {
        return new Color(shadow.red(), shadow.green(), shadow.blue(), alpha);
    }
}
