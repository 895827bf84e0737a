package com.thumbstudio.api.service.overlay;

/**
 * Top-left origin and size of the drawn text block, before shadow and stroke offsets.
 */
public record TextPlacement(int x, int y, int width, int height) {

    public int centerX() {
        return x + width / 2;
    }

    public int centerY() {
        return y + height / 2;
    }
}
