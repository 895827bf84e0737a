package com.thumbstudio.api.service.overlay;

/**
 * Pixel size of a measured text block.
 */
public record TextBounds(int width, int height) {
}
