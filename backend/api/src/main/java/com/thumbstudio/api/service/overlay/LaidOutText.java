package com.thumbstudio.api.service.overlay;

/**
 * Wrapped text together with the font it was measured with.
 */
public record LaidOutText(WrappedText text, ResolvedFont font) {
}
