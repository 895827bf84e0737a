package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.FontPreset;

/**
 * A font face loaded for a preset at a concrete pixel size. Immutable; shared through {@link FontCache}.
 *
 * @param preset    preset the face was resolved for
 * @param pixelSize requested size in pixels
 * @param family    candidate family that satisfied the request
 * @param source    where the face came from
 * @param face      the face itself
 */
public record ResolvedFont(FontPreset preset, int pixelSize, String family, FontSource source, FontFace face) {
}
