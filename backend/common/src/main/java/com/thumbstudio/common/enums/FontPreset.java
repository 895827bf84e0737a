package com.thumbstudio.common.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Font style presets.
 * Families are tried in order: primary first, then fallbacks.
 */
@Getter
@RequiredArgsConstructor
public enum FontPreset {

    IMPACT("impact", "Impact", List.of("Arial Black", "Helvetica Bold", "DejaVuSans-Bold"), true),
    MODERN("modern", "Montserrat", List.of("Arial", "Helvetica", "DejaVuSans"), true),
    DRAMATIC("dramatic", "Bebas Neue", List.of("Impact", "Arial Black", "DejaVuSans-Bold"), false),
    CLEAN("clean", "Roboto", List.of("Arial", "Helvetica", "DejaVuSans"), true);

    public static final FontPreset DEFAULT = IMPACT;

    private final String code;
    private final String primaryFamily;
    private final List<String> fallbackFamilies;
    private final boolean bold;  // weight hint, applied to host fonts matched by family

    /**
     * Primary family followed by the fallbacks.
     */
    public List<String> candidateFamilies() {
        List<String> families = new ArrayList<>(fallbackFamilies.size() + 1);
        families.add(primaryFamily);
        families.addAll(fallbackFamilies);
        return Collections.unmodifiableList(families);
    }

    /**
     * Unknown or missing codes resolve to {@link #DEFAULT}.
     */
    public static FontPreset fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (FontPreset preset : values()) {
            if (preset.code.equals(normalized)) {
                return preset;
            }
        }
        return DEFAULT;
    }
}
