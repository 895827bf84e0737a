package com.thumbstudio.common.enums;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PresetLookupTest {

    @Test
    void knownCodesResolveCaseInsensitively() {
        assertThat(FontPreset.fromCode("Dramatic")).isEqualTo(FontPreset.DRAMATIC);
        assertThat(ColorScheme.fromCode(" yellow_pop ")).isEqualTo(ColorScheme.YELLOW_POP);
        assertThat(TextPosition.fromCode("TOP_RIGHT")).isEqualTo(TextPosition.TOP_RIGHT);
        assertThat(GradientDirection.fromCode("top")).isEqualTo(GradientDirection.TOP);
    }

    @Test
    void unknownCodesFallBackToDefaults() {
        assertThat(FontPreset.fromCode("comic_sans")).isEqualTo(FontPreset.IMPACT);
        assertThat(ColorScheme.fromCode("purple_haze")).isEqualTo(ColorScheme.WHITE_SHADOW);
        assertThat(TextPosition.fromCode("somewhere")).isEqualTo(TextPosition.BOTTOM_CENTER);
        assertThat(GradientDirection.fromCode("left")).isEqualTo(GradientDirection.BOTTOM);
    }

    @Test
    void missingCodesFallBackToDefaults() {
        assertThat(FontPreset.fromCode(null)).isEqualTo(FontPreset.DEFAULT);
        assertThat(ColorScheme.fromCode("")).isEqualTo(ColorScheme.DEFAULT);
        assertThat(TextPosition.fromCode("  ")).isEqualTo(TextPosition.DEFAULT);
        assertThat(GradientDirection.fromCode(null)).isEqualTo(GradientDirection.DEFAULT);
    }

    @Test
    void candidateFamiliesStartWithPrimary() {
        assertThat(FontPreset.IMPACT.candidateFamilies())
                .containsExactly("Impact", "Arial Black", "Helvetica Bold", "DejaVuSans-Bold");
        assertThat(FontPreset.DRAMATIC.isBold()).isFalse();
    }

    @Test
    void positionRatiosStayInsideUnitSquare() {
        for (TextPosition position : TextPosition.values()) {
            assertThat(position.getXRatio()).isBetween(0.0, 1.0);
            assertThat(position.getYRatio()).isBetween(0.0, 1.0);
        }
        assertThat(TextPosition.BOTTOM_CENTER.getXRatio()).isEqualTo(0.5);
        assertThat(TextPosition.BOTTOM_CENTER.getYRatio()).isEqualTo(0.85);
    }
}
