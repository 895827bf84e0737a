package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.ColorScheme;
import com.thumbstudio.common.enums.FontPreset;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Styling for one text overlay pass.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TextStyleConfig {

    public static final int DEFAULT_STROKE_WIDTH = 4;
    public static final int DEFAULT_SHADOW_OFFSET = 5;

    private final String text;

    @Builder.Default
    private final PositionSpec position = PositionSpec.defaults();

    @Builder.Default
    private final FontPreset fontPreset = FontPreset.DEFAULT;

    @Builder.Default
    private final ColorScheme colorScheme = ColorScheme.DEFAULT;

    private final TextColors customColors;  // overrides colorScheme when set

    private final Integer fontSize;         // null = computed from text length and canvas height

    @Builder.Default
    private final int strokeWidth = DEFAULT_STROKE_WIDTH;

    @Builder.Default
    private final int shadowOffset = DEFAULT_SHADOW_OFFSET;

    @Builder.Default
    private final double maxWidthRatio = TextLayoutEngine.DEFAULT_MAX_WIDTH_RATIO;

    public TextColors resolveColors() {
        return customColors != null ? customColors : TextColors.of(colorScheme);
    }

    public PositionSpec resolvePosition() {
        return position != null ? position : PositionSpec.defaults();
    }
}
