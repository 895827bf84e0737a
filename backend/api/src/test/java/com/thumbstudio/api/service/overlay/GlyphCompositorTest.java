package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.ColorScheme;
import com.thumbstudio.common.enums.TextPosition;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Font;
import java.awt.Point;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class GlyphCompositorTest {

    private final GlyphCompositor compositor = new GlyphCompositor();

    @Test
    void centersBlockOnAnchor() {
        TextPlacement placement = compositor.place(new TextBounds(200, 100), 1000, 1000,
                PositionSpec.preset(TextPosition.CENTER));

        assertThat(placement).isEqualTo(new TextPlacement(400, 450, 200, 100));
        assertThat(placement.centerX()).isEqualTo(500);
        assertThat(placement.centerY()).isEqualTo(500);
    }

    @Test
    void clampsToMarginForEveryPresetAndCanvas() {
        int[][] canvases = {{1280, 720}, {320, 180}, {1080, 1920}, {400, 400}};
        TextBounds bounds = new TextBounds(300, 120);
        for (int[] canvas : canvases) {
            for (TextPosition position : TextPosition.values()) {
                TextPlacement placement = compositor.place(bounds, canvas[0], canvas[1], PositionSpec.preset(position));
                assertThat(placement.x()).isGreaterThanOrEqualTo(GlyphCompositor.MIN_MARGIN);
                assertThat(placement.y()).isGreaterThanOrEqualTo(GlyphCompositor.MIN_MARGIN);
                if (canvas[0] >= bounds.width() + 2 * GlyphCompositor.MIN_MARGIN) {
                    assertThat(placement.x()).isLessThanOrEqualTo(canvas[0] - bounds.width() - GlyphCompositor.MIN_MARGIN);
                }
                if (canvas[1] >= bounds.height() + 2 * GlyphCompositor.MIN_MARGIN) {
                    assertThat(placement.y()).isLessThanOrEqualTo(canvas[1] - bounds.height() - GlyphCompositor.MIN_MARGIN);
                }
            }
        }
    }

    @Test
    void cornerAnchorsArePulledBackOnCanvas() {
        TextBounds bounds = new TextBounds(400, 80);

        TextPlacement topRight = compositor.place(bounds, 1280, 720, PositionSpec.custom(1.0, 0.0));
        assertThat(topRight.x()).isEqualTo(1280 - 400 - 10);
        assertThat(topRight.y()).isEqualTo(10);

        TextPlacement bottomLeft = compositor.place(bounds, 1280, 720, PositionSpec.custom(0.0, 1.0));
        assertThat(bottomLeft.x()).isEqualTo(10);
        assertThat(bottomLeft.y()).isEqualTo(720 - 80 - 10);
    }

    @Test
    void tooSmallCanvasDegradesToMinimumMargin() {
        TextPlacement placement = compositor.place(new TextBounds(500, 300), 200, 100,
                PositionSpec.preset(TextPosition.BOTTOM_RIGHT));

        assertThat(placement.x()).isEqualTo(GlyphCompositor.MIN_MARGIN);
        assertThat(placement.y()).isEqualTo(GlyphCompositor.MIN_MARGIN);
    }

    @Test
    void strokeOffsetsFormADisc() {
        List<Point> offsets = GlyphCompositor.strokeOffsets(2);

        assertThat(offsets).hasSize(13);
        assertThat(offsets).contains(new Point(0, 2), new Point(2, 0), new Point(1, 1), new Point(0, 0));
        assertThat(offsets).doesNotContain(new Point(2, 2), new Point(2, 1), new Point(-2, -2));
        assertThat(GlyphCompositor.strokeOffsets(1)).hasSize(5);
        assertThat(GlyphCompositor.strokeOffsets(0)).isEmpty();
        assertThat(GlyphCompositor.strokeOffsets(-3)).isEmpty();
    }

    @Test
    void strokeWidthAboveMaximumIsDisabled() {
        assertThat(GlyphCompositor.strokeOffsets(GlyphCompositor.MAX_STROKE_WIDTH)).isNotEmpty();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            assertThat(GlyphCompositor.strokeOffsets(GlyphCompositor.MAX_STROKE_WIDTH + 1)).isEmpty();
            assertThat(GlyphCompositor.strokeOffsets(20_000)).isEmpty();
            assertThat(GlyphCompositor.strokeOffsets(Integer.MAX_VALUE)).isEmpty();
        });
    }

    @Test
    void hugeStrokeWidthDrawsOnlyShadowAndFill() {
        FixedAdvanceFontFace face = new FixedAdvanceFontFace(10, 20);
        WrappedText text = new WrappedText(List.of("HI"), new TextBounds(20, 20));

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> compositor.render(Rasters.transparent(100, 100), text,
                face, TextColors.of(ColorScheme.WHITE_SHADOW), Integer.MAX_VALUE, 5, PositionSpec.defaults()));

        assertThat(face.draws).hasSize(2);
        assertThat(face.draws.get(1).color()).isEqualTo(Color.WHITE);
    }

    @Test
    void drawsShadowThenStrokeThenFill() {
        FixedAdvanceFontFace face = new FixedAdvanceFontFace(10, 20);
        WrappedText text = new WrappedText(List.of("AB", "CDEF"), new TextBounds(40, 40));
        BufferedImage overlay = Rasters.transparent(400, 200);

        TextPlacement placement = compositor.render(overlay, text, face, TextColors.of(ColorScheme.RED_ALERT),
                1, 5, PositionSpec.preset(TextPosition.CENTER));

        // shadow + 5 stroke offsets + fill
        assertThat(face.draws).hasSize(7);
        FixedAdvanceFontFace.DrawCall shadow = face.draws.get(0);
        assertThat(shadow.x()).isEqualTo(placement.x() + 5);
        assertThat(shadow.y()).isEqualTo(placement.y() + 5);
        assertThat(shadow.color()).isEqualTo(new Color(0, 0, 0, GlyphCompositor.SHADOW_ALPHA));
        assertThat(shadow.text()).isEqualTo("AB\nCDEF");

        for (FixedAdvanceFontFace.DrawCall stroke : face.draws.subList(1, 6)) {
            assertThat(stroke.color()).isEqualTo(Color.WHITE);
            assertThat(Math.abs(stroke.x() - placement.x()) + Math.abs(stroke.y() - placement.y())).isLessThanOrEqualTo(1);
        }

        FixedAdvanceFontFace.DrawCall fill = face.draws.get(6);
        assertThat(fill.x()).isEqualTo(placement.x());
        assertThat(fill.y()).isEqualTo(placement.y());
        assertThat(fill.color()).isEqualTo(new Color(255, 0, 0));
    }

    @Test
    void nonPositiveShadowAndStrokeAreSkipped() {
        FixedAdvanceFontFace face = new FixedAdvanceFontFace(10, 20);
        WrappedText text = new WrappedText(List.of("HI"), new TextBounds(20, 20));

        compositor.render(Rasters.transparent(100, 100), text, face, TextColors.of(ColorScheme.WHITE_SHADOW),
                0, -4, PositionSpec.defaults());

        assertThat(face.draws).hasSize(1);
        assertThat(face.draws.get(0).color()).isEqualTo(Color.WHITE);
    }

    @Test
    void realFaceLeavesOpaqueGlyphPixelsOnTransparentOverlay() {
        AwtFontFace face = new AwtFontFace(new Font(Font.SANS_SERIF, Font.BOLD, 48));
        WrappedText text = new WrappedText(List.of("TEST"), face.measure("TEST"));
        BufferedImage overlay = Rasters.transparent(400, 200);

        TextPlacement placement = compositor.render(overlay, text, face, TextColors.of(ColorScheme.YELLOW_POP),
                3, 4, PositionSpec.preset(TextPosition.CENTER));

        assertThat(overlay.getRGB(0, 0) >>> 24).isZero();
        boolean anyOpaque = false;
        for (int y = placement.y(); y < placement.y() + placement.height() && !anyOpaque; y++) {
            for (int x = placement.x(); x < placement.x() + placement.width(); x++) {
                if ((overlay.getRGB(x, y) >>> 24) == 255) {
                    anyOpaque = true;
                    break;
                }
            }
        }
        assertThat(anyOpaque).isTrue();
    }

    @Test
    void compositeAndFlattenProducesOpaqueRgb() {
        BufferedImage base = Rasters.transparent(10, 10);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                base.setRGB(x, y, 0xFF336699);
            }
        }
        BufferedImage overlay = Rasters.transparent(10, 10);
        overlay.setRGB(5, 5, 0xFFFF0000);

        BufferedImage result = compositor.compositeAndFlatten(base, overlay);

        assertThat(result.getType()).isEqualTo(BufferedImage.TYPE_INT_RGB);
        assertThat(result.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0x336699);
        assertThat(result.getRGB(5, 5) & 0xFFFFFF).isEqualTo(0xFF0000);
    }
}
