package com.thumbstudio.api.service.image;

import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImageCodecTest {

    @Test
    void normalizesFormatAndQuality() {
        ImageCodec jpeg = new ImageCodec(" JPG ", 1.7f);
        assertThat(jpeg.getOutputFormat()).isEqualTo(ImageCodec.FORMAT_JPEG);
        assertThat(jpeg.getContentType()).isEqualTo("image/jpeg");
        assertThat(jpeg.getJpegQuality()).isEqualTo(1.0f);

        ImageCodec fallback = new ImageCodec("webp", 0.5f);
        assertThat(fallback.getOutputFormat()).isEqualTo(ImageCodec.FORMAT_PNG);
        assertThat(fallback.getContentType()).isEqualTo("image/png");
    }

    @Test
    void pngIsLosslessAndDecodesToArgb() {
        ImageCodec codec = new ImageCodec("png", 0.95f);
        BufferedImage source = new BufferedImage(8, 4, BufferedImage.TYPE_INT_RGB);
        source.setRGB(3, 2, 0x12AB34);

        BufferedImage decoded = codec.decode(codec.encode(source));

        assertThat(decoded.getType()).isEqualTo(BufferedImage.TYPE_INT_ARGB);
        assertThat(decoded.getRGB(3, 2)).isEqualTo(0xFF12AB34);
        assertThat(decoded.getRGB(0, 0)).isEqualTo(0xFF000000);
    }

    @Test
    void encodesArgbAsOpaque() {
        ImageCodec codec = new ImageCodec("png", 0.95f);
        BufferedImage source = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        source.setRGB(0, 0, 0x40FF0000);

        BufferedImage decoded = codec.decode(codec.encode(source));

        assertThat(decoded.getRGB(0, 0)).isEqualTo(0xFFFF0000);
    }

    @Test
    void writesJpegWhenConfigured() {
        ImageCodec codec = new ImageCodec("jpeg", 0.9f);

        byte[] encoded = codec.encode(new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB));

        assertThat(encoded[0]).isEqualTo((byte) 0xFF);
        assertThat(encoded[1]).isEqualTo((byte) 0xD8);
        assertThat(codec.decode(encoded).getWidth()).isEqualTo(16);
    }

    @Test
    void rejectsEmptyAndUnreadableInput() {
        ImageCodec codec = new ImageCodec("png", 0.95f);

        assertThatThrownBy(() -> codec.decode(new byte[0]))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.IMAGE_DECODE_FAILED);
        assertThatThrownBy(() -> codec.decode(new byte[]{0, 1, 2, 3, 4}))
                .isInstanceOf(ApiException.class)
                .extracting(e -> ((ApiException) e).getErrorCode())
                .isEqualTo(ErrorCode.IMAGE_DECODE_FAILED);
    }
}
