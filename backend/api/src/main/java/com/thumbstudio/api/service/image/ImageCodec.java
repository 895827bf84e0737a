package com.thumbstudio.api.service.image;

import com.thumbstudio.api.service.overlay.Rasters;
import com.thumbstudio.common.exception.ApiException;
import com.thumbstudio.common.exception.ErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;

/**
 * Decodes input bytes to ARGB rasters and encodes opaque rasters with pinned settings.
 * PNG by default; JPEG at a fixed quality when configured.
 */
@Slf4j
@Getter
public class ImageCodec {

    public static final String FORMAT_PNG = "png";
    public static final String FORMAT_JPEG = "jpeg";

    private final String outputFormat;
    private final float jpegQuality;

    public ImageCodec(String outputFormat, float jpegQuality) {
        String format = outputFormat == null ? FORMAT_PNG : outputFormat.trim().toLowerCase(Locale.ROOT);
        this.outputFormat = format.equals("jpg") || format.equals(FORMAT_JPEG) ? FORMAT_JPEG : FORMAT_PNG;
        this.jpegQuality = Math.max(0f, Math.min(1f, jpegQuality));
        log.info("ImageCodec initialized - format: {}, jpegQuality: {}", this.outputFormat, this.jpegQuality);
    }

    public String getContentType() {
        return FORMAT_JPEG.equals(outputFormat) ? "image/jpeg" : "image/png";
    }

    /**
     * @throws ApiException {@link ErrorCode#IMAGE_DECODE_FAILED} when the bytes are not a readable image
     */
    public BufferedImage decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "Image data is empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "Failed to decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ApiException(ErrorCode.IMAGE_DECODE_FAILED, "Unsupported or corrupt image data (" + data.length + " bytes)");
        }
        return Rasters.toArgb(image);
    }

    /**
     * @throws ApiException {@link ErrorCode#IMAGE_ENCODE_FAILED} when no writer is available or writing fails
     */
    public byte[] encode(BufferedImage image) {
        BufferedImage opaque = image.getType() == BufferedImage.TYPE_INT_RGB ? image : Rasters.flatten(image);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (FORMAT_JPEG.equals(outputFormat)) {
                writeJpeg(opaque, out);
            } else if (!ImageIO.write(opaque, FORMAT_PNG, out)) {
                throw new ApiException(ErrorCode.IMAGE_ENCODE_FAILED, "No PNG writer available");
            }
        } catch (IOException e) {
            throw new ApiException(ErrorCode.IMAGE_ENCODE_FAILED, "Failed to encode image: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private void writeJpeg(BufferedImage image, ByteArrayOutputStream out) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(FORMAT_JPEG);
        if (!writers.hasNext()) {
            throw new ApiException(ErrorCode.IMAGE_ENCODE_FAILED, "No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(jpegQuality);
            writer.setOutput(ios);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
