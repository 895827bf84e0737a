package com.thumbstudio.api.config;

import com.thumbstudio.api.service.image.ImageCodec;
import com.thumbstudio.api.service.overlay.FontCache;
import com.thumbstudio.api.service.overlay.FontResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Text overlay engine wiring.
 * - FontCache: one instance per process, shared by every request
 * - FontResolver: custom fonts directory from thumbnail.overlay.fonts-dir
 * - ImageCodec: output format and pinned JPEG quality
 */
@Configuration
public class OverlayConfig {

    @Bean
    public FontCache fontCache() {
        return new FontCache();
    }

    @Bean
    public FontResolver fontResolver(FontCache fontCache,
                                     @Value("${thumbnail.overlay.fonts-dir:}") String fontsDir) {
        return new FontResolver(fontCache, fontsDir);
    }

    @Bean
    public ImageCodec imageCodec(@Value("${thumbnail.overlay.output-format:png}") String outputFormat,
                                 @Value("${thumbnail.overlay.jpeg-quality:0.95}") float jpegQuality) {
        return new ImageCodec(outputFormat, jpegQuality);
    }
}
