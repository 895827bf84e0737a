package com.thumbstudio.api.service.overlay;

import com.thumbstudio.common.enums.FontPreset;
import lombok.extern.slf4j.Slf4j;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves a {@link FontPreset} at a pixel size to a loaded font face.
 * <p>
 * Each candidate family (primary, then fallbacks) is looked up in the custom fonts directory,
 * then in bundled {@code fonts/} classpath resources, then among fonts installed on the host.
 * When nothing matches, the JDK logical {@code SansSerif} bold face is used, so resolution never fails.
 * Results are cached in the shared {@link FontCache}.
 */
@Slf4j
public class FontResolver {

    public static final String BUILT_IN_FAMILY = Font.SANS_SERIF;

    private static final List<String> FONT_EXTENSIONS = List.of(".ttf", ".otf");
    private static final String CLASSPATH_FONT_DIR = "fonts/";

    private final FontCache fontCache;
    private final Path fontsDir;

    // font files read so far, keyed by location; empty when the file failed to load
    private final ConcurrentHashMap<String, Optional<Font>> loadedFiles = new ConcurrentHashMap<>();

    private volatile HostFonts hostFonts;

    public FontResolver(FontCache fontCache, String fontsDir) {
        this.fontCache = fontCache;
        this.fontsDir = fontsDir == null || fontsDir.isBlank() ? null : Paths.get(fontsDir);
        log.info("FontResolver initialized - fontsDir: {}", this.fontsDir != null ? this.fontsDir : "(none)");
    }

    public ResolvedFont resolve(FontPreset preset, int pixelSize) {
        FontPreset effective = preset != null ? preset : FontPreset.DEFAULT;
        return fontCache.getOrResolve(effective, Math.max(1, pixelSize), this::load);
    }

    private ResolvedFont load(FontPreset preset, int size) {
        for (String family : preset.candidateFamilies()) {
            Optional<ResolvedFont> resolved = fromCustomDir(preset, family, size)
                    .or(() -> fromClasspath(preset, family, size))
                    .or(() -> fromHost(preset, family, size));
            if (resolved.isPresent()) {
                log.debug("[Font] preset={} size={} -> family='{}' source={}",
                        preset.getCode(), size, family, resolved.get().source());
                return resolved.get();
            }
            log.debug("[Font] preset={} family='{}' not available", preset.getCode(), family);
        }

        log.warn("[Font] No candidate family available for preset={} {}, using built-in {}",
                preset.getCode(), preset.candidateFamilies(), BUILT_IN_FAMILY);
        Font builtIn = new Font(BUILT_IN_FAMILY, Font.BOLD, size);
        return new ResolvedFont(preset, size, BUILT_IN_FAMILY, FontSource.BUILT_IN, new AwtFontFace(builtIn));
    }

    private Optional<ResolvedFont> fromCustomDir(FontPreset preset, String family, int size) {
        if (fontsDir == null) {
            return Optional.empty();
        }
        for (String extension : FONT_EXTENSIONS) {
            Path fontPath = fontsDir.resolve(family + extension);
            if (!Files.isRegularFile(fontPath)) {
                continue;
            }
            Optional<Font> base = loadedFiles.computeIfAbsent(fontPath.toAbsolutePath().toString(),
                    key -> readFontFile(fontPath));
            if (base.isPresent()) {
                return Optional.of(toResolved(preset, size, family, FontSource.CUSTOM_DIR, base.get().deriveFont((float) size)));
            }
        }
        return Optional.empty();
    }

    private Optional<ResolvedFont> fromClasspath(FontPreset preset, String family, int size) {
        ClassLoader classLoader = getClass().getClassLoader();
        for (String extension : FONT_EXTENSIONS) {
            String resource = CLASSPATH_FONT_DIR + family + extension;
            if (classLoader.getResource(resource) == null) {
                continue;
            }
            Optional<Font> base = loadedFiles.computeIfAbsent("classpath:" + resource,
                    key -> readFontResource(classLoader, resource));
            if (base.isPresent()) {
                return Optional.of(toResolved(preset, size, family, FontSource.CLASSPATH, base.get().deriveFont((float) size)));
            }
        }
        return Optional.empty();
    }

    private Optional<ResolvedFont> fromHost(FontPreset preset, String family, int size) {
        HostFonts host = hostFonts();
        String key = family.toLowerCase(Locale.ROOT);

        String familyName = host.families().get(key);
        if (familyName != null) {
            Font font = new Font(familyName, preset.isBold() ? Font.BOLD : Font.PLAIN, size);
            return Optional.of(toResolved(preset, size, family, FontSource.SYSTEM, font));
        }
        Font face = host.faces().get(key);
        if (face != null) {
            return Optional.of(toResolved(preset, size, family, FontSource.SYSTEM, face.deriveFont((float) size)));
        }
        return Optional.empty();
    }

    private ResolvedFont toResolved(FontPreset preset, int size, String family, FontSource source, Font font) {
        return new ResolvedFont(preset, size, family, source, new AwtFontFace(font));
    }

    private Optional<Font> readFontFile(Path fontPath) {
        try (InputStream in = Files.newInputStream(fontPath)) {
            Font font = Font.createFont(Font.TRUETYPE_FONT, in);
            log.info("[Font] Loaded font file: {}", fontPath);
            return Optional.of(font);
        } catch (FontFormatException | IOException e) {
            log.warn("[Font] Failed to load font file {}: {}", fontPath, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Font> readFontResource(ClassLoader classLoader, String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                return Optional.empty();
            }
            Font font = Font.createFont(Font.TRUETYPE_FONT, in);
            log.info("[Font] Loaded bundled font: {}", resource);
            return Optional.of(font);
        } catch (FontFormatException | IOException e) {
            log.warn("[Font] Failed to load bundled font {}: {}", resource, e.getMessage());
            return Optional.empty();
        }
    }

    private HostFonts hostFonts() {
        HostFonts current = hostFonts;
        if (current == null) {
            synchronized (this) {
                current = hostFonts;
                if (current == null) {
                    current = HostFonts.scan();
                    hostFonts = current;
                }
            }
        }
        return current;
    }

    /**
     * Fonts installed on the host, indexed by lower-cased family name and by face/PostScript name.
     */
    private record HostFonts(Map<String, String> families, Map<String, Font> faces) {

        static HostFonts scan() {
            GraphicsEnvironment environment = GraphicsEnvironment.getLocalGraphicsEnvironment();
            Map<String, String> families = new HashMap<>();
            for (String family : environment.getAvailableFontFamilyNames(Locale.ROOT)) {
                families.putIfAbsent(family.toLowerCase(Locale.ROOT), family);
            }
            Map<String, Font> faces = new HashMap<>();
            for (Font font : environment.getAllFonts()) {
                faces.putIfAbsent(font.getFontName(Locale.ROOT).toLowerCase(Locale.ROOT), font);
                faces.putIfAbsent(font.getPSName().toLowerCase(Locale.ROOT), font);
            }
            log.info("[Font] Host fonts scanned - families: {}, faces: {}", families.size(), faces.size());
            return new HostFonts(Map.copyOf(families), Map.copyOf(faces));
        }
    }
}
