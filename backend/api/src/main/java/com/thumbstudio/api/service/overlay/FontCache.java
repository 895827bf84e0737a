package com.thumbstudio.api.service.overlay;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.thumbstudio.common.enums.FontPreset;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BiFunction;

/**
 * Process-wide cache of resolved fonts keyed by (preset, pixel size).
 * Lookups are lock-free; a missing key is resolved at most once even under concurrent requests.
 * Entries are never evicted: the key space is bounded by the presets and the sizes requested.
 */
@Slf4j
public class FontCache {

    private final Cache<Key, ResolvedFont> entries;

    public FontCache() {
        this.entries = Caffeine.newBuilder()
            .build();
        log.info("FontCache initialized (no eviction)");
    }

    public ResolvedFont getOrResolve(FontPreset preset, int pixelSize,
                                     BiFunction<FontPreset, Integer, ResolvedFont> resolver) {
        return entries.get(new Key(preset, pixelSize), key -> resolver.apply(key.preset(), key.pixelSize()));
    }

    public ResolvedFont get(FontPreset preset, int pixelSize) {
        return entries.getIfPresent(new Key(preset, pixelSize));
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private record Key(FontPreset preset, int pixelSize) {
    }
}
