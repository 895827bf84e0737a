package com.thumbstudio.api.service.overlay;

/**
 * Where a resolved font face was loaded from.
 */
public enum FontSource {
    CUSTOM_DIR,
    CLASSPATH,
    SYSTEM,
    BUILT_IN
}
