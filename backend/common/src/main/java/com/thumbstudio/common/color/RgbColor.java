package com.thumbstudio.common.color;

import java.util.Locale;

/**
 * Opaque 24-bit color parsed from and printed as {@code #RRGGBB}.
 */
public record RgbColor(int red, int green, int blue) {

    public RgbColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * Parses {@code #RRGGBB} or {@code RRGGBB}, case-insensitive.
     *
     * @throws IllegalArgumentException if the value is not six hex digits
     */
    public static RgbColor fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("hex color must not be null");
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6 || !digits.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
            throw new IllegalArgumentException("hex color must be 6 hex digits: " + hex);
        }
        int value = Integer.parseInt(digits, 16);
        return new RgbColor((value >> 16) & 0xFF, (value >> 8) & 0xFF, value & 0xFF);
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    public int toRgbInt() {
        return (red << 16) | (green << 8) | blue;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " out of range [0,255]: " + value);
        }
    }
}
