package com.thumbstudio.common.color;

import com.thumbstudio.common.enums.ColorScheme;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RgbColorTest {

    @Test
    void fromHexParsesChannels() {
        RgbColor color = RgbColor.fromHex("#00BFFF");
        assertThat(color.red()).isZero();
        assertThat(color.green()).isEqualTo(0xBF);
        assertThat(color.blue()).isEqualTo(0xFF);
    }

    @Test
    void fromHexAcceptsLowerCaseWithoutHash() {
        assertThat(RgbColor.fromHex("ffff00")).isEqualTo(new RgbColor(255, 255, 0));
    }

    @Test
    void hexRoundTripsForEveryRegisteredScheme() {
        for (ColorScheme scheme : ColorScheme.values()) {
            for (String hex : new String[]{scheme.getFillHex(), scheme.getStrokeHex(), scheme.getShadowHex()}) {
                assertThat(RgbColor.fromHex(hex).toHex()).isEqualToIgnoringCase(hex);
                assertThat(RgbColor.fromHex(hex.toLowerCase(Locale.ROOT)).toHex()).isEqualToIgnoringCase(hex);
            }
        }
    }

    @Test
    void toRgbIntPacksChannels() {
        assertThat(new RgbColor(0x12, 0x34, 0x56).toRgbInt()).isEqualTo(0x123456);
    }

    @Test
    void rejectsMalformedHex() {
        assertThatThrownBy(() -> RgbColor.fromHex("#FFF")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.fromHex("#GG0000")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.fromHex("+12345")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RgbColor.fromHex(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOutOfRangeChannel() {
        assertThatThrownBy(() -> new RgbColor(256, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
