package org.cpoanalyzer.cli.rendering;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@Tag("unit")
class ColorGradientTest {

    @Test
    void simple_runsFromWhiteToRed() {
        assertThat(ColorGradient.SIMPLE.rgbAt(0.0)).isEqualTo(0xFFFFFF);
        assertThat(ColorGradient.SIMPLE.rgbAt(1.0)).isEqualTo(0xFF0000);
    }

    @ParameterizedTest
    @EnumSource(ColorGradient.class)
    void rgbAt_clampsOutOfRangeAndNaN(ColorGradient gradient) {
        assertThat(gradient.rgbAt(-3.0)).isEqualTo(gradient.rgbAt(0.0));
        assertThat(gradient.rgbAt(Double.NaN)).isEqualTo(gradient.rgbAt(0.0));
        assertThat(gradient.rgbAt(42.0)).isEqualTo(gradient.rgbAt(1.0));
    }

    @ParameterizedTest
    @EnumSource(ColorGradient.class)
    void fromConfigName_roundTripsConfiguredName(ColorGradient gradient) {
        assertThat(ColorGradient.fromConfigName(gradient.configName())).isEqualTo(gradient);
    }

    @Test
    void batlow_startsDarkBlueAndEndsLight() {
        int start = ColorGradient.BATLOW.rgbAt(0.0);
        int end = ColorGradient.BATLOW.rgbAt(1.0);

        assertThat(start & 0xFF).isGreaterThan((start >> 16) & 0xFF);
        assertThat(brightness(end)).isGreaterThan(brightness(start));
    }

    @Test
    void fromConfigName_rejectsUnknownScale() {
        assertThatThrownBy(() -> ColorGradient.fromConfigName("Jet"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Jet");
    }

    private static int brightness(int rgb) {
        return ((rgb >> 16) & 0xFF) + ((rgb >> 8) & 0xFF) + (rgb & 0xFF);
    }
}
