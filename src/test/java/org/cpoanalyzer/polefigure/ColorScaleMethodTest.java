package org.cpoanalyzer.polefigure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ColorScaleMethodTest {

    @Test
    void scaleTop_dividesSharedMaximum() {
        assertThat(ColorScaleMethod.FULL.scaleTop(6.0)).isEqualTo(6.0);
        assertThat(ColorScaleMethod.DIVIDE_2.scaleTop(6.0)).isEqualTo(3.0);
        assertThat(ColorScaleMethod.DIVIDE_3.scaleTop(6.0)).isEqualTo(2.0);
        assertThat(ColorScaleMethod.DIVIDE_4.scaleTop(6.0)).isEqualTo(1.5);
    }

    @Test
    void fromConfigName_fallsBackToFull() {
        assertThat(ColorScaleMethod.fromConfigName("divide 3")).isEqualTo(ColorScaleMethod.DIVIDE_3);
        assertThat(ColorScaleMethod.fromConfigName("divide 5")).isEqualTo(ColorScaleMethod.FULL);
        assertThat(ColorScaleMethod.DIVIDE_4.legendSuffix()).isEqualTo("/4");
        assertThat(ColorScaleMethod.FULL.legendSuffix()).isEmpty();
    }

    @Test
    void crystalAxisAndMineral_parseConfigNames() {
        assertThat(CrystalAxis.fromConfigName("BAxis")).isEqualTo(CrystalAxis.B_AXIS);
        assertThat(Mineral.fromConfigName("Enstatite")).isEqualTo(Mineral.ENSTATITE);
        assertThatThrownBy(() -> CrystalAxis.fromConfigName("DAxis")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Mineral.fromConfigName("Quartz")).isInstanceOf(IllegalArgumentException.class);
    }
}
