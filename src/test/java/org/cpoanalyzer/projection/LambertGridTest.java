package org.cpoanalyzer.projection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@Tag("unit")
class LambertGridTest {

    @ParameterizedTest
    @EnumSource(Hemisphere.class)
    void build_everyPointIsUnitLength(Hemisphere hemisphere) {
        LambertGrid grid = LambertGrid.build(31, hemisphere);

        for (int row = 0; row < grid.size(); row++) {
            for (int col = 0; col < grid.size(); col++) {
                double[] p = grid.point(row, col);
                assertThat(Math.sqrt(p[0] * p[0] + p[1] * p[1] + p[2] * p[2])).isCloseTo(1.0, within(1e-12));
            }
        }
    }

    @ParameterizedTest
    @EnumSource(Hemisphere.class)
    void build_validPointsLieOnRequestedHemisphere(Hemisphere hemisphere) {
        LambertGrid grid = LambertGrid.build(31, hemisphere);

        for (int row = 0; row < grid.size(); row++) {
            for (int col = 0; col < grid.size(); col++) {
                // valid cells reach slightly past the disk edge, so allow a small overshoot
                if (grid.isValid(row, col)) {
                    double y = grid.point(row, col)[1];
                    if (hemisphere == Hemisphere.UPPER) {
                        assertThat(y).isGreaterThanOrEqualTo(-2e-3);
                    } else {
                        assertThat(y).isLessThanOrEqualTo(2e-3);
                    }
                }
            }
        }
    }

    @Test
    void build_centerMapsToPole() {
        double[] upper = LambertGrid.build(5, Hemisphere.UPPER).point(2, 2);
        double[] lower = LambertGrid.build(5, Hemisphere.LOWER).point(2, 2);

        assertThat(upper[0]).isCloseTo(0.0, within(1e-12));
        assertThat(upper[1]).isCloseTo(1.0, within(1e-12));
        assertThat(upper[2]).isCloseTo(0.0, within(1e-12));
        assertThat(lower[1]).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    void build_rowZeroIsTopOfPlane() {
        LambertGrid grid = LambertGrid.build(5, Hemisphere.UPPER);

        assertThat(grid.planeZ(0, 0)).isEqualTo(LambertGrid.PLANE_RADIUS);
        assertThat(grid.planeZ(4, 0)).isEqualTo(-LambertGrid.PLANE_RADIUS);
        assertThat(grid.planeX(0, 0)).isEqualTo(-LambertGrid.PLANE_RADIUS);
        assertThat(grid.planeX(0, 4)).isEqualTo(LambertGrid.PLANE_RADIUS);
    }

    @Test
    void build_masksCornersButKeepsDiskEdge() {
        LambertGrid grid = LambertGrid.build(5, Hemisphere.UPPER);

        assertThat(grid.isValid(0, 0)).isFalse();
        assertThat(grid.isValid(4, 4)).isFalse();
        // on the boundary circle
        assertThat(grid.isValid(0, 2)).isTrue();
        assertThat(grid.isValid(2, 4)).isTrue();
        assertThat(grid.isValid(2, 2)).isTrue();
    }

    @Test
    void build_rejectsTooFewPoints() {
        assertThatThrownBy(() -> LambertGrid.build(1, Hemisphere.UPPER))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void component_matchesPoint() {
        LambertGrid grid = LambertGrid.build(7, Hemisphere.LOWER);
        double[] p = grid.point(3, 5);

        assertThat(grid.component(3 * 7 + 5, 0)).isEqualTo(p[0]);
        assertThat(grid.component(3 * 7 + 5, 1)).isEqualTo(p[1]);
        assertThat(grid.component(3 * 7 + 5, 2)).isEqualTo(p[2]);
    }
}
