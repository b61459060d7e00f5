package com.lynkvertx.tbce.service;

import com.lynkvertx.tbce.config.BracketCheckConfig;
import com.lynkvertx.tbce.model.PointLoad;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DeflectionModelTest {

    private static final double E = 200000;
    private static final double IXX = 4_000_000;

    private final DeflectionModel model = new DeflectionModel(new BracketCheckConfig());

    private static PointLoad load(double n, double x) {
        return new PointLoad(n, x, "P");
    }

    @Nested
    @DisplayName("closed-form reference cases")
    class ReferenceCases {

        @Test
        @DisplayName("central load: δmax = PL³/(48EI)")
        void centralLoad() {
            double expected = 5000 * Math.pow(2000, 3) / (48 * E * IXX);

            assertThat(model.maxDeflection(2000, List.of(load(5000, 1000)), E, IXX))
                .isCloseTo(expected, within(1e-9));
        }

        @Test
        @DisplayName("central load on a span sampled exactly at midspan")
        void centralLoadExactSample() {
            double expected = 2400 * Math.pow(1200, 3) / (48 * E * IXX);

            assertThat(model.maxDeflection(1200, List.of(load(2400, 600)), E, IXX))
                .isCloseTo(expected, within(1e-12));
        }

        @Test
        @DisplayName("deflection under an eccentric load: P·a²·b²/(3EIL)")
        void eccentricUnderLoad() {
            double a = 300;
            double b = 900;
            double expected = 3000 * a * a * b * b / (3 * E * IXX * 1200);

            assertThat(model.deflectionAt(a, 1200, List.of(load(3000, a)), E, IXX)).isCloseTo(expected, within(1e-12));
        }

        @Test
        @DisplayName("both branches of the single-load curve meet under the load")
        void continuousUnderLoad() {
            double justLeft = DeflectionModel.pointLoadDeflection(449.999999, 1500, 1000, 450, E, IXX);
            double justRight = DeflectionModel.pointLoadDeflection(450.000001, 1500, 1000, 450, E, IXX);

            assertThat(justRight).isCloseTo(justLeft, within(1e-9));
        }
    }

    @Nested
    @DisplayName("superposition and symmetry")
    class Superposition {

        @Test
        @DisplayName("two loads deflect as the sum of each acting alone")
        void sumOfIndividualCurves() {
            PointLoad first = load(1200, 350);
            PointLoad second = load(2600, 1400);
            for (double x = 0; x <= 1800; x += 90) {
                double combined = model.deflectionAt(x, 1800, List.of(first, second), E, IXX);
                double separate = model.deflectionAt(x, 1800, List.of(first), E, IXX)
                    + model.deflectionAt(x, 1800, List.of(second), E, IXX);
                assertThat(combined).isCloseTo(separate, within(1e-12));
            }
        }

        @Test
        @DisplayName("mirrored load position gives the same maximum")
        void mirrorSymmetry() {
            double left = model.maxDeflection(1500, List.of(load(4000, 400)), E, IXX);
            double right = model.maxDeflection(1500, List.of(load(4000, 1100)), E, IXX);

            assertThat(left).isCloseTo(right, within(1e-9));
        }

        @Test
        @DisplayName("increasing a load never decreases δmax")
        void monotonic() {
            double base = model.maxDeflection(1600, List.of(load(800, 400), load(1200, 1000)), E, IXX);
            double heavier = model.maxDeflection(1600, List.of(load(800, 400), load(1900, 1000)), E, IXX);

            assertThat(heavier).isGreaterThanOrEqualTo(base);
        }
    }

    @Nested
    @DisplayName("sampling and degenerate input")
    class SamplingAndDegenerate {

        @Test
        @DisplayName("step = clamp(L/120, 10, 50)")
        void samplingStep() {
            assertThat(model.samplingStep(600)).isEqualTo(10.0);
            assertThat(model.samplingStep(2400)).isEqualTo(20.0);
            assertThat(model.samplingStep(12000)).isEqualTo(50.0);
        }

        @Test
        @DisplayName("very long spans widen the step to stay within the sample cap")
        void cappedSampleCount() {
            assertThat(model.samplingStep(1e12)).isEqualTo(5e8);
            assertThat(model.samplingStep(1e6)).isEqualTo(500.0);
        }

        @Test
        @Timeout(value = 5, unit = TimeUnit.SECONDS)
        @DisplayName("span beyond the int range of sample indices still terminates")
        void hugeSpanTerminates() {
            double expected = 1000 * Math.pow(1e12, 3) / (48 * E * IXX);

            double actual = model.maxDeflection(1e12, List.of(load(1000, 5e11)), E, IXX);

            assertThat(actual).isFinite().isPositive();
            assertThat(actual).isCloseTo(expected, within(expected * 1e-9));
        }

        @Test
        @DisplayName("L, E or I <= 0 gives 0.0")
        void degenerate() {
            List<PointLoad> loads = List.of(load(1000, 500));

            assertThat(model.maxDeflection(0, loads, E, IXX)).isEqualTo(0.0);
            assertThat(model.maxDeflection(1000, loads, 0, IXX)).isEqualTo(0.0);
            assertThat(model.maxDeflection(1000, loads, E, -1)).isEqualTo(0.0);
            assertThat(model.maxDeflection(1000, Collections.emptyList(), E, IXX)).isEqualTo(0.0);
        }
    }
}
