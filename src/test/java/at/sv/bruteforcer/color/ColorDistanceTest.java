package at.sv.bruteforcer.color;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ColorDistanceTest {

    private static final double EPS = 1e-4;

    /**
     * Selected pairs from the supplementary test data of Sharma, Wu and Dalal.
     */
    @Test
    void ciede2000_matchesReferenceData() {
        assertDistance(50, 2.6772, -79.7751, 50, 0, -82.7485, 2.0425);
        assertDistance(50, 3.1571, -77.2803, 50, 0, -82.7485, 2.8615);
        assertDistance(50, 0, 0, 50, -1, 2, 2.3669);
        assertDistance(50, 2.49, -0.001, 50, -2.49, 0.0009, 7.1792);
        assertDistance(50, 2.5, 0, 58, 24, 15, 19.4535);
        assertDistance(50, 2.5, 0, 50, 3.1736, 0.5854, 1.0);
        assertDistance(60.2574, -34.0099, 36.2677, 60.4626, -34.1751, 39.4387, 1.2644);
        assertDistance(22.7233, 20.0904, -46.6940, 23.0331, 14.9730, -42.5619, 2.0373);
        assertDistance(90.8027, -2.0831, 1.4410, 91.1528, -1.6435, 0.0447, 1.4441);
        assertDistance(2.0776, 0.0795, -1.1350, 0.9033, -0.0636, -0.5514, 0.9082);
    }

    @Test
    void ciede2000_sameColor_zero() {
        assertThat(ColorDistance.ciede2000(LabColor.opaque(50, 0, 0), LabColor.opaque(50, 0, 0))).isZero();
        assertThat(ColorDistance.ciede2000(LabColor.opaque(53.2, 80.1, 67.2), LabColor.opaque(53.2, 80.1, 67.2))).isZero();
        assertThat(ColorDistance.ciede2000(LabColor.opaque(0, 0, 0), LabColor.opaque(0, 0, 0))).isZero();
    }

    @Test
    void ciede2000_isSymmetric() {
        double[][] colors = {
                {50, 2.6772, -79.7751},
                {50, 0, 0},
                {50, -1, 2},
                {58, 24, 15},
                {90.8027, -2.0831, 1.4410},
                {2.0776, 0.0795, -1.1350},
                {35, -60, 0},
                {72, 10, -90},
        };
        for (double[] first : colors) {
            for (double[] second : colors) {
                LabColor c1 = LabColor.opaque(first[0], first[1], first[2]);
                LabColor c2 = LabColor.opaque(second[0], second[1], second[2]);
                assertThat(ColorDistance.ciede2000(c1, c2)).isCloseTo(ColorDistance.ciede2000(c2, c1), within(1e-12));
            }
        }
    }

    @Test
    void ciede2000_achromaticColors_onlyLightnessDiffers() {
        double distance = ColorDistance.ciede2000(LabColor.opaque(40, 0, 0), LabColor.opaque(60, 0, 0));

        assertThat(distance).isPositive();
        assertThat(distance).isNotNaN();
    }

    @Test
    void ciede2000_isNeverNegative() {
        for (int l = 0; l <= 100; l += 25) {
            for (int a = -100; a <= 100; a += 50) {
                for (int b = -100; b <= 100; b += 50) {
                    assertThat(ColorDistance.ciede2000(LabColor.opaque(l, a, b), LabColor.opaque(50, 10, -10)))
                            .isGreaterThanOrEqualTo(0.0);
                }
            }
        }
    }

    private static void assertDistance(double l1, double a1, double b1, double l2, double a2, double b2, double expected) {
        double distance = ColorDistance.ciede2000(LabColor.opaque(l1, a1, b1), LabColor.opaque(l2, a2, b2));
        assertThat(distance).isCloseTo(expected, within(EPS));
    }
}
