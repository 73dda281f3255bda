package at.sv.bruteforcer.color;

/**
 * Converts linear sRGB into CIE L*a*b* (D65).
 * <p>
 * Input channels are treated as already linear, no gamma decoding is applied.
 */
public final class LabConverter {

    private LabConverter() {
    }

    // linear sRGB -> XYZ (D65)
    private static final double M11 = 0.4124564, M12 = 0.3575761, M13 = 0.1804375;
    private static final double M21 = 0.2126729, M22 = 0.7151522, M23 = 0.0721750;
    private static final double M31 = 0.0193339, M32 = 0.1191920, M33 = 0.9503041;

    // D65 reference white
    private static final double WHITE_X = 0.95047;
    private static final double WHITE_Y = 1.0;
    private static final double WHITE_Z = 1.08883;

    private static final double EPSILON = 216.0 / 24389.0;
    private static final double KAPPA = 24389.0 / 27.0;

    public static LabColor toLab(LinearColor color) {
        double red = color.red(), green = color.green(), blue = color.blue();
        double x = M11 * red + M12 * green + M13 * blue;
        double y = M21 * red + M22 * green + M23 * blue;
        double z = M31 * red + M32 * green + M33 * blue;

        double fx = f(x / WHITE_X);
        double fy = f(y / WHITE_Y);
        double fz = f(z / WHITE_Z);

        double l = 116.0 * fy - 16.0;
        double a = 500.0 * (fx - fy);
        double b = 200.0 * (fy - fz);
        return new LabColor(l, a, b, color.alpha());
    }

    private static double f(double t) {
        if (t > EPSILON) {
            return Math.cbrt(t);
        }
        return (KAPPA * t + 16.0) / 116.0;
    }
}
