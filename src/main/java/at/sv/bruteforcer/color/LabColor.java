package at.sv.bruteforcer.color;

/**
 * CIE L*a*b* color relative to the D65 white point. The alpha value is carried along unchanged.
 */
public record LabColor(double l, double a, double b, double alpha) {

    public static LabColor opaque(double l, double a, double b) {
        return new LabColor(l, a, b, 1.0);
    }
}
