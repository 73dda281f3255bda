package at.sv.bruteforcer.color;

/**
 * An RGBA color in linear light with straight (non-premultiplied) alpha. All channels are in [0, 1].
 */
public record LinearColor(double red, double green, double blue, double alpha) {

    public static LinearColor opaque(double red, double green, double blue) {
        return new LinearColor(red, green, blue, 1.0);
    }

    public static LinearColor fromRgb(int red, int green, int blue, double alpha) {
        return new LinearColor(red / 255.0, green / 255.0, blue / 255.0, alpha);
    }

    /**
     * Composites this color on top of the given base color using the standard "over" operator.
     */
    public LinearColor over(LinearColor base) {
        double baseWeight = base.alpha * (1.0 - alpha);
        double outAlpha = alpha + baseWeight;
        if (outAlpha <= 0.0) {
            return new LinearColor(0.0, 0.0, 0.0, 0.0);
        }
        return new LinearColor(
                (red * alpha + base.red * baseWeight) / outAlpha,
                (green * alpha + base.green * baseWeight) / outAlpha,
                (blue * alpha + base.blue * baseWeight) / outAlpha,
                outAlpha);
    }
}
