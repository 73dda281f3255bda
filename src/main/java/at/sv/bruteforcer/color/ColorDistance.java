package at.sv.bruteforcer.color;

/**
 * CIEDE2000 color difference.
 * <p>
 * Notation follows: G. Sharma, W. Wu, E. N. Dalal, <a href="https://hajim.rochester.edu/ece/sites/gsharma/ciede2000/ciede2000noteCRNA.pdf">
 * The CIEDE2000 Color-Difference Formula: Implementation Notes, Supplementary Test Data, and Mathematical Observations</a>.
 * The parametric weighting factors k_L, k_C and k_H are all fixed at 1.
 */
public final class ColorDistance {

    private ColorDistance() {
    }

    private static final double POW_25_7 = Math.pow(25.0, 7);

    public static double ciede2000(LabColor lab1, LabColor lab2) {
        // step 1: C' and h'
        double cStar1 = Math.hypot(lab1.a(), lab1.b());
        double cStar2 = Math.hypot(lab2.a(), lab2.b());
        double cBar = (cStar1 + cStar2) / 2.0;
        double g = 0.5 * (1.0 - Math.sqrt(pow7(cBar) / (pow7(cBar) + POW_25_7)));

        double aPrime1 = (1.0 + g) * lab1.a();
        double aPrime2 = (1.0 + g) * lab2.a();

        double cPrime1 = Math.hypot(aPrime1, lab1.b());
        double cPrime2 = Math.hypot(aPrime2, lab2.b());

        double hPrime1 = hueDegrees(aPrime1, lab1.b());
        double hPrime2 = hueDegrees(aPrime2, lab2.b());

        // step 2: delta L', delta C', delta H'
        double deltaL = lab2.l() - lab1.l();
        double deltaC = cPrime2 - cPrime1;
        double chromaProduct = cPrime1 * cPrime2;
        double deltaHueAngle = hueDifference(hPrime1, hPrime2, chromaProduct);
        double deltaH = 2.0 * Math.sqrt(chromaProduct) * Math.sin(Math.toRadians(deltaHueAngle / 2.0));

        // step 3: the weighted difference
        double lBarPrime = (lab1.l() + lab2.l()) / 2.0;
        double cBarPrime = (cPrime1 + cPrime2) / 2.0;
        double hBarPrime = meanHue(hPrime1, hPrime2, chromaProduct);

        double t = 1.0
                   - 0.17 * degCos(hBarPrime - 30.0)
                   + 0.24 * degCos(2.0 * hBarPrime)
                   + 0.32 * degCos(3.0 * hBarPrime + 6.0)
                   - 0.20 * degCos(4.0 * hBarPrime - 63.0);

        double deltaTheta = 30.0 * Math.exp(-square((hBarPrime - 275.0) / 25.0));
        double rC = 2.0 * Math.sqrt(pow7(cBarPrime) / (pow7(cBarPrime) + POW_25_7));
        double lOffset = square(lBarPrime - 50.0);
        double sL = 1.0 + (0.015 * lOffset) / Math.sqrt(20.0 + lOffset);
        double sC = 1.0 + 0.045 * cBarPrime;
        double sH = 1.0 + 0.015 * cBarPrime * t;
        double rT = -rC * Math.sin(Math.toRadians(2.0 * deltaTheta));

        double lightness = deltaL / sL;
        double chroma = deltaC / sC;
        double hue = deltaH / sH;
        return Math.sqrt(square(lightness) + square(chroma) + square(hue) + rT * chroma * hue);
    }

    /**
     * Hue angle in [0, 360). Defined as 0 for a == b == 0.
     */
    private static double hueDegrees(double a, double b) {
        if (a == 0.0 && b == 0.0) {
            return 0.0;
        }
        double degrees = Math.toDegrees(Math.atan2(b, a));
        if (degrees < 0.0) {
            return degrees + 360.0;
        }
        return degrees;
    }

    private static double hueDifference(double h1, double h2, double chromaProduct) {
        if (chromaProduct == 0.0) {
            return 0.0;
        }
        double diff = h2 - h1;
        if (Math.abs(diff) <= 180.0) {
            return diff;
        }
        if (diff > 180.0) {
            return diff - 360.0;
        }
        return diff + 360.0;
    }

    private static double meanHue(double h1, double h2, double chromaProduct) {
        if (chromaProduct == 0.0) {
            return h1 + h2;
        }
        if (Math.abs(h2 - h1) <= 180.0) {
            return (h1 + h2) / 2.0;
        }
        if (h1 + h2 < 360.0) {
            return (h1 + h2 + 360.0) / 2.0;
        }
        return (h1 + h2 - 360.0) / 2.0;
    }

    private static double degCos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    private static double square(double value) {
        return value * value;
    }

    private static double pow7(double value) {
        double cube = value * value * value;
        return cube * cube * value;
    }
}
