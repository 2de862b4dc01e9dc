package loci.patchsynth.normalization;

/**
 * sRGB (D65) to CIE L*a*b* conversion for single pixels.
 */
final class LabColor {

    private static final double XN = 0.950456;
    private static final double ZN = 1.088754;
    private static final double EPSILON = 216.0 / 24389.0;
    private static final double KAPPA = 24389.0 / 27.0;

    private LabColor() {}

    /**
     * @return {L in [0, 100], a, b}
     */
    static double[] fromRgb(int r, int g, int b) {
        double rl = linearize(r / 255.0);
        double gl = linearize(g / 255.0);
        double bl = linearize(b / 255.0);

        double x = (0.412453 * rl + 0.357580 * gl + 0.180423 * bl) / XN;
        double y = 0.212671 * rl + 0.715160 * gl + 0.072169 * bl;
        double z = (0.019334 * rl + 0.119193 * gl + 0.950227 * bl) / ZN;

        double fx = f(x);
        double fy = f(y);
        double fz = f(z);
        return new double[] {116.0 * fy - 16.0, 500.0 * (fx - fy), 200.0 * (fy - fz)};
    }

    /**
     * @return packed 0xRRGGBB, channels clipped to [0, 255]
     */
    static int toRgb(double l, double a, double bStar) {
        double fy = (l + 16.0) / 116.0;
        double fx = fy + a / 500.0;
        double fz = fy - bStar / 200.0;

        double x = fInverse(fx) * XN;
        double y = fInverse(fy);
        double z = fInverse(fz) * ZN;

        double rl = 3.240479 * x - 1.537150 * y - 0.498535 * z;
        double gl = -0.969256 * x + 1.875992 * y + 0.041556 * z;
        double bl = 0.055648 * x - 0.204043 * y + 1.057311 * z;

        return (toByte(rl) << 16) | (toByte(gl) << 8) | toByte(bl);
    }

    private static double linearize(double c) {
        return c <= 0.04045 ? c / 12.92 : Math.pow((c + 0.055) / 1.055, 2.4);
    }

    private static int toByte(double linear) {
        double c = linear <= 0.0031308 ? 12.92 * linear : 1.055 * Math.pow(linear, 1 / 2.4) - 0.055;
        return (int) Math.round(Math.max(0, Math.min(1, c)) * 255.0);
    }

    private static double f(double t) {
        return t > EPSILON ? Math.cbrt(t) : (KAPPA * t + 16.0) / 116.0;
    }

    private static double fInverse(double t) {
        double t3 = t * t * t;
        return t3 > EPSILON ? t3 : (116.0 * t - 16.0) / KAPPA;
    }
}
