package loci.patchsynth.normalization;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.awt.image.BufferedImage;

/**
 * Brightness standardization: stretches the L* channel so its 95th percentile becomes white.
 *
 * <p>Runs before the stain transform, on source patches and on the reference image alike.
 */
public class LuminosityStandardizer implements StainNormalizer {

    public static final double DEFAULT_PERCENTILE = 95.0;

    private final double percentile;

    public LuminosityStandardizer() {
        this(DEFAULT_PERCENTILE);
    }

    public LuminosityStandardizer(double percentile) {
        if (percentile <= 0 || percentile > 100) {
            throw new IllegalArgumentException("Percentile must be in (0, 100]: " + percentile);
        }
        this.percentile = percentile;
    }

    @Override
    public BufferedImage transform(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);

        double[] lightness = new double[rgb.length];
        double[] a = new double[rgb.length];
        double[] b = new double[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            double[] lab = LabColor.fromRgb((p >> 16) & 0xFF, (p >> 8) & 0xFF, p & 0xFF);
            lightness[i] = lab[0] / 100.0;
            a[i] = lab[1];
            b[i] = lab[2];
        }

        double reference = percentile(lightness, percentile);
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        if (reference <= 0) {
            // All black, nothing to stretch
            out.setRGB(0, 0, width, height, rgb, 0, width);
            return out;
        }

        int[] result = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            double l = Math.min(1.0, lightness[i] / reference) * 100.0;
            result[i] = LabColor.toRgb(l, a[i], b[i]);
        }
        out.setRGB(0, 0, width, height, result, 0, width);
        return out;
    }

    /**
     * Linear-interpolation percentile, matching the usual numeric-library default.
     */
    static double percentile(double[] values, double p) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }
}
