package loci.patchsynth.normalization;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Macenko stain normalization for H&amp;E images.
 *
 * <p>Stain vectors are estimated in optical density (OD) space from tissue pixels: the two main
 * eigenvectors of the OD covariance span the stain plane, and the robust extreme angles in that
 * plane give the hematoxylin and eosin directions. {@link #fit} stores the stain matrix and the
 * 99th-percentile concentrations of the reference; {@link #transform} re-expresses a source image's
 * concentrations in the reference's stains, rescaled to the reference's maximum concentrations.
 *
 * <p>Concentrations are solved by least squares and clamped at zero.
 */
public class MacenkoStainNormalizer implements StainNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(MacenkoStainNormalizer.class);

    /** Pixels with a lightness below this fraction count as tissue. */
    static final double LUMINOSITY_THRESHOLD = 0.8;
    static final double ANGULAR_PERCENTILE = 99.0;
    static final double MIN_OD = 1e-6;
    /** Fewer tissue pixels than this cannot support a stain estimate. */
    static final int MIN_TISSUE_PIXELS = 10;
    static final double MAX_STAIN_COSINE = 0.9999;

    private double[][] stainMatrix;
    private double[] maxConcentrations;

    public MacenkoStainNormalizer() {
    }

    private MacenkoStainNormalizer(double[][] stainMatrix, double[] maxConcentrations) {
        this.stainMatrix = stainMatrix;
        this.maxConcentrations = maxConcentrations;
    }

    /**
     * Rebuilds a fitted normalizer from persisted state.
     *
     * @param stainMatrix       2x3 matrix, rows are the unit H and E stain vectors in OD space
     * @param maxConcentrations the reference's 99th-percentile H and E concentrations
     */
    public static MacenkoStainNormalizer fromModel(double[][] stainMatrix, double[] maxConcentrations) {
        if (stainMatrix == null || stainMatrix.length != 2
                || stainMatrix[0].length != 3 || stainMatrix[1].length != 3) {
            throw new IllegalArgumentException("Stain matrix must be 2x3");
        }
        if (maxConcentrations == null || maxConcentrations.length != 2) {
            throw new IllegalArgumentException("Two maximum concentrations are required");
        }
        return new MacenkoStainNormalizer(
                new double[][] {stainMatrix[0].clone(), stainMatrix[1].clone()},
                maxConcentrations.clone());
    }

    /**
     * Fits the normalizer to a reference image.
     *
     * @param reference RGB reference image, already brightness-standardized
     * @return this normalizer
     * @throws IllegalArgumentException if the reference holds too little tissue
     */
    public MacenkoStainNormalizer fit(BufferedImage reference) {
        double[][] od = opticalDensity(reference);
        double[][] stains = estimateStainMatrix(od);
        if (stains == null) {
            throw new IllegalArgumentException("Reference image does not contain enough stained tissue to fit stains");
        }
        this.stainMatrix = stains;
        this.maxConcentrations = percentileConcentrations(concentrations(od, stains));
        logger.info("Fitted stain matrix H={} E={}, max concentrations {}",
                Arrays.toString(stains[0]), Arrays.toString(stains[1]), Arrays.toString(maxConcentrations));
        return this;
    }

    public boolean isFitted() {
        return stainMatrix != null;
    }

    @Override
    public BufferedImage transform(BufferedImage image) {
        if (!isFitted()) {
            throw new IllegalStateException("Normalizer has not been fitted");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        double[][] od = opticalDensity(image);

        double[][] sourceStains = estimateStainMatrix(od);
        if (sourceStains == null) {
            logger.warn("Too little tissue to estimate stains on a {}x{} patch, leaving colors unchanged", width, height);
            return copyRgb(image);
        }
        double[][] c = concentrations(od, sourceStains);
        double[] sourceMax = percentileConcentrations(c);

        int[] rgb = new int[od.length];
        for (int i = 0; i < od.length; i++) {
            double ch = sourceMax[0] > 0 ? c[i][0] * maxConcentrations[0] / sourceMax[0] : 0;
            double ce = sourceMax[1] > 0 ? c[i][1] * maxConcentrations[1] / sourceMax[1] : 0;
            int packed = 0;
            for (int k = 0; k < 3; k++) {
                double value = 255.0 * Math.exp(-(ch * stainMatrix[0][k] + ce * stainMatrix[1][k]));
                int v = (int) Math.max(0, Math.min(255, value));
                packed = (packed << 8) | v;
            }
            rgb[i] = packed;
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, rgb, 0, width);
        return out;
    }

    public double[][] getStainMatrix() {
        return stainMatrix == null ? null : new double[][] {stainMatrix[0].clone(), stainMatrix[1].clone()};
    }

    public double[] getMaxConcentrations() {
        return maxConcentrations == null ? null : maxConcentrations.clone();
    }

    /**
     * @return per-pixel OD triples, zeros in the input treated as ones
     */
    static double[][] opticalDensity(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        double[][] od = new double[rgb.length][3];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            od[i][0] = toOd((p >> 16) & 0xFF);
            od[i][1] = toOd((p >> 8) & 0xFF);
            od[i][2] = toOd(p & 0xFF);
        }
        return od;
    }

    private static double toOd(int channel) {
        return Math.max(-Math.log(Math.max(channel, 1) / 255.0), MIN_OD);
    }

    /**
     * @return the 2x3 H/E stain matrix, or null if there are too few tissue pixels or only one stain
     */
    static double[][] estimateStainMatrix(double[][] od) {
        double[][] tissue = Arrays.stream(od)
                .filter(MacenkoStainNormalizer::isTissue)
                .toArray(double[][]::new);
        if (tissue.length < MIN_TISSUE_PIXELS) {
            return null;
        }

        RealMatrix covariance = new Covariance(tissue).getCovarianceMatrix();
        EigenDecomposition eigen = new EigenDecomposition(covariance);
        double[] values = eigen.getRealEigenvalues();
        Integer[] order = {0, 1, 2};
        Arrays.sort(order, (x, y) -> Double.compare(values[y], values[x]));

        double[] v1 = eigen.getEigenvector(order[0]).toArray();
        double[] v2 = eigen.getEigenvector(order[1]).toArray();
        if (v1[0] < 0) {
            negate(v1);
        }
        if (v2[0] < 0) {
            negate(v2);
        }

        double[] angles = new double[tissue.length];
        for (int i = 0; i < tissue.length; i++) {
            double p1 = dot(tissue[i], v1);
            double p2 = dot(tissue[i], v2);
            angles[i] = Math.atan2(p2, p1);
        }
        double minAngle = LuminosityStandardizer.percentile(angles, 100 - ANGULAR_PERCENTILE);
        double maxAngle = LuminosityStandardizer.percentile(angles, ANGULAR_PERCENTILE);

        double[] s1 = combine(v1, v2, minAngle);
        double[] s2 = combine(v1, v2, maxAngle);
        // Hematoxylin has the larger red OD component
        double[][] stains = s1[0] > s2[0] ? new double[][] {s1, s2} : new double[][] {s2, s1};
        normalize(stains[0]);
        normalize(stains[1]);
        if (Math.abs(dot(stains[0], stains[1])) > MAX_STAIN_COSINE) {
            // A single dominant stain, no second direction to separate
            return null;
        }
        return stains;
    }

    /**
     * Least-squares concentrations of each pixel for the given stains, clamped at zero.
     */
    static double[][] concentrations(double[][] od, double[][] stains) {
        RealMatrix s = new Array2DRowRealMatrix(stains, false);
        RealMatrix pseudoInverse;
        try {
            RealMatrix gram = s.multiply(s.transpose());
            pseudoInverse = s.transpose().multiply(new LUDecomposition(gram).getSolver().getInverse());
        } catch (SingularMatrixException e) {
            throw new IllegalArgumentException("Stain vectors are collinear", e);
        }
        double[][] p = pseudoInverse.getData();
        double[][] c = new double[od.length][2];
        for (int i = 0; i < od.length; i++) {
            for (int k = 0; k < 2; k++) {
                double v = od[i][0] * p[0][k] + od[i][1] * p[1][k] + od[i][2] * p[2][k];
                c[i][k] = Math.max(0, v);
            }
        }
        return c;
    }

    private static double[] percentileConcentrations(double[][] c) {
        double[] h = new double[c.length];
        double[] e = new double[c.length];
        for (int i = 0; i < c.length; i++) {
            h[i] = c[i][0];
            e[i] = c[i][1];
        }
        return new double[] {
                LuminosityStandardizer.percentile(h, 99),
                LuminosityStandardizer.percentile(e, 99)
        };
    }

    private static boolean isTissue(double[] od) {
        int r = (int) Math.round(255.0 * Math.exp(-od[0]));
        int g = (int) Math.round(255.0 * Math.exp(-od[1]));
        int b = (int) Math.round(255.0 * Math.exp(-od[2]));
        return LabColor.fromRgb(r, g, b)[0] / 100.0 < LUMINOSITY_THRESHOLD;
    }

    private static double[] combine(double[] v1, double[] v2, double angle) {
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return new double[] {
                v1[0] * c + v2[0] * s,
                v1[1] * c + v2[1] * s,
                v1[2] * c + v2[2] * s
        };
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static void negate(double[] v) {
        for (int i = 0; i < v.length; i++) {
            v[i] = -v[i];
        }
    }

    private static void normalize(double[] v) {
        double norm = Math.sqrt(dot(v, v));
        if (norm > 0) {
            for (int i = 0; i < v.length; i++) {
                v[i] /= norm;
            }
        }
    }

    private static BufferedImage copyRgb(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, image.getRGB(0, 0, width, height, null, 0, width), 0, width);
        return out;
    }
}
