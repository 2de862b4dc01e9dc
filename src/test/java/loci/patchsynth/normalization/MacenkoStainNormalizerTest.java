package loci.patchsynth.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MacenkoStainNormalizer on synthetic H&amp;E images built from known stain vectors.
 */
class MacenkoStainNormalizerTest {

    static final double[] HEMATOXYLIN = unit(0.65, 0.70, 0.29);
    static final double[] EOSIN = unit(0.07, 0.99, 0.11);

    /**
     * A third of the pixels carry hematoxylin only, a third eosin only, the rest both.
     */
    static BufferedImage syntheticHE(int width, int height, long seed, double scale) {
        Random random = new Random(seed);
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int kind = (y * width + x) % 3;
                double ch = kind == 1 ? 0 : scale * (0.6 + 0.9 * random.nextDouble());
                double ce = kind == 0 ? 0 : scale * (0.6 + 0.9 * random.nextDouble());
                int rgb = 0;
                for (int k = 0; k < 3; k++) {
                    double od = ch * HEMATOXYLIN[k] + ce * EOSIN[k];
                    rgb = (rgb << 8) | (int) Math.round(255.0 * Math.exp(-od));
                }
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    private static double[] unit(double r, double g, double b) {
        double n = Math.sqrt(r * r + g * g + b * b);
        return new double[] {r / n, g / n, b / n};
    }

    private static double cosine(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static double meanAbsDifference(BufferedImage a, BufferedImage b) {
        long total = 0;
        for (int y = 0; y < a.getHeight(); y++) {
            for (int x = 0; x < a.getWidth(); x++) {
                int p = a.getRGB(x, y);
                int q = b.getRGB(x, y);
                for (int shift = 0; shift <= 16; shift += 8) {
                    total += Math.abs(((p >> shift) & 0xFF) - ((q >> shift) & 0xFF));
                }
            }
        }
        return total / (3.0 * a.getWidth() * a.getHeight());
    }

    // ==================== Fitting ====================

    @Test
    @DisplayName("Fitting recovers the hematoxylin and eosin directions")
    void testFitRecoversStains() {
        MacenkoStainNormalizer normalizer = new MacenkoStainNormalizer().fit(syntheticHE(30, 30, 1, 1.0));

        double[][] stains = normalizer.getStainMatrix();
        assertTrue(normalizer.isFitted());
        assertTrue(cosine(stains[0], HEMATOXYLIN) > 0.98, "H row " + Arrays.toString(stains[0]));
        assertTrue(cosine(stains[1], EOSIN) > 0.98, "E row " + Arrays.toString(stains[1]));
        double[] max = normalizer.getMaxConcentrations();
        assertTrue(max[0] > 0 && max[1] > 0);
    }

    @Test
    @DisplayName("A reference without tissue cannot be fitted")
    void testFitBlankReference() {
        BufferedImage white = new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 20; y++) {
            for (int x = 0; x < 20; x++) {
                white.setRGB(x, y, 0xFFFFFF);
            }
        }

        assertThrows(IllegalArgumentException.class, () -> new MacenkoStainNormalizer().fit(white));
    }

    // ==================== Transform ====================

    @Test
    @DisplayName("The reference maps close to itself")
    void testReferenceIsFixedPoint() {
        BufferedImage reference = syntheticHE(30, 30, 2, 1.0);
        MacenkoStainNormalizer normalizer = new MacenkoStainNormalizer().fit(reference);

        BufferedImage out = normalizer.transform(reference);

        assertTrue(meanAbsDifference(reference, out) < 4.0);
    }

    @Test
    @DisplayName("A faint source is pulled toward the reference's stain intensity")
    void testFaintSourceDarkened() {
        BufferedImage reference = syntheticHE(30, 30, 3, 1.0);
        MacenkoStainNormalizer normalizer = new MacenkoStainNormalizer().fit(reference);
        BufferedImage faint = syntheticHE(30, 30, 4, 0.7);

        BufferedImage out = normalizer.transform(faint);

        assertTrue(meanAbsDifference(reference, out) < meanAbsDifference(reference, faint));
    }

    @Test
    @DisplayName("Output keeps the source's dimensions and leaves the input untouched")
    void testShapePreserved() {
        MacenkoStainNormalizer normalizer = new MacenkoStainNormalizer().fit(syntheticHE(30, 30, 5, 1.0));
        BufferedImage source = syntheticHE(17, 9, 6, 1.0);
        int before = source.getRGB(3, 4);

        BufferedImage out = normalizer.transform(source);

        assertEquals(17, out.getWidth());
        assertEquals(9, out.getHeight());
        assertEquals(before, source.getRGB(3, 4));
    }

    @Test
    @DisplayName("A patch without tissue is returned unchanged")
    void testBlankPatchUnchanged() {
        MacenkoStainNormalizer normalizer = new MacenkoStainNormalizer().fit(syntheticHE(30, 30, 7, 1.0));
        BufferedImage blank = new BufferedImage(8, 8, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 8; y++) {
            for (int x = 0; x < 8; x++) {
                blank.setRGB(x, y, 0xF0F0F0);
            }
        }

        BufferedImage out = normalizer.transform(blank);

        assertEquals(0, meanAbsDifference(blank, out));
    }

    @Test
    void testTransformBeforeFit() {
        assertThrows(IllegalStateException.class,
                () -> new MacenkoStainNormalizer().transform(syntheticHE(4, 4, 8, 1.0)));
    }

    @Test
    @DisplayName("Persisted state must be a 2x3 matrix with two maxima")
    void testFromModelValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> MacenkoStainNormalizer.fromModel(new double[][] {{1, 0, 0}}, new double[] {1, 1}));
        assertThrows(IllegalArgumentException.class,
                () -> MacenkoStainNormalizer.fromModel(new double[][] {HEMATOXYLIN, EOSIN}, new double[] {1}));
        assertTrue(MacenkoStainNormalizer.fromModel(new double[][] {HEMATOXYLIN, EOSIN}, new double[] {1, 1}).isFitted());
    }
}
