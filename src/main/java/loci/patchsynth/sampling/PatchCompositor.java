package loci.patchsynth.sampling;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;

import java.awt.image.BufferedImage;

/**
 * Pixel-wise stitching of two sources along a {@link StitchMask}: a cleared mask pixel takes the
 * first source, a set one the second. The mask applies to all color channels alike.
 */
public class PatchCompositor {

    private PatchCompositor() {}

    /**
     * @return a new RGB composite
     * @throws IllegalArgumentException if the three inputs differ in size
     */
    public static BufferedImage compositeImage(BufferedImage first, BufferedImage second, StitchMask mask) {
        requireSameSize(first.getWidth(), first.getHeight(), second.getWidth(), second.getHeight(), mask, "image");
        int w = mask.getWidth();
        int h = mask.getHeight();
        int[] a = first.getRGB(0, 0, w, h, null, 0, w);
        int[] b = second.getRGB(0, 0, w, h, null, 0, w);
        int[] out = new int[a.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = mask.selectsSecond(i) ? b[i] : a[i];
        }
        BufferedImage composite = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        composite.setRGB(0, 0, w, h, out, 0, w);
        return composite;
    }

    /**
     * @return the composite label mask
     * @throws IllegalArgumentException if the three inputs differ in size
     */
    public static LabelMask compositeLabels(LabelMask first, LabelMask second, StitchMask mask) {
        requireSameSize(first.getWidth(), first.getHeight(), second.getWidth(), second.getHeight(), mask, "label");
        int[] a = first.getLabels();
        int[] b = second.getLabels();
        int[] out = new int[a.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = mask.selectsSecond(i) ? b[i] : a[i];
        }
        return new LabelMask(mask.getWidth(), mask.getHeight(), out);
    }

    private static void requireSameSize(int w1, int h1, int w2, int h2, StitchMask mask, String what) {
        if (w1 != w2 || h1 != h2 || w1 != mask.getWidth() || h1 != mask.getHeight()) {
            throw new IllegalArgumentException(String.format(
                    "Cannot stitch %s sources of %dx%d and %dx%d with mask '%s' of %dx%d",
                    what, w1, h1, w2, h2, mask.getId(), mask.getWidth(), mask.getHeight()));
        }
    }
}
