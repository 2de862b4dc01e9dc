package loci.patchsynth.normalization;

import java.awt.image.BufferedImage;

/**
 * A fitted color transform applied to every source patch before compositing.
 *
 * <p>Implementations are pure functions of their fitted state: the input image is never modified
 * and the same input always gives the same output.
 */
@FunctionalInterface
public interface StainNormalizer {

    /**
     * @param image RGB source image
     * @return a new RGB image of identical width and height
     */
    BufferedImage transform(BufferedImage image);

    /**
     * @return a normalizer that runs this one, then {@code next}
     */
    default StainNormalizer andThen(StainNormalizer next) {
        return image -> next.transform(transform(image));
    }

    /**
     * @return the transform used when normalization is disabled
     */
    static StainNormalizer identity() {
        return image -> image;
    }
}
