package loci.patchsynth.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CompositeNameGenerator
 *
 * <p>Builds the base name shared by a composite image and its label mask:
 * {@code <patch1>_<patch2>_<mask-id>}. Patch file names lose their extension; the stitch mask is
 * passed as its id, which has already lost it, and is used as is. Dots left in an id are kept.
 *
 * <p>The image is written as {@code <base>.jpg} under the output image folder and the labels as
 * {@code <base>.png} under the output mask folder, so the two stay associated by name.
 * The same triple drawn twice yields the same name and the later write replaces the earlier one.
 */
public class CompositeNameGenerator {
    private static final Logger logger = LoggerFactory.getLogger(CompositeNameGenerator.class);

    public static final String IMAGE_EXTENSION = ".jpg";
    public static final String LABEL_EXTENSION = ".png";

    /**
     * @param firstPatch  file name of the first source patch (label mask or image)
     * @param secondPatch file name of the second source patch
     * @param stitchMask  id of the stitch mask (its file name without extension)
     * @return the composite base name
     */
    public static String generateName(String firstPatch, String secondPatch, String stitchMask) {
        if (firstPatch == null || secondPatch == null || stitchMask == null) {
            throw new IllegalArgumentException("Composite name needs two patches and a mask");
        }
        String name = MinorFunctions.stripExtension(firstPatch)
                + "_" + MinorFunctions.stripExtension(secondPatch)
                + "_" + stitchMask;
        logger.debug("Generated composite name: {} (patches={}, {}, mask={})",
                name, firstPatch, secondPatch, stitchMask);
        return name;
    }

    public static String imageFileName(String baseName) {
        return baseName + IMAGE_EXTENSION;
    }

    public static String labelFileName(String baseName) {
        return baseName + LABEL_EXTENSION;
    }
}
