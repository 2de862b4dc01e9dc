package loci.patchsynth.model;

/**
 * Binary selector deciding, per pixel, which of two source patches contributes to a composite.
 * A cleared pixel takes the first source, a set pixel the second.
 */
public final class StitchMask {

    private final String id;
    private final int width;
    private final int height;
    private final boolean[] selectSecond;

    /**
     * @param id           mask identifier used in composite names (file name without extension)
     * @param width        width in pixels
     * @param height       height in pixels
     * @param selectSecond row-major selector, length {@code width * height}; not copied
     */
    public StitchMask(String id, int width, int height, boolean[] selectSecond) {
        if (selectSecond.length != width * height) {
            throw new IllegalArgumentException(String.format(
                    "Stitch mask '%s' holds %d values, expected %dx%d", id, selectSecond.length, width, height));
        }
        this.id = id;
        this.width = width;
        this.height = height;
        this.selectSecond = selectSecond;
    }

    /**
     * Binarizes raw mask samples: any nonzero value selects the second source.
     */
    public static StitchMask fromSamples(String id, int width, int height, int[] samples) {
        boolean[] select = new boolean[samples.length];
        for (int i = 0; i < samples.length; i++) {
            select[i] = samples[i] != 0;
        }
        return new StitchMask(id, width, height, select);
    }

    public String getId() {
        return id;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean selectsSecond(int x, int y) {
        return selectSecond[y * width + x];
    }

    public boolean selectsSecond(int index) {
        return selectSecond[index];
    }
}
