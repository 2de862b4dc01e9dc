package loci.patchsynth.model;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Per-pixel tissue class labels of one patch, row-major.
 */
public final class LabelMask {

    private final int width;
    private final int height;
    private final int[] labels;

    /**
     * @param width  width in pixels
     * @param height height in pixels
     * @param labels row-major class values, length {@code width * height}; not copied
     */
    public LabelMask(int width, int height, int[] labels) {
        if (labels.length != width * height) {
            throw new IllegalArgumentException(String.format(
                    "Label array holds %d values, expected %dx%d", labels.length, width, height));
        }
        this.width = width;
        this.height = height;
        this.labels = labels;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int get(int x, int y) {
        return labels[y * width + x];
    }

    /**
     * @return the raw row-major array backing this mask
     */
    public int[] getLabels() {
        return labels;
    }

    /**
     * @return the distinct class values present, ascending
     */
    public SortedSet<Integer> distinctClasses() {
        SortedSet<Integer> classes = new TreeSet<>();
        for (int label : labels) {
            classes.add(label);
        }
        return classes;
    }

    public int maxLabel() {
        int max = 0;
        for (int label : labels) {
            max = Math.max(max, label);
        }
        return max;
    }
}
