package loci.patchsynth;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.utilities.PatchImageIO;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Builds small on-disk corpora for sampler and worker tests:
 * {@code <root>/data/image/*.jpg}, {@code <root>/data/mask_FINAL/*.png} and a stitch mask folder.
 */
public final class PatchFixtures {

    public static final int SIZE = 2;

    public final Path dataRoot;
    public final Path imageDir;
    public final Path maskDir;
    public final Path stitchDir;

    public PatchFixtures(Path root) throws IOException {
        this.dataRoot = root.resolve("data");
        this.imageDir = Files.createDirectories(dataRoot.resolve("image"));
        this.maskDir = Files.createDirectories(dataRoot.resolve("mask_FINAL"));
        this.stitchDir = Files.createDirectories(root.resolve("stitch"));
    }

    /**
     * Adds a patch whose every pixel has the given class and color.
     */
    public PatchFixtures patch(String name, int classLabel, int rgb) throws IOException {
        int[] labels = new int[SIZE * SIZE];
        Arrays.fill(labels, classLabel);
        return patch(name, labels, rgb);
    }

    /**
     * Adds a patch with the given row-major labels and a uniform color.
     */
    public PatchFixtures patch(String name, int[] labels, int rgb) throws IOException {
        PatchImageIO.writeImage(solid(rgb), imageDir.resolve(name + ".jpg"));
        PatchImageIO.writeLabelMask(new LabelMask(SIZE, SIZE, labels), maskDir.resolve(name + ".png"));
        return this;
    }

    /**
     * Adds a stitch mask with the given row-major samples.
     */
    public PatchFixtures stitchMask(String name, int... samples) throws IOException {
        BufferedImage img = new BufferedImage(SIZE, SIZE, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        raster.setSamples(0, 0, SIZE, SIZE, 0, samples);
        ImageIO.write(img, "png", stitchDir.resolve(name + ".png").toFile());
        return this;
    }

    public static BufferedImage solid(int rgb) {
        return solid(SIZE, SIZE, rgb);
    }

    public static BufferedImage solid(int width, int height, int rgb) {
        BufferedImage img = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                img.setRGB(x, y, rgb);
            }
        }
        return img;
    }

    /**
     * @return file names in a folder, sorted
     */
    public static String[] list(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return new String[0];
        }
        try (var files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toArray(String[]::new);
        }
    }
}
