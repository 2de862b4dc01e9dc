package loci.patchsynth.utilities;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reading and writing of patch images, label masks and stitch masks.
 *
 * <p>Images are handled as {@link BufferedImage#TYPE_INT_RGB}. Label masks and stitch masks are read
 * from the first raster band, so grey-level and palette PNGs both give their stored values.
 */
public class PatchImageIO {
    private static final Logger logger = LoggerFactory.getLogger(PatchImageIO.class);

    /**
     * Reads an image and converts it to packed RGB.
     *
     * @param path image file
     * @return RGB image
     * @throws IOException if the file is missing or no reader understands it
     */
    public static BufferedImage readRgb(Path path) throws IOException {
        BufferedImage img = readRaw(path);
        if (img.getType() == BufferedImage.TYPE_INT_RGB) {
            return img;
        }
        BufferedImage rgb = new BufferedImage(img.getWidth(), img.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(img, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }

    /**
     * @param path label mask file
     * @return class values of the first band
     */
    public static LabelMask readLabelMask(Path path) throws IOException {
        BufferedImage img = readRaw(path);
        Raster raster = img.getRaster();
        int w = raster.getWidth();
        int h = raster.getHeight();
        int[] labels = raster.getSamples(0, 0, w, h, 0, new int[w * h]);
        return new LabelMask(w, h, labels);
    }

    /**
     * @param path stitch mask file; its name without extension becomes the mask id
     * @return binarized stitch mask
     */
    public static StitchMask readStitchMask(Path path) throws IOException {
        BufferedImage img = readRaw(path);
        Raster raster = img.getRaster();
        int w = raster.getWidth();
        int h = raster.getHeight();
        int[] samples = raster.getSamples(0, 0, w, h, 0, new int[w * h]);
        return StitchMask.fromSamples(MinorFunctions.stripExtension(path.getFileName().toString()), w, h, samples);
    }

    /**
     * Writes an RGB image in the format implied by the file extension.
     */
    public static void writeImage(BufferedImage image, Path path) throws IOException {
        String format = formatOf(path);
        if (!ImageIO.write(image, format, path.toFile())) {
            throw new IOException("No image writer for format '" + format + "': " + path);
        }
        logger.debug("Wrote image {}", path);
    }

    /**
     * Writes labels as a single-band PNG, 8 bit when every value fits, 16 bit otherwise.
     */
    public static void writeLabelMask(LabelMask labels, Path path) throws IOException {
        int type = labels.maxLabel() <= 0xFF ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_USHORT_GRAY;
        BufferedImage img = new BufferedImage(labels.getWidth(), labels.getHeight(), type);
        WritableRaster raster = img.getRaster();
        raster.setSamples(0, 0, labels.getWidth(), labels.getHeight(), 0, labels.getLabels());
        if (!ImageIO.write(img, "png", path.toFile())) {
            throw new IOException("No PNG writer available: " + path);
        }
        logger.debug("Wrote label mask {}", path);
    }

    private static BufferedImage readRaw(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image file not found: " + path);
        }
        BufferedImage img = ImageIO.read(path.toFile());
        if (img == null) {
            throw new IOException("Unsupported or malformed image: " + path);
        }
        return img;
    }

    private static String formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String ext = dot >= 0 ? name.substring(dot + 1).toLowerCase() : "png";
        return ext.equals("jpeg") ? "jpg" : ext;
    }
}
