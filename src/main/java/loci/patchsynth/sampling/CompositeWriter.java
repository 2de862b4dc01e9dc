package loci.patchsynth.sampling;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.utilities.CompositeNameGenerator;
import loci.patchsynth.utilities.PatchImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes composites into two parallel trees under the output folder: images to
 * {@code <output>/<imageDirName>/<name>.jpg} and labels to {@code <output>/<maskDirName>/<name>.png}.
 */
public class CompositeWriter {
    private static final Logger logger = LoggerFactory.getLogger(CompositeWriter.class);

    private final Path imageOut;
    private final Path maskOut;
    private int written;

    public CompositeWriter(Path outputDir, String imageDirName, String maskDirName) {
        this.imageOut = outputDir.resolve(imageDirName);
        this.maskOut = outputDir.resolve(maskDirName);
    }

    /**
     * Creates both output folders if needed.
     */
    public CompositeWriter prepare() throws IOException {
        Files.createDirectories(imageOut);
        Files.createDirectories(maskOut);
        return this;
    }

    /**
     * @param baseName composite base name, see {@link CompositeNameGenerator}
     */
    public void write(String baseName, BufferedImage image, LabelMask labels) throws IOException {
        PatchImageIO.writeImage(image, imageOut.resolve(CompositeNameGenerator.imageFileName(baseName)));
        PatchImageIO.writeLabelMask(labels, maskOut.resolve(CompositeNameGenerator.labelFileName(baseName)));
        written++;
        logger.debug("Wrote composite {} ({} so far)", baseName, written);
    }

    public int getWritten() {
        return written;
    }

    public Path getImageOut() {
        return imageOut;
    }

    public Path getMaskOut() {
        return maskOut;
    }
}
