package loci.patchsynth.sampling;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;
import loci.patchsynth.utilities.MinorFunctions;
import loci.patchsynth.utilities.PatchImageIO;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The input corpus of one worker: source images, their label masks and the stitch masks.
 *
 * <p>A patch is identified by its label-mask file name ({@code X.png}); its image is
 * {@code X<imageExtension>} in the image folder.
 */
public class PatchSource {

    private final Path imageDir;
    private final Path maskDir;
    private final Path stitchMaskDir;
    private final String imageExtension;

    public PatchSource(Path imageDir, Path maskDir, Path stitchMaskDir, String imageExtension) {
        this.imageDir = imageDir;
        this.maskDir = maskDir;
        this.stitchMaskDir = stitchMaskDir;
        this.imageExtension = imageExtension;
    }

    /**
     * @return label-mask file names, sorted
     */
    public List<String> listPatchIds() throws IOException {
        return listFiles(maskDir, "Label mask");
    }

    /**
     * @return stitch-mask file names, sorted
     */
    public List<String> listStitchMasks() throws IOException {
        return listFiles(stitchMaskDir, "Stitch mask");
    }

    public Path imagePath(String patchId) {
        return imageDir.resolve(MinorFunctions.stripExtension(patchId) + imageExtension);
    }

    public Path maskPath(String patchId) {
        return maskDir.resolve(patchId);
    }

    public BufferedImage readImage(String patchId) throws IOException {
        return PatchImageIO.readRgb(imagePath(patchId));
    }

    public LabelMask readLabels(String patchId) throws IOException {
        return PatchImageIO.readLabelMask(maskPath(patchId));
    }

    public StitchMask readStitchMask(String fileName) throws IOException {
        return PatchImageIO.readStitchMask(stitchMaskDir.resolve(fileName));
    }

    private static List<String> listFiles(Path dir, String what) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException(what + " folder not found: " + dir);
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
