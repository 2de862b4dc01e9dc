package loci.patchsynth.sampling;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;
import loci.patchsynth.normalization.StainNormalizer;
import loci.patchsynth.utilities.CompositeNameGenerator;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.Random;

/**
 * Base of the three sampling policies.
 *
 * <p>Subclasses decide which source patches to draw; this class holds the shared resources and
 * turns an accepted draw into a written composite. Source images are normalized one by one before
 * they are stitched.
 */
public abstract class PatchSampler {

    protected final PatchSource source;
    protected final CompositeWriter writer;
    protected final StainNormalizer normalizer;
    protected final Random random;
    protected final SamplingContext context;

    private List<String> stitchMasks;

    protected PatchSampler(PatchSource source, CompositeWriter writer, StainNormalizer normalizer,
                           Random random, SamplingContext context) {
        this.source = source;
        this.writer = writer;
        this.normalizer = normalizer;
        this.random = random;
        this.context = context;
    }

    /**
     * Produces this sampler's share of composites.
     *
     * @return number of composites written
     * @throws IOException                 if an input is missing or unreadable, or an output cannot be written
     * @throws SamplingExhaustedException  if the constraints cannot be satisfied
     * @throws java.util.concurrent.CancellationException if the context was cancelled
     */
    public abstract int run() throws IOException;

    /**
     * @return a uniformly chosen element
     */
    protected <T> T pick(List<T> items) {
        return items.get(random.nextInt(items.size()));
    }

    /**
     * Draws and reads a stitch mask.
     */
    protected StitchMask drawStitchMask() throws IOException {
        if (stitchMasks == null) {
            stitchMasks = source.listStitchMasks();
            if (stitchMasks.isEmpty()) {
                throw new IOException("No stitch masks available");
            }
        }
        return source.readStitchMask(pick(stitchMasks));
    }

    /**
     * Normalizes both source images, stitches them and writes the composite with the given labels.
     *
     * @param labels the already stitched labels of the two sources
     * @return the composite base name
     */
    protected String emit(String firstPatch, String secondPatch, StitchMask mask, LabelMask labels)
            throws IOException {
        BufferedImage first = normalizer.transform(source.readImage(firstPatch));
        BufferedImage second = normalizer.transform(source.readImage(secondPatch));
        BufferedImage image = PatchCompositor.compositeImage(first, second, mask);
        String name = CompositeNameGenerator.generateName(firstPatch, secondPatch, mask.getId());
        writer.write(name, image, labels);
        return name;
    }

    /**
     * Reads the labels of both patches and stitches them.
     */
    protected LabelMask stitchLabels(String firstPatch, String secondPatch, StitchMask mask) throws IOException {
        return PatchCompositor.compositeLabels(source.readLabels(firstPatch), source.readLabels(secondPatch), mask);
    }
}
