package loci.patchsynth.sampling;

import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.StitchMask;
import loci.patchsynth.normalization.StainNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Random;

/**
 * Uniform sampling: two patches and a stitch mask drawn with replacement from the whole corpus.
 * Every draw is accepted.
 */
public class GeneralizedSampler extends PatchSampler {
    private static final Logger logger = LoggerFactory.getLogger(GeneralizedSampler.class);

    private final int nPatches;

    public GeneralizedSampler(PatchSource source, CompositeWriter writer, StainNormalizer normalizer,
                              Random random, SamplingContext context, int nPatches) {
        super(source, writer, normalizer, random, context);
        this.nPatches = nPatches;
    }

    @Override
    public int run() throws IOException {
        List<String> patches = source.listPatchIds();
        if (patches.isEmpty()) {
            throw new IOException("No label masks found to sample from");
        }
        logger.info("Generating {} composites from {} patches", nPatches, patches.size());

        int count = 0;
        while (count < nPatches) {
            context.checkCancelled();
            String first = pick(patches);
            String second = pick(patches);
            StitchMask mask = drawStitchMask();
            LabelMask labels = stitchLabels(first, second, mask);
            emit(first, second, mask, labels);
            count++;
            if (count % 100 == 0) {
                logger.info("{}/{} composites written", count, nPatches);
            }
        }
        return count;
    }
}
