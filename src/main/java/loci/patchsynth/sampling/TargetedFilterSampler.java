package loci.patchsynth.sampling;

import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.PatchClassIndex;
import loci.patchsynth.model.StitchMask;
import loci.patchsynth.normalization.StainNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rejection sampling towards target class pairs.
 *
 * <p>A draw is accepted when its stitched labels contain both classes of at least one target pair.
 * Only the labels are stitched to test a draw; images are read and normalized for accepted draws
 * only. With exclusion enabled, patches that already hold a full target pair are never drawn, so
 * every accepted pair arises from the stitch.
 */
public class TargetedFilterSampler extends PatchSampler {
    private static final Logger logger = LoggerFactory.getLogger(TargetedFilterSampler.class);

    private final int nPatches;
    private final Set<ClassPair> targets;
    private final boolean excludeExisting;
    private final PatchClassIndex index;

    private long rejected;

    public TargetedFilterSampler(PatchSource source, CompositeWriter writer, StainNormalizer normalizer,
                                 Random random, SamplingContext context, int nPatches,
                                 List<ClassPair> targets, boolean excludeExisting, PatchClassIndex index) {
        super(source, writer, normalizer, random, context);
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("At least one target pair is required");
        }
        this.nPatches = nPatches;
        this.targets = new LinkedHashSet<>(targets);
        this.excludeExisting = excludeExisting;
        this.index = index;
    }

    @Override
    public int run() throws IOException {
        List<String> candidates = candidates();
        logger.info("Generating {} composites for target pairs {} from {} candidate patches",
                nPatches, targets, candidates.size());

        int count = 0;
        int attempts = 0;
        while (count < nPatches) {
            context.checkCancelled();
            if (attempts >= context.getMaxAttempts()) {
                throw new SamplingExhaustedException(String.format(
                        "No draw matched target pairs %s in %d consecutive attempts (%d of %d composites written)",
                        targets, attempts, count, nPatches));
            }
            String first = pick(candidates);
            String second = pick(candidates);
            StitchMask mask = drawStitchMask();
            LabelMask labels = stitchLabels(first, second, mask);
            if (!holdsTargetPair(labels.distinctClasses())) {
                attempts++;
                rejected++;
                continue;
            }
            String name = emit(first, second, mask, labels);
            logger.debug("Accepted {} after {} rejected draw(s)", name, attempts);
            count++;
            attempts = 0;
        }
        logger.info("Wrote {} composites, rejected {} draw(s)", count, rejected);
        return count;
    }

    /**
     * @return the patches eligible for drawing, after exclusion
     * @throws SamplingExhaustedException if no target pair can ever be formed from them
     */
    List<String> candidates() throws IOException {
        List<String> patches = source.listPatchIds();
        if (excludeExisting) {
            patches = patches.stream()
                    .filter(p -> !holdsTargetPair(index.classesOf(p)))
                    .collect(Collectors.toList());
        }
        if (patches.isEmpty()) {
            throw new SamplingExhaustedException(excludeExisting
                    ? "No candidate patches left after excluding those holding " + targets
                    : "No label masks found to sample from");
        }
        Set<Integer> available = new HashSet<>();
        for (String p : patches) {
            available.addAll(index.classesOf(p));
        }
        if (!holdsTargetPair(available)) {
            throw new SamplingExhaustedException("No target pair of " + targets
                    + " can be formed from the classes of the candidate patches " + available);
        }
        return patches;
    }

    boolean holdsTargetPair(Set<Integer> classes) {
        for (ClassPair pair : targets) {
            if (pair.isContainedIn(classes)) {
                return true;
            }
        }
        return false;
    }

    public long getRejected() {
        return rejected;
    }
}
