package loci.patchsynth.sampling;

import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.LabelMask;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.PatchClassIndex;
import loci.patchsynth.model.StitchMask;
import loci.patchsynth.normalization.StainNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Quota-driven sampling over the class pools.
 *
 * <p>Pending pairs are served round-robin: each pass visits every pair still below quota once,
 * drawing the first patch from the pool of its first class and the second from the pool of its
 * second class. With exclusion enabled, a draw where either patch already holds both classes is
 * discarded and the pass moves on to the next pair.
 */
public class TargetedMatrixSampler extends PatchSampler {
    private static final Logger logger = LoggerFactory.getLogger(TargetedMatrixSampler.class);

    private final List<Quota> quotas;
    private final boolean excludeExisting;
    private final PatchClassIndex index;

    private static final class Quota {
        final int first;
        final int second;
        final int target;
        int done;
        int misses;

        Quota(int first, int second, int target) {
            this.first = first;
            this.second = second;
            this.target = target;
        }

        boolean isMet() {
            return done >= target;
        }

        ClassPair pair() {
            return new ClassPair(first, second);
        }
    }

    public TargetedMatrixSampler(PatchSource source, CompositeWriter writer, StainNormalizer normalizer,
                                 Random random, SamplingContext context, List<PairTask> tasks,
                                 boolean excludeExisting, PatchClassIndex index) {
        super(source, writer, normalizer, random, context);
        this.quotas = mergeTasks(tasks);
        this.excludeExisting = excludeExisting;
        this.index = index;
    }

    /**
     * Fragments of the same pair in one chunk become a single quota, in first-seen order.
     */
    private static List<Quota> mergeTasks(List<PairTask> tasks) {
        Map<ClassPair, PairTask> merged = new LinkedHashMap<>();
        for (PairTask task : tasks) {
            merged.merge(task.pair(), task, (a, b) -> a.withCount(a.count() + b.count()));
        }
        List<Quota> result = new ArrayList<>();
        for (PairTask task : merged.values()) {
            result.add(new Quota(task.classA(), task.classB(), task.count()));
        }
        return result;
    }

    @Override
    public int run() throws IOException {
        checkFeasible();
        int total = quotas.stream().mapToInt(q -> q.target).sum();
        logger.info("Generating {} composites for {} class pair(s)", total, quotas.size());

        int count = 0;
        while (count < total) {
            for (Quota quota : quotas) {
                if (quota.isMet()) {
                    continue;
                }
                context.checkCancelled();
                String first = pick(index.poolOf(quota.first));
                String second = pick(index.poolOf(quota.second));
                if (excludeExisting && (holdsBoth(first, quota) || holdsBoth(second, quota))) {
                    quota.misses++;
                    if (quota.misses >= context.getMaxAttempts()) {
                        throw new SamplingExhaustedException(String.format(
                                "Pair %s: %d consecutive draws already held both classes (%d of %d written)",
                                quota.pair(), quota.misses, quota.done, quota.target));
                    }
                    continue;
                }
                StitchMask mask = drawStitchMask();
                LabelMask labels = stitchLabels(first, second, mask);
                String name = emit(first, second, mask, labels);
                logger.debug("Pair {}: wrote {}", quota.pair(), name);
                quota.done++;
                quota.misses = 0;
                count++;
                if (count >= total) {
                    break;
                }
            }
        }
        logger.info("Wrote {} composites", count);
        return count;
    }

    /**
     * @throws SamplingExhaustedException if some pair can never be drawn
     */
    void checkFeasible() {
        for (Quota quota : quotas) {
            for (int cls : new int[] {quota.first, quota.second}) {
                List<String> pool = index.poolOf(cls);
                if (pool.isEmpty()) {
                    throw new SamplingExhaustedException(
                            "Pair " + quota.pair() + ": no patch contains class " + cls);
                }
                if (excludeExisting && pool.stream().allMatch(p -> holdsBoth(p, quota))) {
                    throw new SamplingExhaustedException("Pair " + quota.pair()
                            + ": every patch with class " + cls + " already holds both classes");
                }
            }
        }
    }

    private boolean holdsBoth(String patchId, Quota quota) {
        return index.containsPair(patchId, quota.pair());
    }

    /**
     * @return composites written per pair so far
     */
    public Map<ClassPair, Integer> getCounters() {
        Map<ClassPair, Integer> counters = new LinkedHashMap<>();
        for (Quota quota : quotas) {
            counters.put(quota.pair(), quota.done);
        }
        return counters;
    }
}
