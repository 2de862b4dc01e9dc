package loci.patchsynth.worker;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import loci.patchsynth.model.PatchClassIndex;
import loci.patchsynth.model.SynthesisMode;
import loci.patchsynth.normalization.NormalizerStore;
import loci.patchsynth.normalization.StainNormalizer;
import loci.patchsynth.sampling.CompositeWriter;
import loci.patchsynth.sampling.GeneralizedSampler;
import loci.patchsynth.sampling.PatchSampler;
import loci.patchsynth.sampling.PatchSource;
import loci.patchsynth.sampling.SamplingContext;
import loci.patchsynth.sampling.SamplingExhaustedException;
import loci.patchsynth.sampling.TargetedFilterSampler;
import loci.patchsynth.sampling.TargetedMatrixSampler;
import loci.patchsynth.utilities.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Random;
import java.util.concurrent.CancellationException;

/**
 * Entry point of a worker process: samples and writes the composites of one chunk.
 *
 * <p>Exit codes: 0 success, 1 failure, 2 bad arguments, 3 sampling exhausted, 4 cancelled.
 * When the process is asked to terminate, a shutdown hook cancels the running sampler and gives it
 * a moment to stop between two composites.
 */
public class StitchWorker {
    private static final Logger logger = LoggerFactory.getLogger(StitchWorker.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_BAD_ARGUMENTS = 2;
    public static final int EXIT_EXHAUSTED = 3;
    public static final int EXIT_CANCELLED = 4;

    private static final long SHUTDOWN_WAIT_MS = 5000;

    public static void main(String[] args) {
        int code = run(args);
        if (code == EXIT_CANCELLED) {
            // Cancellation comes from the shutdown hook; System.exit would block behind it
            Runtime.getRuntime().halt(code);
        }
        System.exit(code);
    }

    /**
     * Runs a worker in the current JVM.
     *
     * @return the process exit code
     */
    public static int run(String[] args) {
        WorkerParameters params = new WorkerParameters();
        JCommander commander = JCommander.newBuilder()
                .addObject(params)
                .programName(StitchWorker.class.getSimpleName())
                .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            logger.error("Invalid worker arguments: {}", e.getMessage());
            return EXIT_BAD_ARGUMENTS;
        }
        if (params.help) {
            commander.usage();
            return EXIT_OK;
        }

        SamplingContext context;
        PatchSampler sampler;
        try {
            context = new SamplingContext(params.maxAttempts);
            sampler = createSampler(params, context);
        } catch (IllegalArgumentException | InvalidConfigurationException e) {
            logger.error("Invalid worker arguments: {}", e.getMessage());
            return EXIT_BAD_ARGUMENTS;
        } catch (IOException e) {
            logger.error("Worker {} could not load its inputs", params.workerIndex, e);
            return EXIT_FAILURE;
        }

        Thread mainThread = Thread.currentThread();
        Thread cancelHook = new Thread(() -> {
            context.cancel();
            try {
                mainThread.join(SHUTDOWN_WAIT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "worker-cancel");
        Runtime.getRuntime().addShutdownHook(cancelHook);

        try {
            logger.info("Worker {} starting: {}", params.workerIndex, params);
            int written = sampler.run();
            logger.info("Worker {} finished, {} composites written", params.workerIndex, written);
            return EXIT_OK;
        } catch (SamplingExhaustedException e) {
            logger.error("Worker {} gave up: {}", params.workerIndex, e.getMessage());
            return EXIT_EXHAUSTED;
        } catch (CancellationException e) {
            logger.warn("Worker {} cancelled", params.workerIndex);
            return EXIT_CANCELLED;
        } catch (IOException | RuntimeException e) {
            logger.error("Worker {} failed", params.workerIndex, e);
            return EXIT_FAILURE;
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(cancelHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down, cancel hook stays registered");
            }
        }
    }

    static PatchSampler createSampler(WorkerParameters params, SamplingContext context) throws IOException {
        SynthesisMode mode = params.synthesisMode();
        PatchSource source = new PatchSource(params.imageDir(), params.maskDir(),
                Paths.get(params.stitchMasks), params.imageExtension);
        CompositeWriter writer = new CompositeWriter(Paths.get(params.outputDir),
                params.imageDirName, params.maskDirName).prepare();
        StainNormalizer normalizer = params.normModel == null
                ? StainNormalizer.identity()
                : NormalizerStore.load(Paths.get(params.normModel));
        Random random = new Random(params.seed);

        switch (mode) {
            case GENERALIZED:
                return new GeneralizedSampler(source, writer, normalizer, random, context,
                        requirePatchCount(params));
            case TARGETED_FILTER:
                return new TargetedFilterSampler(source, writer, normalizer, random, context,
                        requirePatchCount(params), params.targetPairs(), params.excludeExisting,
                        loadIndex(params));
            case TARGETED_MATRIX:
                return new TargetedMatrixSampler(source, writer, normalizer, random, context,
                        params.pairTasks(), params.excludeExisting, loadIndex(params));
            default:
                throw new IllegalArgumentException("Unsupported mode " + mode);
        }
    }

    private static int requirePatchCount(WorkerParameters params) {
        if (params.nPatches == null || params.nPatches < 0) {
            throw new IllegalArgumentException("--n-patches must be given and not negative for mode " + params.mode);
        }
        return params.nPatches;
    }

    private static PatchClassIndex loadIndex(WorkerParameters params) throws IOException {
        if (params.patchClassesJson == null) {
            throw new IllegalArgumentException("--patch-classes-json is required for mode " + params.mode);
        }
        return PatchClassIndex.load(Paths.get(params.patchClassesJson));
    }
}
