package loci.patchsynth.service;

import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.PairTask;
import loci.patchsynth.model.SynthesisMode;
import loci.patchsynth.model.WorkChunk;
import loci.patchsynth.utilities.SynthesisConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Centralized builder for worker command line arguments.
 *
 * <p>Each worker receives its own seed, {@code baseSeed + slotIndex}, so worker random streams are
 * independent yet reproducible. Matrix chunks are passed as repeated {@code --pair i-j --count n}
 * arguments, count chunks as {@code --n-patches}.
 */
public class WorkerCommandBuilder {
    private static final Logger logger = LoggerFactory.getLogger(WorkerCommandBuilder.class);

    // Required parameters
    private SynthesisMode mode;
    private Long baseSeed;
    private WorkChunk chunk;
    private Path dataRoot;
    private Path stitchMasks;
    private Path outputDir;

    // Optional parameters
    private String imageDirName = SynthesisConfig.DEFAULT_IMAGE_DIR_NAME;
    private String maskDirName = SynthesisConfig.DEFAULT_MASK_DIR_NAME;
    private String imageExtension = SynthesisConfig.DEFAULT_IMAGE_EXTENSION;
    private List<ClassPair> filterPairs = List.of();
    private boolean excludeExisting;
    private Path patchClassesJson;
    private Path normModel;
    private int maxAttempts = SynthesisConfig.DEFAULT_MAX_ATTEMPTS;

    /**
     * Private constructor - use static builder() method
     */
    private WorkerCommandBuilder() {}

    public static WorkerCommandBuilder builder() {
        return new WorkerCommandBuilder();
    }

    /**
     * @return a builder pre-filled with everything the run configuration shares across workers
     */
    public static WorkerCommandBuilder forConfig(SynthesisConfig config) {
        return builder()
                .mode(config.getMode())
                .baseSeed(config.getSeed())
                .dataRoot(config.getDataRoot())
                .imageDirName(config.getImageDirName())
                .maskDirName(config.getMaskDirName())
                .imageExtension(config.getImageExtension())
                .stitchMasks(config.getStitchMaskDir())
                .outputDir(config.getOutputDir())
                .filterPairs(config.getFilterPairs())
                .excludeExisting(config.isExcludeExisting())
                .patchClassesJson(config.getPatchClassesJson())
                .normModel(config.getNormModel())
                .maxAttempts(config.getMaxAttempts());
    }

    public WorkerCommandBuilder mode(SynthesisMode mode) {
        this.mode = mode;
        return this;
    }

    public WorkerCommandBuilder baseSeed(long baseSeed) {
        this.baseSeed = baseSeed;
        return this;
    }

    public WorkerCommandBuilder chunk(WorkChunk chunk) {
        this.chunk = chunk;
        return this;
    }

    public WorkerCommandBuilder dataRoot(Path dataRoot) {
        this.dataRoot = dataRoot;
        return this;
    }

    public WorkerCommandBuilder imageDirName(String imageDirName) {
        this.imageDirName = imageDirName;
        return this;
    }

    public WorkerCommandBuilder maskDirName(String maskDirName) {
        this.maskDirName = maskDirName;
        return this;
    }

    public WorkerCommandBuilder imageExtension(String imageExtension) {
        this.imageExtension = imageExtension;
        return this;
    }

    public WorkerCommandBuilder stitchMasks(Path stitchMasks) {
        this.stitchMasks = stitchMasks;
        return this;
    }

    public WorkerCommandBuilder outputDir(Path outputDir) {
        this.outputDir = outputDir;
        return this;
    }

    public WorkerCommandBuilder filterPairs(List<ClassPair> filterPairs) {
        this.filterPairs = filterPairs == null ? List.of() : filterPairs;
        return this;
    }

    public WorkerCommandBuilder excludeExisting(boolean excludeExisting) {
        this.excludeExisting = excludeExisting;
        return this;
    }

    public WorkerCommandBuilder patchClassesJson(Path patchClassesJson) {
        this.patchClassesJson = patchClassesJson;
        return this;
    }

    public WorkerCommandBuilder normModel(Path normModel) {
        this.normModel = normModel;
        return this;
    }

    public WorkerCommandBuilder maxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
        return this;
    }

    /**
     * Validates that all required parameters are set
     */
    private void validate() {
        List<String> missing = new ArrayList<>();

        if (mode == null) missing.add("mode");
        if (baseSeed == null) missing.add("baseSeed");
        if (chunk == null) missing.add("chunk");
        if (dataRoot == null) missing.add("dataRoot");
        if (stitchMasks == null) missing.add("stitchMasks");
        if (outputDir == null) missing.add("outputDir");
        if (mode != null && mode.usesPatchClasses() && patchClassesJson == null) missing.add("patchClassesJson");
        if (mode == SynthesisMode.TARGETED_FILTER && filterPairs.isEmpty()) missing.add("filterPairs");

        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required parameters: " + String.join(", ", missing));
        }
        if (mode == SynthesisMode.TARGETED_MATRIX && !chunk.hasTasks()) {
            throw new IllegalStateException("targeted_matrix workers need a chunk of pair tasks");
        }
        if (mode != SynthesisMode.TARGETED_MATRIX && chunk.hasTasks()) {
            throw new IllegalStateException(mode + " workers need a patch count, not pair tasks");
        }
    }

    /**
     * @return the worker seed for the configured chunk
     */
    public long workerSeed() {
        return baseSeed + chunk.getSlotIndex();
    }

    /**
     * Builds the argument list passed to the worker entry point.
     *
     * @return worker arguments, without the java executable or main class
     */
    public List<String> build() {
        validate();

        List<String> args = new ArrayList<>(Arrays.asList(
                "--mode", mode.getConfigName(),
                "--seed", String.valueOf(workerSeed()),
                "--worker-index", String.valueOf(chunk.getSlotIndex())
        ));

        if (mode == SynthesisMode.TARGETED_MATRIX) {
            for (PairTask task : chunk.getTasks()) {
                args.addAll(Arrays.asList(
                        "--pair", task.classA() + "-" + task.classB(),
                        "--count", String.valueOf(task.count())));
            }
        } else {
            args.addAll(Arrays.asList("--n-patches", String.valueOf(chunk.getPatchCount())));
        }

        if (mode == SynthesisMode.TARGETED_FILTER) {
            args.addAll(Arrays.asList("--filter-pairs",
                    filterPairs.stream().map(ClassPair::toString).collect(Collectors.joining(","))));
        }
        if (mode.usesPatchClasses()) {
            if (excludeExisting) {
                args.add("--exclude-existing");
            }
            args.addAll(Arrays.asList("--patch-classes-json", patchClassesJson.toString()));
        }

        args.addAll(Arrays.asList(
                "--data-root", dataRoot.toString(),
                "--image-dir-name", imageDirName,
                "--mask-dir-name", maskDirName,
                "--image-extension", imageExtension,
                "--stitch-masks", stitchMasks.toString(),
                "--output-dir", outputDir.toString(),
                "--max-attempts", String.valueOf(maxAttempts)
        ));

        if (normModel != null) {
            args.addAll(Arrays.asList("--norm-model", normModel.toString()));
        }

        logger.debug("Worker arguments for {}: {}", chunk, args);
        return args;
    }
}
