package loci.patchsynth.utilities;

import loci.patchsynth.model.BalancingPolicy;
import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.NormalizationMethod;
import loci.patchsynth.model.SynthesisMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validated, immutable settings of one synthesis run.
 * This class follows the builder pattern; {@link Builder#build()} checks every constraint and
 * reports all violations at once.
 *
 * <p>Which fields are required depends on the {@link SynthesisMode}:</p>
 * <ul>
 *   <li><strong>generalized:</strong> {@code nPatches}</li>
 *   <li><strong>targeted_filter:</strong> {@code nPatches}, {@code filterPairs}, {@code patchClassesJson}</li>
 *   <li><strong>targeted_matrix:</strong> {@code matrix}, {@code patchClassesJson}, optional {@code classes}</li>
 * </ul>
 *
 * <pre>{@code
 * SynthesisConfig config = new SynthesisConfig.Builder()
 *     .mode(SynthesisMode.GENERALIZED)
 *     .cpus(List.of(0, 1, 2, 3))
 *     .seed(42)
 *     .dataRoot(Path.of("/data/patches"))
 *     .stitchMaskDir(Path.of("/data/stitch_masks"))
 *     .outputDir(Path.of("/data/synthetic"))
 *     .normalization(NormalizationMethod.NONE)
 *     .nPatches(1000)
 *     .build();
 * }</pre>
 */
public class SynthesisConfig {
    private static final Logger logger = LoggerFactory.getLogger(SynthesisConfig.class);

    public static final String DEFAULT_IMAGE_DIR_NAME = "image";
    public static final String DEFAULT_MASK_DIR_NAME = "mask_FINAL";
    public static final String DEFAULT_IMAGE_EXTENSION = ".jpg";
    public static final String DEFAULT_NORM_MODEL_NAME = "macenko_normalizer.json";
    public static final int DEFAULT_MAX_ATTEMPTS = 100_000;

    private SynthesisMode mode;
    private List<Integer> cpus = List.of();
    private Long seed;
    private Path dataRoot;
    private String imageDirName = DEFAULT_IMAGE_DIR_NAME;
    private String maskDirName = DEFAULT_MASK_DIR_NAME;
    private String imageExtension = DEFAULT_IMAGE_EXTENSION;
    private Path stitchMaskDir;
    private Path outputDir;
    private Path patchClassesJson;
    private NormalizationMethod normalization = NormalizationMethod.MACENKO;
    private Path referenceImage;
    private Path normModel;
    private Integer nPatches;
    private List<ClassPair> filterPairs = List.of();
    private List<List<Object>> matrix;
    private List<Integer> classes;
    private boolean excludeExisting = true;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private int workerTimeoutSeconds = 0;
    private BalancingPolicy balancing = BalancingPolicy.QUOTA_SPLIT;
    private boolean pinCpus = true;

    /**
     * Builder class for constructing SynthesisConfig instances.
     */
    public static class Builder {
        private static final Logger logger = LoggerFactory.getLogger(Builder.class);
        private final SynthesisConfig config = new SynthesisConfig();

        public Builder mode(SynthesisMode mode) {
            logger.debug("Setting mode: {}", mode);
            config.mode = mode;
            return this;
        }

        /**
         * @param cpus CPU identifiers workers may be pinned to; one worker slot per CPU
         */
        public Builder cpus(List<Integer> cpus) {
            logger.debug("Setting cpus: {}", cpus);
            config.cpus = cpus == null ? List.of() : List.copyOf(cpus);
            return this;
        }

        public Builder seed(long seed) {
            config.seed = seed;
            return this;
        }

        public Builder dataRoot(Path dataRoot) {
            config.dataRoot = dataRoot;
            return this;
        }

        public Builder imageDirName(String name) {
            if (name != null) config.imageDirName = name;
            return this;
        }

        public Builder maskDirName(String name) {
            if (name != null) config.maskDirName = name;
            return this;
        }

        /**
         * @param extension extension of source images, with or without the leading dot
         */
        public Builder imageExtension(String extension) {
            if (extension != null) {
                config.imageExtension = extension.startsWith(".") ? extension : "." + extension;
            }
            return this;
        }

        public Builder stitchMaskDir(Path dir) {
            config.stitchMaskDir = dir;
            return this;
        }

        public Builder outputDir(Path dir) {
            config.outputDir = dir;
            return this;
        }

        public Builder patchClassesJson(Path path) {
            config.patchClassesJson = path;
            return this;
        }

        public Builder normalization(NormalizationMethod method) {
            if (method != null) config.normalization = method;
            return this;
        }

        public Builder referenceImage(Path path) {
            config.referenceImage = path;
            return this;
        }

        /**
         * @param path where the fitted normalizer is stored; defaults to the output directory
         */
        public Builder normModel(Path path) {
            config.normModel = path;
            return this;
        }

        public Builder nPatches(Integer nPatches) {
            config.nPatches = nPatches;
            return this;
        }

        public Builder filterPairs(List<ClassPair> pairs) {
            config.filterPairs = pairs == null ? List.of() : List.copyOf(pairs);
            return this;
        }

        /**
         * @param matrix square matrix of pair counts; only the strict upper triangle is read
         */
        public Builder matrix(List<List<Object>> matrix) {
            config.matrix = matrix;
            return this;
        }

        public Builder classes(List<Integer> classes) {
            config.classes = classes == null ? null : List.copyOf(classes);
            return this;
        }

        public Builder excludeExisting(boolean exclude) {
            config.excludeExisting = exclude;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            config.maxAttempts = maxAttempts;
            return this;
        }

        public Builder workerTimeoutSeconds(int seconds) {
            config.workerTimeoutSeconds = seconds;
            return this;
        }

        public Builder balancing(BalancingPolicy policy) {
            if (policy != null) config.balancing = policy;
            return this;
        }

        public Builder pinCpus(boolean pin) {
            config.pinCpus = pin;
            return this;
        }

        /**
         * Builds the configuration, validating that all required fields are set.
         *
         * @return the completed configuration
         * @throws InvalidConfigurationException listing every problem found
         */
        public SynthesisConfig build() {
            List<String> problems = new ArrayList<>();

            if (config.mode == null) problems.add("mode is required");
            if (config.cpus.isEmpty()) {
                problems.add("cpus must list at least one CPU");
            } else {
                Set<Integer> seen = new HashSet<>();
                for (Integer cpu : config.cpus) {
                    if (cpu == null || cpu < 0) problems.add("cpus must be non-negative integers, got " + cpu);
                    else if (!seen.add(cpu)) problems.add("cpu " + cpu + " is listed twice");
                }
            }
            if (config.seed == null) problems.add("seed is required");
            if (config.dataRoot == null) problems.add("data_root is required");
            if (config.stitchMaskDir == null) problems.add("stitch_masks is required");
            if (config.outputDir == null) problems.add("output_dir is required");
            if (config.maxAttempts <= 0) problems.add("max_attempts must be positive, got " + config.maxAttempts);
            if (config.workerTimeoutSeconds < 0) {
                problems.add("worker_timeout_seconds must not be negative, got " + config.workerTimeoutSeconds);
            }

            if (config.normalization == NormalizationMethod.MACENKO) {
                if (config.referenceImage == null) problems.add("m_norm_img is required for macenko normalization");
                if (config.normModel == null && config.outputDir != null) {
                    config.normModel = config.outputDir.resolve(DEFAULT_NORM_MODEL_NAME);
                }
            }

            if (config.mode != null) {
                if (config.mode != SynthesisMode.TARGETED_MATRIX
                        && (config.nPatches == null || config.nPatches <= 0)) {
                    problems.add("n_patches must be a positive integer for mode " + config.mode);
                }
                if (config.mode == SynthesisMode.TARGETED_FILTER && config.filterPairs.isEmpty()) {
                    problems.add("targeted_filter_pairs must list at least one pair");
                }
                if (config.mode.usesPatchClasses() && config.patchClassesJson == null) {
                    problems.add("patch_classes_json is required for mode " + config.mode);
                }
                if (config.mode == SynthesisMode.TARGETED_MATRIX) {
                    validateMatrix(problems);
                }
            }

            if (!problems.isEmpty()) {
                logger.error("Build validation failed: {}", problems);
                throw new InvalidConfigurationException(problems);
            }

            logger.debug("Successfully built SynthesisConfig: mode={}, cpus={}, seed={}, output={}",
                    config.mode, config.cpus, config.seed, config.outputDir);
            return config;
        }

        private void validateMatrix(List<String> problems) {
            if (config.matrix == null || config.matrix.isEmpty()) {
                problems.add("matrix is required for mode targeted_matrix");
                return;
            }
            int n = config.matrix.size();
            for (int i = 0; i < n; i++) {
                List<Object> row = config.matrix.get(i);
                if (row == null || row.size() != n) {
                    problems.add(String.format("matrix must be square: row %d has %d entries, expected %d",
                            i, row == null ? 0 : row.size(), n));
                }
            }
            if (config.classes != null) {
                if (config.classes.size() != n) {
                    problems.add(String.format("classes has %d labels but the matrix has %d rows",
                            config.classes.size(), n));
                }
                if (new HashSet<>(config.classes).size() != config.classes.size()) {
                    problems.add("classes must not contain duplicates: " + config.classes);
                }
            }
        }
    }

    // Private constructor - use Builder
    private SynthesisConfig() {}

    public SynthesisMode getMode() { return mode; }

    public List<Integer> getCpus() { return cpus; }

    public long getSeed() { return seed; }

    public Path getDataRoot() { return dataRoot; }

    public String getImageDirName() { return imageDirName; }

    public String getMaskDirName() { return maskDirName; }

    public String getImageExtension() { return imageExtension; }

    public Path getStitchMaskDir() { return stitchMaskDir; }

    public Path getOutputDir() { return outputDir; }

    public Path getPatchClassesJson() { return patchClassesJson; }

    public NormalizationMethod getNormalization() { return normalization; }

    public Path getReferenceImage() { return referenceImage; }

    /**
     * @return path of the persisted normalizer, or null when normalization is disabled
     */
    public Path getNormModel() { return normalization == NormalizationMethod.NONE ? null : normModel; }

    public Integer getNPatches() { return nPatches; }

    public List<ClassPair> getFilterPairs() { return filterPairs; }

    public List<List<Object>> getMatrix() { return matrix; }

    /**
     * @return class labels for the matrix rows, or null for positional labels
     */
    public List<Integer> getClasses() { return classes; }

    public boolean isExcludeExisting() { return excludeExisting; }

    public int getMaxAttempts() { return maxAttempts; }

    public int getWorkerTimeoutSeconds() { return workerTimeoutSeconds; }

    public BalancingPolicy getBalancing() { return balancing; }

    public boolean isPinCpus() { return pinCpus; }

    /** Source image folder, {@code <data_root>/<image_dir_name>}. */
    public Path getImageDir() { return dataRoot.resolve(imageDirName); }

    /** Source label mask folder, {@code <data_root>/<mask_dir_name>}. */
    public Path getMaskDir() { return dataRoot.resolve(maskDirName); }
}
