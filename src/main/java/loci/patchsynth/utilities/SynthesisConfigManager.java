package loci.patchsynth.utilities;

import loci.patchsynth.model.BalancingPolicy;
import loci.patchsynth.model.ClassPair;
import loci.patchsynth.model.NormalizationMethod;
import loci.patchsynth.model.SynthesisMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * SynthesisConfigManager
 *
 * <p>Loads a run's YAML configuration and turns it into a validated {@link SynthesisConfig}:
 *   - Parses the YAML into a Map&lt;String,Object&gt;.
 *   - Offers type safe getters (getString, getInteger, getList, etc.).
 *   - Validates required keys for the selected mode and reports all missing keys together.
 */
public class SynthesisConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(SynthesisConfigManager.class);

    static final Set<String> KNOWN_KEYS = Set.of(
            "mode", "cpus", "seed", "data_root", "image_dir_name", "mask_dir_name", "image_extension",
            "stitch_masks", "output_dir", "patch_classes_json", "normalization", "m_norm_img", "norm_model",
            "n_patches", "targeted_filter_pairs", "matrix", "classes", "exclude_existing", "max_attempts",
            "worker_timeout_seconds", "balancing", "pin_cpus");

    private final Map<String, Object> configData;
    private final Path configPath;

    private SynthesisConfigManager(Path configPath, Map<String, Object> configData) {
        this.configPath = configPath;
        this.configData = configData;
    }

    /**
     * Reads a YAML configuration file.
     *
     * @param configPath path to the YAML file
     * @return manager over the loaded data
     * @throws InvalidConfigurationException if the file is missing, unreadable or not a YAML map
     */
    public static SynthesisConfigManager load(Path configPath) {
        return new SynthesisConfigManager(configPath, loadConfig(configPath));
    }

    /**
     * Wraps already-parsed configuration data.
     */
    public static SynthesisConfigManager fromMap(Map<String, Object> data) {
        return new SynthesisConfigManager(null, new LinkedHashMap<>(data));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadConfig(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidConfigurationException("Configuration file not found: " + path);
        }
        Yaml yaml = new Yaml();
        try (InputStream in = Files.newInputStream(path)) {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                logger.info("Loaded configuration from {}", path);
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            throw new InvalidConfigurationException("YAML root is not a map: " + path);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Error parsing YAML: " + path, e);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Error reading configuration: " + path, e);
        }
    }

    public Object getConfigItem(String key) {
        return configData.get(key);
    }

    public String getString(String key) {
        Object v = getConfigItem(key);
        return v == null ? null : v.toString();
    }

    /**
     * @return the integer value, or null if absent
     * @throws InvalidConfigurationException if present but not an integer
     */
    public Integer getInteger(String key) {
        Object v = getConfigItem(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Expected an integer for '" + key + "' but got " + v, e);
        }
    }

    public Long getLong(String key) {
        Object v = getConfigItem(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Expected an integer for '" + key + "' but got " + v, e);
        }
    }

    public Boolean getBoolean(String key) {
        Object v = getConfigItem(key);
        if (v == null) return null;
        if (v instanceof Boolean b) return b;
        return Boolean.parseBoolean(v.toString().trim());
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        Object v = getConfigItem(key);
        if (v == null) return null;
        if (v instanceof List<?>) return (List<Object>) v;
        throw new InvalidConfigurationException("Expected a list for '" + key + "' but got " + v);
    }

    public Path getPath(String key) {
        String v = getString(key);
        return v == null || v.isBlank() ? null : Paths.get(v);
    }

    /**
     * Checks that every key the selected mode needs is present.
     *
     * @return missing keys, empty if the configuration is complete
     * @throws InvalidConfigurationException if the mode itself is unknown
     */
    public List<String> validateConfiguration() {
        List<String> missing = new ArrayList<>();

        for (String key : List.of("mode", "cpus", "seed", "data_root", "stitch_masks", "output_dir")) {
            if (getConfigItem(key) == null) missing.add(key);
        }

        for (String key : configData.keySet()) {
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("Ignoring unknown configuration key '{}'", key);
            }
        }

        String modeName = getString("mode");
        if (modeName != null) {
            SynthesisMode mode = SynthesisMode.fromConfigName(modeName);
            if (mode != SynthesisMode.TARGETED_MATRIX && getConfigItem("n_patches") == null) {
                missing.add("n_patches");
            }
            if (mode == SynthesisMode.TARGETED_FILTER && getConfigItem("targeted_filter_pairs") == null) {
                missing.add("targeted_filter_pairs");
            }
            if (mode == SynthesisMode.TARGETED_MATRIX && getConfigItem("matrix") == null) {
                missing.add("matrix");
            }
            if (mode.usesPatchClasses() && getConfigItem("patch_classes_json") == null) {
                missing.add("patch_classes_json");
            }
        }

        String normName = getString("normalization");
        NormalizationMethod norm = normName == null ? NormalizationMethod.MACENKO : NormalizationMethod.fromConfigName(normName);
        if (norm == NormalizationMethod.MACENKO && getConfigItem("m_norm_img") == null) {
            missing.add("m_norm_img");
        }

        if (!missing.isEmpty()) {
            logger.error("Configuration validation failed for {}. Missing: {}",
                    configPath == null ? "in-memory configuration" : configPath, missing);
        } else {
            logger.info("Configuration validation passed");
        }
        return missing;
    }

    /**
     * Validates the loaded data and converts it into a {@link SynthesisConfig}.
     *
     * @return the validated configuration
     * @throws InvalidConfigurationException listing the missing keys or invalid values
     */
    public SynthesisConfig toSynthesisConfig() {
        List<String> missing = validateConfiguration();
        if (!missing.isEmpty()) {
            List<String> problems = new ArrayList<>();
            for (String key : missing) problems.add("missing required key '" + key + "'");
            throw new InvalidConfigurationException(problems);
        }

        SynthesisConfig.Builder builder = new SynthesisConfig.Builder()
                .mode(SynthesisMode.fromConfigName(getString("mode")))
                .cpus(readIntegerList("cpus"))
                .seed(getLong("seed"))
                .dataRoot(getPath("data_root"))
                .imageDirName(getString("image_dir_name"))
                .maskDirName(getString("mask_dir_name"))
                .imageExtension(getString("image_extension"))
                .stitchMaskDir(getPath("stitch_masks"))
                .outputDir(getPath("output_dir"))
                .patchClassesJson(getPath("patch_classes_json"))
                .referenceImage(getPath("m_norm_img"))
                .normModel(getPath("norm_model"))
                .nPatches(getInteger("n_patches"))
                .filterPairs(readFilterPairs())
                .matrix(readMatrix())
                .classes(readIntegerList("classes"));

        if (getString("normalization") != null) {
            builder.normalization(NormalizationMethod.fromConfigName(getString("normalization")));
        }
        if (getString("balancing") != null) {
            builder.balancing(BalancingPolicy.fromConfigName(getString("balancing")));
        }
        if (getBoolean("exclude_existing") != null) builder.excludeExisting(getBoolean("exclude_existing"));
        if (getInteger("max_attempts") != null) builder.maxAttempts(getInteger("max_attempts"));
        if (getInteger("worker_timeout_seconds") != null) {
            builder.workerTimeoutSeconds(getInteger("worker_timeout_seconds"));
        }
        if (getBoolean("pin_cpus") != null) builder.pinCpus(getBoolean("pin_cpus"));

        return builder.build();
    }

    private List<Integer> readIntegerList(String key) {
        List<Object> raw = getList(key);
        if (raw == null) return null;
        List<Integer> values = new ArrayList<>();
        for (Object o : raw) {
            if (o instanceof Number n) {
                values.add(n.intValue());
            } else {
                try {
                    values.add(Integer.parseInt(String.valueOf(o).trim()));
                } catch (NumberFormatException e) {
                    throw new InvalidConfigurationException("Expected integers in '" + key + "' but got " + o, e);
                }
            }
        }
        return values;
    }

    /**
     * Accepts {@code [[1, 2], [3, 4]]} as well as {@code ["1-2", "3-4"]}.
     */
    private List<ClassPair> readFilterPairs() {
        List<Object> raw = getList("targeted_filter_pairs");
        if (raw == null) return null;
        List<ClassPair> pairs = new ArrayList<>();
        for (Object o : raw) {
            try {
                if (o instanceof List<?> l && l.size() == 2
                        && l.get(0) instanceof Number a && l.get(1) instanceof Number b) {
                    pairs.add(new ClassPair(a.intValue(), b.intValue()));
                } else {
                    pairs.add(ClassPair.parse(String.valueOf(o)));
                }
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException("Invalid entry in targeted_filter_pairs: " + o, e);
            }
        }
        return pairs;
    }

    @SuppressWarnings("unchecked")
    private List<List<Object>> readMatrix() {
        List<Object> raw = getList("matrix");
        if (raw == null) return null;
        List<List<Object>> rows = new ArrayList<>();
        for (Object row : raw) {
            if (!(row instanceof List<?>)) {
                throw new InvalidConfigurationException("Every matrix row must be a list, got " + row);
            }
            rows.add((List<Object>) row);
        }
        return rows;
    }
}
