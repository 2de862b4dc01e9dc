package loci.patchsynth.model;

import loci.patchsynth.utilities.InvalidConfigurationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Sampling policy used by every worker of a run.
 *
 * <ul>
 *   <li><strong>GENERALIZED:</strong> uniform draws from the whole corpus, no rejection</li>
 *   <li><strong>TARGETED_FILTER:</strong> uniform draws, accepted only if the stitched label set
 *       contains at least one target class pair</li>
 *   <li><strong>TARGETED_MATRIX:</strong> per-pair quotas drawn from the class pool</li>
 * </ul>
 */
public enum SynthesisMode {
    GENERALIZED("generalized"),
    TARGETED_FILTER("targeted_filter"),
    TARGETED_MATRIX("targeted_matrix");

    private final String configName;

    SynthesisMode(String configName) {
        this.configName = configName;
    }

    /**
     * @return the name used in YAML configuration files and on the worker command line
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * @return true if this mode needs the patch-classes index
     */
    public boolean usesPatchClasses() {
        return this != GENERALIZED;
    }

    /**
     * Resolves a configuration value to a mode.
     *
     * @param name value of the {@code mode} key
     * @return the matching mode
     * @throws InvalidConfigurationException if the name is unknown
     */
    public static SynthesisMode fromConfigName(String name) {
        for (SynthesisMode mode : values()) {
            if (mode.configName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return mode;
            }
        }
        throw new InvalidConfigurationException("Unknown mode '" + name + "', expected one of "
                + Arrays.stream(values()).map(SynthesisMode::getConfigName).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return configName;
    }
}
