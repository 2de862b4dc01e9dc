package loci.patchsynth.model;

import loci.patchsynth.utilities.InvalidConfigurationException;

/** Colour normalization applied to every source patch before stitching. */
public enum NormalizationMethod {
    MACENKO("macenko"),
    NONE("none");

    private final String configName;

    NormalizationMethod(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static NormalizationMethod fromConfigName(String name) {
        for (NormalizationMethod method : values()) {
            if (method.configName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return method;
            }
        }
        throw new InvalidConfigurationException("Unknown normalization '" + name + "', expected macenko or none");
    }
}
