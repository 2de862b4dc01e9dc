package loci.patchsynth.model;

import loci.patchsynth.utilities.InvalidConfigurationException;

/**
 * How pair tasks are distributed over worker slots in matrix mode.
 *
 * <p>{@link #QUOTA_SPLIT} gives every slot exactly its share of the total, splitting a task
 * across slots when needed. {@link #GREEDY} keeps tasks whole and hands each to the least loaded
 * slot; it is only as balanced as the task granularity allows.
 */
public enum BalancingPolicy {
    QUOTA_SPLIT("quota_split"),
    GREEDY("greedy");

    private final String configName;

    BalancingPolicy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static BalancingPolicy fromConfigName(String name) {
        for (BalancingPolicy policy : values()) {
            if (policy.configName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return policy;
            }
        }
        throw new InvalidConfigurationException("Unknown balancing policy '" + name
                + "', expected quota_split or greedy");
    }
}
