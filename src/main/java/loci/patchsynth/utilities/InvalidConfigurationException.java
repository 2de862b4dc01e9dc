package loci.patchsynth.utilities;

import java.util.List;

/**
 * Thrown when a run configuration is incomplete or contradictory.
 * Raised before any worker is launched.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> problems;

    public InvalidConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    /**
     * @param problems every problem found, reported together
     */
    public InvalidConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * @return the individual problems, at least one
     */
    public List<String> getProblems() {
        return problems;
    }
}
