package loci.patchsynth.sampling;

/**
 * Thrown when a targeted sampler cannot produce an accepted draw: either the constraints are
 * infeasible for the available patches, or too many consecutive draws were rejected.
 */
public class SamplingExhaustedException extends RuntimeException {

    public SamplingExhaustedException(String message) {
        super(message);
    }
}
