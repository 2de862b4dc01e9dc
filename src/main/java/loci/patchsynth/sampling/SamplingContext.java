package loci.patchsynth.sampling;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared state of one sampling run: the rejection cap and a cancellation flag polled on every draw.
 */
public class SamplingContext {

    private final int maxAttempts;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * @param maxAttempts consecutive rejected draws tolerated before giving up
     */
    public SamplingContext(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if {@link #cancel()} has been called
     */
    public void checkCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Sampling cancelled");
        }
    }
}
