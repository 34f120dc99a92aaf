package org.janelia.coreprep.transfer;

import java.util.Random;
import java.util.function.Supplier;

import com.google.common.base.Preconditions;
import org.janelia.coreprep.utils.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded exponential backoff with jitter. Only {@link TransientTransferException}s are retried.
 */
public class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final long baseDelayMillis;
    private final long maxDelayMillis;
    private final Random random;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis) {
        this(maxAttempts, baseDelayMillis, maxDelayMillis, new Random(), Sleeper.SYSTEM);
    }

    public RetryPolicy(int maxAttempts, long baseDelayMillis, long maxDelayMillis, Random random, Sleeper sleeper) {
        Preconditions.checkArgument(maxAttempts >= 1, "Max attempts must be at least 1: %s", maxAttempts);
        Preconditions.checkArgument(baseDelayMillis >= 0, "Base delay must not be negative: %s", baseDelayMillis);
        Preconditions.checkArgument(maxDelayMillis >= baseDelayMillis, "Max delay %s is less than base delay %s", maxDelayMillis, baseDelayMillis);
        this.maxAttempts = maxAttempts;
        this.baseDelayMillis = baseDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.random = random;
        this.sleeper = sleeper;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the retry that follows the given failed attempt (0 based):
     * base * 2^attempt plus a jitter of up to half of that, capped at the max delay.
     */
    public long computeDelayMillis(int attempt) {
        double delay = baseDelayMillis * Math.pow(2, attempt);
        double jitteredDelay = delay + random.nextDouble() * 0.5 * delay;
        return (long) Math.min(maxDelayMillis, jitteredDelay);
    }

    public <T> T execute(String description, Supplier<T> action) {
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (TransientTransferException e) {
                if (attempt + 1 >= maxAttempts) {
                    LOG.error("{} failed after {} attempts", description, attempt + 1);
                    throw e;
                }
                long delay = computeDelayMillis(attempt);
                LOG.warn("{} failed on attempt {} of {} - retry in {}ms: {}", description, attempt + 1, maxAttempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransferException("Interrupted while waiting to retry " + description, ie);
                }
            }
        }
    }
}
