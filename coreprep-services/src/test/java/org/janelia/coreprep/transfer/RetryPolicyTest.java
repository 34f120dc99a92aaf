package org.janelia.coreprep.transfer;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Before;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.Assert.assertThrows;

public class RetryPolicyTest {

    private List<Long> sleeps;

    @Before
    public void setUp() {
        sleeps = new ArrayList<>();
    }

    @Test
    public void delaysGrowUpToTheCap() {
        RetryPolicy retryPolicy = new RetryPolicy(10, 1000, 30000, new Random(17), sleeps::add);
        long previous = 0;
        for (int attempt = 0; attempt < 10; attempt++) {
            long delay = retryPolicy.computeDelayMillis(attempt);
            long unjittered = Math.min(30000, 1000L << attempt);
            assertThat("attempt " + attempt, delay, greaterThanOrEqualTo(unjittered));
            assertThat("attempt " + attempt, delay, lessThanOrEqualTo(30000L));
            assertThat("attempt " + attempt, delay, greaterThanOrEqualTo(previous));
            previous = delay;
        }
        assertThat(retryPolicy.computeDelayMillis(20), equalTo(30000L));
    }

    @Test
    public void noJitterWhenRandomReturnsZero() {
        RetryPolicy retryPolicy = new RetryPolicy(5, 1000, 30000, zeroRandom(), sleeps::add);
        assertThat(retryPolicy.computeDelayMillis(0), equalTo(1000L));
        assertThat(retryPolicy.computeDelayMillis(1), equalTo(2000L));
        assertThat(retryPolicy.computeDelayMillis(4), equalTo(16000L));
        assertThat(retryPolicy.computeDelayMillis(5), equalTo(30000L));
    }

    @Test
    public void transientFailuresAreRetried() {
        RetryPolicy retryPolicy = new RetryPolicy(5, 1000, 30000, zeroRandom(), sleeps::add);
        AtomicInteger calls = new AtomicInteger();
        String result = retryPolicy.execute("test action", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientTransferException("service unavailable", 503, null);
            }
            return "task-1";
        });
        assertThat(result, equalTo("task-1"));
        assertThat(calls.get(), equalTo(3));
        assertThat(sleeps, contains(1000L, 2000L));
    }

    @Test
    public void lastTransientFailureIsRethrown() {
        RetryPolicy retryPolicy = new RetryPolicy(3, 10, 100, zeroRandom(), sleeps::add);
        AtomicInteger calls = new AtomicInteger();
        TransientTransferException lastError = new TransientTransferException("gateway timeout", 504, null);
        TransientTransferException e = assertThrows(TransientTransferException.class, () -> retryPolicy.execute("test action", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientTransferException("connection refused", null);
            }
            throw lastError;
        }));
        assertThat(e, sameInstance(lastError));
        assertThat(calls.get(), equalTo(3));
        assertThat(sleeps, hasSize(2));
    }

    @Test
    public void permanentFailuresAreNotRetried() {
        RetryPolicy retryPolicy = new RetryPolicy(5, 10, 100, zeroRandom(), sleeps::add);
        AtomicInteger calls = new AtomicInteger();
        TransferException e = assertThrows(TransferException.class, () -> retryPolicy.execute("test action", () -> {
            calls.incrementAndGet();
            throw new TransferException("forbidden", 403, null);
        }));
        assertThat(e.getStatusCode(), equalTo(403));
        assertThat(calls.get(), equalTo(1));
        assertThat(sleeps, hasSize(0));
    }

    @Test
    public void interruptedWaitStopsRetrying() {
        RetryPolicy retryPolicy = new RetryPolicy(5, 10, 100, zeroRandom(), millis -> {
            throw new InterruptedException();
        });
        try {
            assertThrows(TransferException.class, () -> retryPolicy.execute("test action", () -> {
                throw new TransientTransferException("connection refused", null);
            }));
            assertThat(Thread.currentThread().isInterrupted(), equalTo(true));
        } finally {
            // clear the flag for the other tests
            Thread.interrupted();
        }
    }

    @Test
    public void invalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(0, 10, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, -1, 100));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, 100, 10));
    }

    private Random zeroRandom() {
        return new Random() {
            @Override
            public double nextDouble() {
                return 0;
            }
        };
    }
}
