package org.janelia.coreprep.common;

/**
 * A timed condition which can timeout after a preset amount of time. The timeout is checked every time
 * an unsatisfied condition value is retrieved and if the elapsed time exceeds it a CondTimeoutException is thrown.
 * A timeout that is not positive never expires.
 *
 * @param <T> the type of the state
 */
public class TimedCond<T> extends ContinuationCond.Cond<DatedObject<T>> {

    private final DatedObject<T> datedState;
    private final long timeoutMs;

    public TimedCond(DatedObject<T> datedState, boolean condValue, long timeoutMs) {
        super(datedState, condValue);
        this.datedState = datedState;
        this.timeoutMs = timeoutMs;
    }

    @Override
    public boolean isCondValue() {
        if (!super.isCondValue()) {
            checkTimeout();
        }
        return super.isCondValue();
    }

    @Override
    public boolean isNotCondValue() {
        return !isCondValue();
    }

    private void checkTimeout() {
        if (timeoutMs > 0 && datedState.getElapsedMillis() > timeoutMs) {
            throw new CondTimeoutException(timeoutMs);
        }
    }
}
