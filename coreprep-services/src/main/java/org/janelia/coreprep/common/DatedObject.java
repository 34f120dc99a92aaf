package org.janelia.coreprep.common;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;

/**
 * An object wrapper which knows when it was created.
 * @param <T> type of the wrapped object
 */
public class DatedObject<T> {

    private final Ticker ticker;
    private final long creationTimeNanos;
    private final T obj;

    public DatedObject(T obj) {
        this(obj, Ticker.systemTicker());
    }

    public DatedObject(T obj, Ticker ticker) {
        this.ticker = ticker;
        this.creationTimeNanos = ticker.read();
        this.obj = obj;
    }

    public long getElapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(ticker.read() - creationTimeNanos);
    }

    public T getObj() {
        return obj;
    }
}
