package org.janelia.coreprep.utils;

/**
 * Blocks the calling thread for a given number of milliseconds.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
