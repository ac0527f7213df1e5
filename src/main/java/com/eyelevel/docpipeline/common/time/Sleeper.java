package com.eyelevel.docpipeline.common.time;

/**
 * Suspends the calling job between polls. Replaced by a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
