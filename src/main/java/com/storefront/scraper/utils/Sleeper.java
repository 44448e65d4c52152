package com.storefront.scraper.utils;

/**
 * Pacing and backoff waits go through here so tests can run without wall-clock delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;

    /**
     * Sleeps, restoring the interrupt flag instead of throwing.
     *
     * @return false if the wait was interrupted
     */
    default boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
