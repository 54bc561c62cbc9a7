package com.splitttr.coedit.bus;

/**
 * Handle returned by subscribe calls. Unsubscribing twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
