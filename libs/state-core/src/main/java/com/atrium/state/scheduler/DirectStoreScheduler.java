package com.atrium.state.scheduler;

/**
 * Runs every task inline on the calling thread.
 *
 * <p>For hosts that are already single-threaded, and for tests that complete repository futures
 * by hand.
 */
public final class DirectStoreScheduler implements StoreScheduler {

    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
