package com.atrium.state.scheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Confines stores to one named daemon thread. */
public final class SingleThreadStoreScheduler implements StoreScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SingleThreadStoreScheduler.class);

    private final ExecutorService executor;
    private final String threadName;

    public SingleThreadStoreScheduler(String threadName) {
        if (threadName == null || threadName.isBlank()) {
            throw new IllegalArgumentException("threadName must not be null or blank");
        }
        this.threadName = threadName;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void execute(Runnable command) {
        executor.execute(command);
    }

    public String threadName() {
        return threadName;
    }

    /** Stops accepting tasks and waits briefly for queued ones to finish. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Store scheduler {} did not drain in time, forcing shutdown", threadName);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
