package de.mirkosertic.pwstrength;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool running the matchers of an evaluation in parallel.
 */
public class MatcherExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(MatcherExecutorService.class);

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    private final ThreadPoolExecutor executor;

    /**
     * @param threadPoolSize number of worker threads, must be positive
     */
    public MatcherExecutorService(final int threadPoolSize) {
        if (threadPoolSize <= 0) {
            throw new IllegalArgumentException("threadPoolSize must be positive, got " + threadPoolSize);
        }

        final int pool = POOL_COUNTER.getAndIncrement();
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "matcher-" + pool + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.debug("MatcherExecutorService initialized with {} threads", threadPoolSize);
    }

    /**
     * Pool size for an ensemble of {@code matcherCount} matchers, capped at the available processors.
     */
    public static int defaultPoolSize(final int matcherCount) {
        return Math.max(1, Math.min(matcherCount, Runtime.getRuntime().availableProcessors()));
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Shutdown the executor service, waiting a short time for running matchers.
     */
    public void shutdown() {
        logger.debug("Shutting down MatcherExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("MatcherExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for MatcherExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
