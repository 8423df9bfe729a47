package com.replicasim.dispatcher;

import com.replicasim.config.ReplicaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Dispatcher schedules mailbox runners on a shared thread pool.
 * The replica's control loop and every canister's actor loop run on the same dispatcher.
 */
public final class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final ExecutorService executor;
    private final String name;
    private volatile boolean shutdown = false;

    private Dispatcher(ExecutorService executor, String name) {
        this.executor = executor;
        this.name = name;
    }

    /**
     * Creates a dispatcher for the executor settings of the given configuration.
     *
     * @param config the replica configuration
     * @param name   the name prefix for threads
     * @return a new Dispatcher
     */
    public static Dispatcher create(ReplicaConfig config, String name) {
        switch (config.getExecutorType()) {
            case FIXED:
                return fixedThreadPoolDispatcher(config.getPoolSize(), name);
            case WORK_STEALING:
                return workStealingDispatcher(config.getPoolSize(), name);
            case CACHED:
                return cachedThreadPoolDispatcher(name);
            default:
                throw new IllegalArgumentException("Unknown executor type: " + config.getExecutorType());
        }
    }

    /**
     * Creates a dispatcher backed by a fixed-size platform thread pool.
     *
     * @param threads The number of platform threads in the pool
     * @param name    The name prefix for threads
     * @return A new Dispatcher using platform threads
     */
    public static Dispatcher fixedThreadPoolDispatcher(int threads, String name) {
        int poolSize = Math.max(1, threads);
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, namedDaemonThreads(name));
        logger.info("Created fixed thread pool dispatcher: {} with {} threads", name, poolSize);
        return new Dispatcher(executor, name);
    }

    /**
     * Creates a dispatcher backed by a work-stealing pool.
     *
     * @param parallelism The target parallelism level
     * @param name        The dispatcher name
     * @return A new Dispatcher using a ForkJoinPool
     */
    public static Dispatcher workStealingDispatcher(int parallelism, String name) {
        int level = Math.max(1, parallelism);
        ExecutorService executor = new ForkJoinPool(level, pool -> {
            var thread = ForkJoinPool.defaultForkJoinWorkerThreadFactory.newThread(pool);
            thread.setName(name + "-" + thread.getPoolIndex());
            return thread;
        }, null, true);
        logger.info("Created work-stealing dispatcher: {} with parallelism {}", name, level);
        return new Dispatcher(executor, name);
    }

    /**
     * Creates a dispatcher backed by an unbounded cached thread pool.
     * Suitable when canister code blocks, e.g. on the outcome of another call.
     *
     * @param name The name prefix for threads
     * @return A new Dispatcher using a cached pool
     */
    public static Dispatcher cachedThreadPoolDispatcher(String name) {
        ExecutorService executor = Executors.newCachedThreadPool(namedDaemonThreads(name));
        logger.info("Created cached thread pool dispatcher: {}", name);
        return new Dispatcher(executor, name);
    }

    private static ThreadFactory namedDaemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Schedules a runner for execution on the dispatcher's thread pool.
     *
     * @param task The runnable task (typically a MailboxRunner) to schedule
     * @return true if the task was accepted
     */
    public boolean schedule(Runnable task) {
        if (shutdown) {
            logger.warn("Attempted to schedule task on shutdown dispatcher: {}", name);
            return false;
        }
        try {
            executor.execute(task);
            return true;
        } catch (RejectedExecutionException e) {
            logger.error("Failed to schedule task on dispatcher {}: {}", name, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Initiates shutdown. Running tasks complete, no new tasks are accepted.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        logger.info("Shutting down dispatcher: {}", name);
        executor.shutdown();
    }

    /**
     * Waits for running tasks to finish after {@link #shutdown()}.
     *
     * @return true if all tasks terminated, false if timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) {
        try {
            return executor.awaitTermination(timeout, unit);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for dispatcher {} termination", name);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public String getName() {
        return name;
    }
}
