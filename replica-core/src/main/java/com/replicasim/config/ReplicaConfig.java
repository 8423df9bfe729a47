package com.replicasim.config;

import com.replicasim.dispatcher.MailboxType;

import java.time.Duration;
import java.util.Optional;
import java.util.Properties;

/**
 * Configuration of a replica: the thread pool its actor loops run on, how many messages a
 * loop handles per activation, the mailbox implementation and an optional call deadline.
 */
public class ReplicaConfig {
    public static final String EXECUTOR_TYPE_PROPERTY = "replica.executor.type";
    public static final String POOL_SIZE_PROPERTY = "replica.executor.pool-size";
    public static final String THROUGHPUT_PROPERTY = "replica.throughput";
    public static final String MAILBOX_TYPE_PROPERTY = "replica.mailbox.type";
    public static final String CALL_TIMEOUT_PROPERTY = "replica.call-timeout-ms";

    public static final int DEFAULT_POOL_SIZE = Math.max(4, Runtime.getRuntime().availableProcessors());
    public static final int DEFAULT_THROUGHPUT = 64;
    public static final ExecutorType DEFAULT_EXECUTOR_TYPE = ExecutorType.FIXED;
    public static final MailboxType DEFAULT_MAILBOX_TYPE = MailboxType.MPSC;

    /**
     * Thread pool flavours the actor loops can run on.
     */
    public enum ExecutorType {
        /** Fixed number of platform threads. */
        FIXED,
        /** Work-stealing ForkJoinPool in async mode. */
        WORK_STEALING,
        /** Unbounded cached pool, for canister code that blocks. */
        CACHED
    }

    private ExecutorType executorType = DEFAULT_EXECUTOR_TYPE;
    private int poolSize = DEFAULT_POOL_SIZE;
    private int throughput = DEFAULT_THROUGHPUT;
    private MailboxType mailboxType = DEFAULT_MAILBOX_TYPE;
    private Duration callTimeout;

    /**
     * Creates a configuration with default values and no call deadline.
     */
    public ReplicaConfig() {
        // Use defaults
    }

    /**
     * Reads a configuration from properties; absent keys keep their defaults.
     *
     * @param properties the source properties
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static ReplicaConfig fromProperties(Properties properties) {
        ReplicaConfig config = new ReplicaConfig();
        String executor = properties.getProperty(EXECUTOR_TYPE_PROPERTY);
        if (executor != null) {
            config.setExecutorType(ExecutorType.valueOf(executor.trim().toUpperCase()));
        }
        String poolSize = properties.getProperty(POOL_SIZE_PROPERTY);
        if (poolSize != null) {
            config.setPoolSize(parseInt(POOL_SIZE_PROPERTY, poolSize));
        }
        String throughput = properties.getProperty(THROUGHPUT_PROPERTY);
        if (throughput != null) {
            config.setThroughput(parseInt(THROUGHPUT_PROPERTY, throughput));
        }
        String mailbox = properties.getProperty(MAILBOX_TYPE_PROPERTY);
        if (mailbox != null) {
            config.setMailboxType(MailboxType.valueOf(mailbox.trim().toUpperCase()));
        }
        String timeout = properties.getProperty(CALL_TIMEOUT_PROPERTY);
        if (timeout != null) {
            config.setCallTimeout(Duration.ofMillis(parseInt(CALL_TIMEOUT_PROPERTY, timeout)));
        }
        return config;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public ExecutorType getExecutorType() {
        return executorType;
    }

    public ReplicaConfig setExecutorType(ExecutorType executorType) {
        if (executorType == null) {
            throw new IllegalArgumentException("Executor type cannot be null");
        }
        this.executorType = executorType;
        return this;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public ReplicaConfig setPoolSize(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        this.poolSize = poolSize;
        return this;
    }

    /**
     * Gets the maximum number of messages one actor loop processes per activation.
     */
    public int getThroughput() {
        return throughput;
    }

    public ReplicaConfig setThroughput(int throughput) {
        if (throughput <= 0) {
            throw new IllegalArgumentException("Throughput must be positive");
        }
        this.throughput = throughput;
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public ReplicaConfig setMailboxType(MailboxType mailboxType) {
        if (mailboxType == null) {
            throw new IllegalArgumentException("Mailbox type cannot be null");
        }
        this.mailboxType = mailboxType;
        return this;
    }

    /**
     * Gets the deadline applied to inter-canister calls, empty when calls wait forever.
     */
    public Optional<Duration> getCallTimeout() {
        return Optional.ofNullable(callTimeout);
    }

    /**
     * Sets the deadline for inter-canister calls. Pass null to wait forever (the default).
     */
    public ReplicaConfig setCallTimeout(Duration callTimeout) {
        if (callTimeout != null && (callTimeout.isNegative() || callTimeout.isZero())) {
            throw new IllegalArgumentException("Call timeout must be positive");
        }
        this.callTimeout = callTimeout;
        return this;
    }

    @Override
    public String toString() {
        return "ReplicaConfig{executorType=" + executorType
                + ", poolSize=" + poolSize
                + ", throughput=" + throughput
                + ", mailboxType=" + mailboxType
                + ", callTimeout=" + (callTimeout == null ? "none" : callTimeout)
                + "}";
    }
}
