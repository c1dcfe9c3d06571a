package io.txevents.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.sql.Connection;

/**
 * Configuration properties for txevents.
 *
 * @see TxEventsAutoConfiguration
 */
@ConfigurationProperties(prefix = "txevents")
public class TxEventsProperties {

    private final Dispatcher dispatcher = new Dispatcher();
    private final Transaction transaction = new Transaction();
    private final Retry retry = new Retry();
    private final Metrics metrics = new Metrics();

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public Retry getRetry() {
        return retry;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Which machinery drives read-write transactions.
     */
    public enum Manager {
        /** Plain JDBC connections from the {@code DataSource}. */
        JDBC,
        /** Spring's {@code PlatformTransactionManager}. */
        SPRING
    }

    public enum Isolation {
        DEFAULT(-1),
        READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
        REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
        SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

        private final int level;

        Isolation(int level) {
            this.level = level;
        }

        /**
         * JDBC isolation constant, or {@code -1} to keep the driver default.
         */
        public int level() {
            return level;
        }
    }

    public static class Dispatcher {
        /**
         * Events processed per flush before the cascade is aborted.
         */
        private int maxDepth = 10;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    public static class Transaction {
        private Manager manager = Manager.JDBC;

        /**
         * Total attempts for work hitting serialization failures or deadlocks.
         */
        private int maxAttempts = 5;

        private Isolation isolation = Isolation.DEFAULT;

        public Manager getManager() {
            return manager;
        }

        public void setManager(Manager manager) {
            this.manager = manager;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Isolation getIsolation() {
            return isolation;
        }

        public void setIsolation(Isolation isolation) {
            this.isolation = isolation;
        }
    }

    public static class Retry {
        private long baseDelayMs = 50;
        private long maxDelayMs = 1000;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "txevents";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
