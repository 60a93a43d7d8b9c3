package com.scanq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "scanq")
public class ScanQProperties {

    private final Database database = new Database();
    private final Queue queue = new Queue();
    private final Retry retry = new Retry();
    private final Scheduler scheduler = new Scheduler();
    private final Scan scan = new Scan();
    private final Schedules schedules = new Schedules();

    public Database getDatabase() {
        return database;
    }

    public Queue getQueue() {
        return queue;
    }

    public Retry getRetry() {
        return retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Scan getScan() {
        return scan;
    }

    public Schedules getSchedules() {
        return schedules;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Queue {
        private int maxConcurrent = 5;
        private int defaultMaxRetries = 3;
        private Duration retryDelayStep = Duration.ofSeconds(1);
        private int recentJobsLimit = 500;

        public int getMaxConcurrent() {
            return maxConcurrent;
        }

        public void setMaxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Duration getRetryDelayStep() {
            return retryDelayStep;
        }

        public void setRetryDelayStep(Duration retryDelayStep) {
            this.retryDelayStep = retryDelayStep;
        }

        public int getRecentJobsLimit() {
            return recentJobsLimit;
        }

        public void setRecentJobsLimit(int recentJobsLimit) {
            this.recentJobsLimit = recentJobsLimit;
        }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(10);
        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialDelay() {
            return initialDelay;
        }

        public void setInitialDelay(Duration initialDelay) {
            this.initialDelay = initialDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    public static class Scheduler {
        private int batchSize = 5;
        private DispatchMode dispatchMode = DispatchMode.INLINE;
        private final AutoTrigger autoTrigger = new AutoTrigger();

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public DispatchMode getDispatchMode() {
            return dispatchMode;
        }

        public void setDispatchMode(DispatchMode dispatchMode) {
            this.dispatchMode = dispatchMode;
        }

        public AutoTrigger getAutoTrigger() {
            return autoTrigger;
        }

        public enum DispatchMode {
            /**
             * Due schedules are executed one after another on the calling thread.
             */
            INLINE,

            /**
             * Due schedules are handed to the job queue; bookkeeping runs when the job finishes.
             */
            QUEUE
        }

        public static class AutoTrigger {
            private boolean enabled = false;
            private long pollIntervalInSeconds = 60;

            public boolean isEnabled() {
                return enabled;
            }

            public void setEnabled(boolean enabled) {
                this.enabled = enabled;
            }

            public long getPollIntervalInSeconds() {
                return pollIntervalInSeconds;
            }

            public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
                this.pollIntervalInSeconds = pollIntervalInSeconds;
            }
        }
    }

    public static class Scan {
        private String baseUrl = "http://localhost:3000";
        private String profileLevel = "BASIC";
        private String triggeredBy = "scheduled";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getProfileLevel() {
            return profileLevel;
        }

        public void setProfileLevel(String profileLevel) {
            this.profileLevel = profileLevel;
        }

        public String getTriggeredBy() {
            return triggeredBy;
        }

        public void setTriggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
        }
    }

    public static class Schedules {
        private Store store = Store.JPA;

        public Store getStore() {
            return store;
        }

        public void setStore(Store store) {
            this.store = store;
        }

        public enum Store {
            JPA,
            MEMORY
        }
    }
}
