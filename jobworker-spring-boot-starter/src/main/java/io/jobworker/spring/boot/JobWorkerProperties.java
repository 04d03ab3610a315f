package io.jobworker.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the job worker.
 *
 * <p>Rate-limit entries are keyed by action name; use bracket notation for names with
 * underscores, e.g. {@code jobworker.rate-limit.limits.[button_click].max-requests=30}.
 * Entries override the built-in table, which stays in effect for actions not listed.
 *
 * @see JobWorkerAutoConfiguration
 */
@ConfigurationProperties(prefix = "jobworker")
public class JobWorkerProperties {

    /**
     * Start the worker loop when the context starts. Disable to drive the worker manually.
     */
    private boolean autoStart = true;

    private final Tables tables = new Tables();
    private final Worker worker = new Worker();
    private final RateLimit rateLimit = new RateLimit();
    private final AutoBroadcast autoBroadcast = new AutoBroadcast();
    private final Notifications notifications = new Notifications();
    private final PreCheckout preCheckout = new PreCheckout();
    private final Metrics metrics = new Metrics();

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Tables getTables() {
        return tables;
    }

    public Worker getWorker() {
        return worker;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public AutoBroadcast getAutoBroadcast() {
        return autoBroadcast;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public PreCheckout getPreCheckout() {
        return preCheckout;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Tables {
        private String jobs = "jobs";
        private String liveNotifications = "live_notification_messages";
        private String settings = "worker_settings";

        public String getJobs() {
            return jobs;
        }

        public void setJobs(String jobs) {
            this.jobs = jobs;
        }

        public String getLiveNotifications() {
            return liveNotifications;
        }

        public void setLiveNotifications(String liveNotifications) {
            this.liveNotifications = liveNotifications;
        }

        public String getSettings() {
            return settings;
        }

        public void setSettings(String settings) {
            this.settings = settings;
        }
    }

    public static class Worker {
        private Duration pollInterval = Duration.ofSeconds(2);
        private Duration periodicCheckInterval = Duration.ofMinutes(5);
        private Duration slowJobThreshold = Duration.ofSeconds(5);
        private int retryCeiling = 3;
        private List<String> excludedTypes = new ArrayList<>(List.of("send_to_groups"));
        private boolean runOnce = false;
        private int runOnceAttempts = 3;
        private Duration runOnceRetryDelay = Duration.ofSeconds(1);
        /**
         * Processing lease. Unset (default) leaves jobs of crashed workers in processing.
         */
        private Duration staleProcessingTimeout;

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getPeriodicCheckInterval() {
            return periodicCheckInterval;
        }

        public void setPeriodicCheckInterval(Duration periodicCheckInterval) {
            this.periodicCheckInterval = periodicCheckInterval;
        }

        public Duration getSlowJobThreshold() {
            return slowJobThreshold;
        }

        public void setSlowJobThreshold(Duration slowJobThreshold) {
            this.slowJobThreshold = slowJobThreshold;
        }

        public int getRetryCeiling() {
            return retryCeiling;
        }

        public void setRetryCeiling(int retryCeiling) {
            this.retryCeiling = retryCeiling;
        }

        public List<String> getExcludedTypes() {
            return excludedTypes;
        }

        public void setExcludedTypes(List<String> excludedTypes) {
            this.excludedTypes = excludedTypes;
        }

        public boolean isRunOnce() {
            return runOnce;
        }

        public void setRunOnce(boolean runOnce) {
            this.runOnce = runOnce;
        }

        public int getRunOnceAttempts() {
            return runOnceAttempts;
        }

        public void setRunOnceAttempts(int runOnceAttempts) {
            this.runOnceAttempts = runOnceAttempts;
        }

        public Duration getRunOnceRetryDelay() {
            return runOnceRetryDelay;
        }

        public void setRunOnceRetryDelay(Duration runOnceRetryDelay) {
            this.runOnceRetryDelay = runOnceRetryDelay;
        }

        public Duration getStaleProcessingTimeout() {
            return staleProcessingTimeout;
        }

        public void setStaleProcessingTimeout(Duration staleProcessingTimeout) {
            this.staleProcessingTimeout = staleProcessingTimeout;
        }
    }

    public static class RateLimit {
        private Map<String, Limit> limits = new LinkedHashMap<>();
        private Duration sweepInterval = Duration.ofMinutes(10);

        public Map<String, Limit> getLimits() {
            return limits;
        }

        public void setLimits(Map<String, Limit> limits) {
            this.limits = limits;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    public static class Limit {
        private int maxRequests;
        private Duration window = Duration.ofSeconds(60);

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class AutoBroadcast {
        private boolean enabled = true;
        private long threshold = 10;
        private Duration cooldown = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getThreshold() {
            return threshold;
        }

        public void setThreshold(long threshold) {
            this.threshold = threshold;
        }

        public Duration getCooldown() {
            return cooldown;
        }

        public void setCooldown(Duration cooldown) {
            this.cooldown = cooldown;
        }
    }

    public static class Notifications {
        private Duration retractWindow = Duration.ofHours(48);

        public Duration getRetractWindow() {
            return retractWindow;
        }

        public void setRetractWindow(Duration retractWindow) {
            this.retractWindow = retractWindow;
        }
    }

    public static class PreCheckout {
        private Duration deadline = Duration.ofSeconds(10);
        private Duration responseMargin = Duration.ofSeconds(1);
        private int threads = 4;

        public Duration getDeadline() {
            return deadline;
        }

        public void setDeadline(Duration deadline) {
            this.deadline = deadline;
        }

        public Duration getResponseMargin() {
            return responseMargin;
        }

        public void setResponseMargin(Duration responseMargin) {
            this.responseMargin = responseMargin;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "jobworker";

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
