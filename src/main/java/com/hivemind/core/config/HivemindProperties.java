package com.hivemind.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "hivemind")
public class HivemindProperties {

    private Coordinator coordinator = new Coordinator();
    private Memory memory = new Memory();
    private Execution execution = new Execution();
    private Platform platform = new Platform();

    // -- Coordinator accessors (delegate to nested) --
    public int getMaxConcurrentAgents() { return coordinator.maxConcurrentAgents; }
    public boolean isAutoSpawn() { return coordinator.autoSpawn; }
    public Duration getStaleTaskThreshold() { return Duration.ofMinutes(coordinator.staleTaskMinutes); }
    public Duration getStaleGracePeriod() { return Duration.ofMinutes(coordinator.staleGraceMinutes); }
    public Duration getDefaultEstimate() { return Duration.ofMinutes(coordinator.defaultEstimateMinutes); }
    public Duration getMaxEstimate() { return Duration.ofHours(coordinator.maxEstimateHours); }

    // -- Memory accessors --
    public int getHistoryLimit() { return memory.historyLimit; }
    public int getSimilarPatternLimit() { return memory.similarPatternLimit; }

    /**
     * True when a platform base URL was configured. Without it the wave executor still
     * generates artifacts but does not deploy them.
     */
    public boolean isPlatformConfigured() {
        return platform.baseUrl != null && !platform.baseUrl.isBlank();
    }

    public Coordinator getCoordinator() { return coordinator; }
    public void setCoordinator(Coordinator coordinator) { this.coordinator = coordinator; }
    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Platform getPlatform() { return platform; }
    public void setPlatform(Platform platform) { this.platform = platform; }

    public static class Coordinator {
        private int maxConcurrentAgents = 8;
        private boolean autoSpawn = true;
        private int staleTaskMinutes = 10;
        private int staleGraceMinutes = 20;
        private int defaultEstimateMinutes = 60;
        private int maxEstimateHours = 24;
        private long sweepIntervalMs = 60_000;

        public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
        public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
        public boolean isAutoSpawn() { return autoSpawn; }
        public void setAutoSpawn(boolean autoSpawn) { this.autoSpawn = autoSpawn; }
        public int getStaleTaskMinutes() { return staleTaskMinutes; }
        public void setStaleTaskMinutes(int staleTaskMinutes) { this.staleTaskMinutes = staleTaskMinutes; }
        public int getStaleGraceMinutes() { return staleGraceMinutes; }
        public void setStaleGraceMinutes(int staleGraceMinutes) { this.staleGraceMinutes = staleGraceMinutes; }
        public int getDefaultEstimateMinutes() { return defaultEstimateMinutes; }
        public void setDefaultEstimateMinutes(int defaultEstimateMinutes) { this.defaultEstimateMinutes = defaultEstimateMinutes; }
        public int getMaxEstimateHours() { return maxEstimateHours; }
        public void setMaxEstimateHours(int maxEstimateHours) { this.maxEstimateHours = maxEstimateHours; }
        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
    }

    public static class Memory {
        private int historyLimit = 1000;
        private int similarPatternLimit = 5;

        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
        public int getSimilarPatternLimit() { return similarPatternLimit; }
        public void setSimilarPatternLimit(int similarPatternLimit) { this.similarPatternLimit = similarPatternLimit; }
    }

    public static class Execution {
        private int taskTimeoutSeconds = 300;

        public int getTaskTimeoutSeconds() { return taskTimeoutSeconds; }
        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) { this.taskTimeoutSeconds = taskTimeoutSeconds; }
    }

    public static class Platform {
        private String baseUrl = "";
        private String username = "";
        private String password = "";
        private int timeoutSeconds = 30;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }
        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }
}
