/*
 * Copyright 2025 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.firefly.stageengine.config;

import com.firefly.stageengine.concurrency.RetryPolicy;
import com.firefly.stageengine.core.StageConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the stage engine.
 * <p>
 * Example configuration:
 * <pre>
 * firefly.stage.engine.concurrency-limit=20
 * firefly.stage.engine.batch-size=200
 * firefly.stage.engine.preserve-order=true
 * firefly.stage.engine.retry.max-retries=5
 * firefly.stage.engine.retry.base-delay=500ms
 * firefly.stage.engine.events.history.enabled=true
 * </pre>
 */
@ConfigurationProperties(prefix = "firefly.stage.engine")
public class StageEngineProperties {

    /**
     * Maximum number of unit invocations in flight per batch run.
     */
    private int concurrencyLimit = 10;

    /**
     * Inputs above this size are processed in sequential chunks.
     */
    private int batchSize = 100;

    /**
     * Whether batch results are aligned with input order.
     */
    private boolean preserveOrder = true;

    /**
     * Outer concurrency for batch runs of composites; 0 keeps each component's default.
     */
    private int batchConcurrency = 0;

    /**
     * Chunk size of streamed batch results; 0 keeps each component's default.
     */
    private int streamBatchSize = 0;

    /**
     * Whether fan-out step failures fail the invocation.
     */
    private boolean throwOnError = true;

    @NestedConfigurationProperty
    private RetryProperties retry = new RetryProperties();

    @NestedConfigurationProperty
    private EventsProperties events = new EventsProperties();

    /** Default per-call config built from these properties. */
    public StageConfig toStageConfig() {
        return StageConfig.builder()
                .concurrencyLimit(concurrencyLimit)
                .batchSize(batchSize)
                .preserveOrder(preserveOrder)
                .batchConcurrency(batchConcurrency)
                .streamBatchSize(streamBatchSize)
                .throwOnError(throwOnError)
                .build();
    }

    public int getConcurrencyLimit() { return concurrencyLimit; }
    public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }
    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    public boolean isPreserveOrder() { return preserveOrder; }
    public void setPreserveOrder(boolean preserveOrder) { this.preserveOrder = preserveOrder; }
    public int getBatchConcurrency() { return batchConcurrency; }
    public void setBatchConcurrency(int batchConcurrency) { this.batchConcurrency = batchConcurrency; }
    public int getStreamBatchSize() { return streamBatchSize; }
    public void setStreamBatchSize(int streamBatchSize) { this.streamBatchSize = streamBatchSize; }
    public boolean isThrowOnError() { return throwOnError; }
    public void setThrowOnError(boolean throwOnError) { this.throwOnError = throwOnError; }
    public RetryProperties getRetry() { return retry; }
    public void setRetry(RetryProperties retry) { this.retry = retry; }
    public EventsProperties getEvents() { return events; }
    public void setEvents(EventsProperties events) { this.events = events; }

    /**
     * Default retry policy exposed as a bean for stages decorated with retry.
     */
    public static class RetryProperties {
        private int maxRetries = RetryPolicy.DEFAULT_MAX_RETRIES;
        private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
        private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
        private double backoffFactor = RetryPolicy.DEFAULT_BACKOFF_FACTOR;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxRetries, baseDelay, maxDelay, backoffFactor);
        }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getBaseDelay() { return baseDelay; }
        public void setBaseDelay(Duration baseDelay) { this.baseDelay = baseDelay; }
        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
        public double getBackoffFactor() { return backoffFactor; }
        public void setBackoffFactor(double backoffFactor) { this.backoffFactor = backoffFactor; }
    }

    public static class EventsProperties {

        /**
         * Whether the SLF4J event sink is registered.
         */
        private boolean loggingEnabled = true;

        /**
         * Whether the Micrometer sink is registered when a MeterRegistry is present.
         */
        private boolean metricsEnabled = true;

        @NestedConfigurationProperty
        private HistoryProperties history = new HistoryProperties();

        public boolean isLoggingEnabled() { return loggingEnabled; }
        public void setLoggingEnabled(boolean loggingEnabled) { this.loggingEnabled = loggingEnabled; }
        public boolean isMetricsEnabled() { return metricsEnabled; }
        public void setMetricsEnabled(boolean metricsEnabled) { this.metricsEnabled = metricsEnabled; }
        public HistoryProperties getHistory() { return history; }
        public void setHistory(HistoryProperties history) { this.history = history; }
    }

    /**
     * Bounded in-memory event history, mostly for debugging and tests.
     */
    public static class HistoryProperties {
        private boolean enabled = false;
        private int maxEvents = 1000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getMaxEvents() { return maxEvents; }
        public void setMaxEvents(int maxEvents) { this.maxEvents = maxEvents; }
    }
}
