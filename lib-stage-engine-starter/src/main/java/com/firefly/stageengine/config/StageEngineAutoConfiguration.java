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
import com.firefly.stageengine.engine.StageEngine;
import com.firefly.stageengine.observability.CompositeStageEvents;
import com.firefly.stageengine.observability.InMemoryStageEvents;
import com.firefly.stageengine.observability.StageEvents;
import com.firefly.stageengine.observability.StageLoggerEvents;
import com.firefly.stageengine.observability.StageMicrometerEvents;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.ArrayList;
import java.util.List;

/**
 * Auto-configuration for the stage engine.
 * <p>
 * Registers the built-in event sinks according to {@code firefly.stage.engine.events.*},
 * combines them into a primary {@link CompositeStageEvents} and exposes a {@link StageEngine}
 * whose run defaults come from {@link StageEngineProperties}. A user-defined {@link StageEvents}
 * bean replaces the composite.
 */
@AutoConfiguration(afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@EnableConfigurationProperties(StageEngineProperties.class)
public class StageEngineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(StageEngineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.stage.engine.events", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public StageLoggerEvents stageLoggerEvents() {
        return new StageLoggerEvents();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.stage.engine.events.history", name = "enabled", havingValue = "true")
    public InMemoryStageEvents inMemoryStageEvents(StageEngineProperties properties) {
        return new InMemoryStageEvents(properties.getEvents().getHistory().getMaxEvents());
    }

    @Bean
    @Primary
    @ConditionalOnMissingBean(value = StageEvents.class,
            ignored = {StageLoggerEvents.class, InMemoryStageEvents.class, StageMicrometerEvents.class})
    public StageEvents stageEventsComposite(ObjectProvider<StageLoggerEvents> logger,
                                            ObjectProvider<InMemoryStageEvents> history,
                                            ObjectProvider<StageMicrometerEvents> micrometer) {
        List<StageEvents> sinks = new ArrayList<>();
        logger.ifAvailable(sinks::add);
        history.ifAvailable(sinks::add);
        micrometer.ifAvailable(sinks::add);
        log.debug("Stage event sinks: {}", sinks.stream().map(s -> s.getClass().getSimpleName()).toList());
        return new CompositeStageEvents(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy stageRetryPolicy(StageEngineProperties properties) {
        return properties.getRetry().toRetryPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public StageEngine stageEngine(StageEngineProperties properties, StageEvents stageEvents) {
        log.info("Creating StageEngine with concurrencyLimit={}, batchSize={}, preserveOrder={}",
                properties.getConcurrencyLimit(), properties.getBatchSize(), properties.isPreserveOrder());
        return new StageEngine(properties.toStageConfig(), stageEvents);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnBean(type = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(prefix = "firefly.stage.engine.events", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class MicrometerAutoConfig {

        @Bean
        @ConditionalOnMissingBean
        public StageMicrometerEvents stageMicrometerEvents(MeterRegistry registry) {
            return new StageMicrometerEvents(registry);
        }
    }
}
