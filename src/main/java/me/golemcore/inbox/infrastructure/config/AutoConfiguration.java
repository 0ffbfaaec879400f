package me.golemcore.inbox.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the inbox service and the startup summary.
 *
 * <p>
 * Two executors are defined:
 * <ul>
 * <li>{@code delegatedWorkExecutor} - approval workflow tasks started by the
 * long-running tool</li>
 * <li>{@code agentRuntimeExecutor} - model calls that advance agent runs</li>
 * </ul>
 * Both are shut down with the application context.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final InboxProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(name = "delegatedWorkExecutor", destroyMethod = "shutdownNow")
    public ExecutorService delegatedWorkExecutor() {
        return Executors.newFixedThreadPool(properties.getWorkflow().getExecutorThreads(),
                namedDaemonThreads("approval-workflow-"));
    }

    @Bean(name = "agentRuntimeExecutor", destroyMethod = "shutdownNow")
    public ExecutorService agentRuntimeExecutor() {
        return Executors.newFixedThreadPool(properties.getAgent().getExecutorThreads(),
                namedDaemonThreads("agent-runtime-"));
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Inbox v{} starting...", version);
        log.info("Agent model: {}", properties.getAgent().getModel());
        log.info("Workflow mode: {} ({})", properties.getWorkflow().getMode(), properties.getWorkflow().getName());
        log.info("Status queue: {}", properties.getQueue().getName());
        log.info("Tool error policy: {}", properties.getRun().getToolErrorPolicy());
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
