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

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the langchain4j chat model used by the agent runtime. Any
 * OpenAI-compatible endpoint works through {@code inbox.agent.base-url}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ChatModelConfig {

    private static final String MISSING_KEY_PLACEHOLDER = "not-configured";

    private final InboxProperties properties;

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel() {
        InboxProperties.AgentProperties agent = properties.getAgent();
        String apiKey = agent.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[LLM] inbox.agent.api-key is not set, model calls will fail until it is configured");
            apiKey = MISSING_KEY_PLACEHOLDER;
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(agent.getModel())
                .maxRetries(0) // the run fails and the driver reports it
                .timeout(agent.getTimeout());

        if (agent.getBaseUrl() != null && !agent.getBaseUrl().isBlank()) {
            builder.baseUrl(agent.getBaseUrl());
        }
        if (agent.getTemperature() != null) {
            builder.temperature(agent.getTemperature());
        }

        log.info("[LLM] Chat model: {}", agent.getModel());
        return builder.build();
    }
}
