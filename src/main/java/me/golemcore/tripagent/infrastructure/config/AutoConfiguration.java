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

package me.golemcore.tripagent.infrastructure.config;

import me.golemcore.tripagent.domain.service.LlmConfigService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans and startup logging.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final TripAgentProperties properties;
    private final LlmConfigService llmConfigService;

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

    @PostConstruct
    public void init() {
        log.info("Trip agent starting...");
        log.info("LLM Provider: {}", llmConfigService.resolve()
                .map(config -> config.getProvider().getId() + " (" + config.getEffectiveModel() + ")")
                .orElse("not configured, offline fallback active"));
        log.info("Question language: {}", properties.getQuestions().getLanguage());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
    }
}
