package me.golemcore.memory.infrastructure.config;

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
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans of the memory engine and a startup summary of
 * the effective configuration.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final MemoryEngineProperties properties;

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
        MemoryEngineProperties.RetentionProperties retention = properties.getRetention();
        MemoryEngineProperties.RegistryProperties registry = properties.getRegistry();
        log.info("Memory engine starting...");
        log.info("Retention: keepRecent={}, compressionThreshold={}, prompt<={} chars, response<={} chars",
                retention.getKeepRecentCount(), retention.getCompressionThreshold(),
                retention.getPromptMaxLength(), retention.getResponseMaxLength());
        log.info("Relevance: threshold={}, limit={}, trend window={}",
                properties.getRelevance().getThreshold(), properties.getRelevance().getLimit(),
                properties.getTrends().getWindowSize());
        log.info("Registry: maxCacheSize={}, compressionThreshold={}, agent cleanup every {}",
                registry.getMaxCacheSize(), registry.getCompressionThreshold(),
                properties.getAgent().getCleanupFrequency());
    }
}
