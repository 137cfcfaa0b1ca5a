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

import lombok.Data;
import me.golemcore.memory.domain.model.ContextType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration of the memory engine, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code memory.*} prefix and are grouped per
 * subsystem:
 * <ul>
 * <li>{@link ImportanceProperties} - context importance weights</li>
 * <li>{@link RetentionProperties} - interaction truncation and compression</li>
 * <li>{@link RelevanceProperties} - relevance retrieval defaults</li>
 * <li>{@link TrendProperties} - performance trend window</li>
 * <li>{@link AgentProperties} - agent runtime cleanup and task defaults</li>
 * <li>{@link RegistryProperties} - in-memory agent memory registry</li>
 * </ul>
 *
 * <p>
 * Unknown keys under the prefix fail binding instead of being ignored.
 */
@Component
@ConfigurationProperties(prefix = "memory", ignoreUnknownFields = false)
@Data
public class MemoryEngineProperties {

    private ImportanceProperties importance = new ImportanceProperties();
    private RetentionProperties retention = new RetentionProperties();
    private RelevanceProperties relevance = new RelevanceProperties();
    private TrendProperties trends = new TrendProperties();
    private AgentProperties agent = new AgentProperties();
    private RegistryProperties registry = new RegistryProperties();

    @Data
    public static class ImportanceProperties {
        private double hierarchyBonus = 5;
        private double childrenBonus = 3;
        private double referencesBonus = 2;
        private double tagBonus = 1;
        private double ageDecay = 0.1;
        private Map<ContextType, Integer> typeBonuses = new EnumMap<>(ContextType.class);
    }

    @Data
    public static class RetentionProperties {
        private int promptMaxLength = 500;
        private int responseMaxLength = 1000;
        private int patternWindow = 20;
        private int keepRecentCount = 50;
        private int compressionThreshold = 100;
    }

    @Data
    public static class RelevanceProperties {
        private double threshold = 0.3;
        private int limit = 5;
    }

    @Data
    public static class TrendProperties {
        private int windowSize = 20;
    }

    @Data
    public static class AgentProperties {
        private Duration cleanupFrequency = Duration.ofHours(1);
        private Duration defaultTaskDuration = Duration.ofMinutes(60);
    }

    @Data
    public static class RegistryProperties {
        private int maxCacheSize = 100;
        private int compressionThreshold = 80;
        private int keepRecentCount = 50;
    }
}
