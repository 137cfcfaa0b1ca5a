package me.golemcore.memory.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.AgentMemory;
import me.golemcore.memory.domain.model.DomainExpertise;
import me.golemcore.memory.domain.model.ExpertiseLevel;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.PerformanceTrend;
import me.golemcore.memory.domain.model.TrendDirection;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Derives domain expertise and performance trends from interaction history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryInsightService {

    private static final double SIGNIFICANT_CHANGE = 0.1;
    private static final double MAX_TREND_CONFIDENCE = 0.9;
    private static final double BASE_TREND_CONFIDENCE = 0.5;
    private static final double MAX_EXPERTISE_CONFIDENCE = 0.95;

    private final MemoryEngineProperties properties;

    /**
     * Classifies the agent within a domain. An interaction belongs to the domain
     * when it carries the domain tag or its prompt mentions the domain.
     */
    public DomainExpertise getDomainExpertise(AgentMemory memory, String domain) {
        if (domain == null || domain.isBlank()) {
            return DomainExpertise.untouched();
        }
        String needle = domain.toLowerCase(Locale.ROOT);
        List<Interaction> domainInteractions = memory.getInteractions().stream()
                .filter(interaction -> interaction.hasTag(domain)
                        || interaction.getPrompt().toLowerCase(Locale.ROOT).contains(needle))
                .toList();

        if (domainInteractions.isEmpty()) {
            return DomainExpertise.untouched();
        }

        int experience = domainInteractions.size();
        double successRate = successRate(domainInteractions);
        long avgResponseTime = Math.round(averageDuration(domainInteractions));

        ExpertiseLevel level;
        double confidence;
        if (experience >= 50 && successRate >= 0.9) {
            level = ExpertiseLevel.EXPERT;
            confidence = Math.min(MAX_EXPERTISE_CONFIDENCE, successRate + 0.05);
        } else if (experience >= 20 && successRate >= 0.8) {
            level = ExpertiseLevel.ADVANCED;
            confidence = successRate + 0.02;
        } else if (experience >= 10 && successRate >= 0.7) {
            level = ExpertiseLevel.INTERMEDIATE;
            confidence = successRate;
        } else {
            level = ExpertiseLevel.NOVICE;
            confidence = successRate;
        }

        return DomainExpertise.builder()
                .level(level)
                .confidence(round2(confidence))
                .experience(experience)
                .avgResponseTime(avgResponseTime)
                .successRate(round2(successRate))
                .build();
    }

    public PerformanceTrend getPerformanceTrends(AgentMemory memory) {
        return getPerformanceTrends(memory, properties.getTrends().getWindowSize());
    }

    public PerformanceTrend getPerformanceTrends(AgentMemory memory, int windowSize) {
        return analyzeTrend(memory.getInteractions(), windowSize);
    }

    /**
     * Compares the last {@code windowSize} interactions with the window before
     * them. Without a previous window the recent one is compared with itself.
     */
    public PerformanceTrend analyzeTrend(List<Interaction> interactions, int windowSize) {
        if (windowSize <= 0 || interactions.size() < windowSize) {
            return PerformanceTrend.insufficientData();
        }

        int size = interactions.size();
        List<Interaction> recent = interactions.subList(size - windowSize, size);
        List<Interaction> older = interactions.subList(Math.max(0, size - windowSize * 2), size - windowSize);
        List<Interaction> baseline = older.isEmpty() ? recent : older;

        double recentSuccessRate = successRate(recent);
        double olderSuccessRate = successRate(baseline);
        double recentAvgTime = averageDuration(recent);
        double olderAvgTime = averageDuration(baseline);

        double successDiff = recentSuccessRate - olderSuccessRate;
        double timeDiff = olderAvgTime > 0 ? (olderAvgTime - recentAvgTime) / olderAvgTime : 0;

        TrendDirection trend = TrendDirection.STABLE;
        double confidence = BASE_TREND_CONFIDENCE;
        if (successDiff > SIGNIFICANT_CHANGE || timeDiff > SIGNIFICANT_CHANGE) {
            trend = TrendDirection.IMPROVING;
            confidence = Math.min(MAX_TREND_CONFIDENCE,
                    BASE_TREND_CONFIDENCE + Math.abs(successDiff) + Math.abs(timeDiff));
        } else if (successDiff < -SIGNIFICANT_CHANGE || timeDiff < -SIGNIFICANT_CHANGE) {
            trend = TrendDirection.DECLINING;
            confidence = Math.min(MAX_TREND_CONFIDENCE,
                    BASE_TREND_CONFIDENCE + Math.abs(successDiff) + Math.abs(timeDiff));
        }

        return PerformanceTrend.builder()
                .trend(trend)
                .confidence(round2(confidence))
                .recentSuccessRate(round2(recentSuccessRate))
                .recentAvgTime(Math.round(recentAvgTime))
                .successChange(round2(successDiff))
                .timeChange(round2(timeDiff))
                .build();
    }

    static double successRate(List<Interaction> interactions) {
        if (interactions.isEmpty()) {
            return 0;
        }
        long successful = interactions.stream().filter(Interaction::isSuccess).count();
        return (double) successful / interactions.size();
    }

    static double averageDuration(List<Interaction> interactions) {
        return interactions.stream().mapToLong(Interaction::getDuration).average().orElse(0);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
