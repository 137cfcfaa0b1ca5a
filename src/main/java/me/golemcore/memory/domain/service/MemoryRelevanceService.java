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
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.RelevanceQuery;
import me.golemcore.memory.domain.model.ScoredInteraction;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Ranks stored interactions against a lexical query.
 *
 * <p>
 * Relevance is a sum capped at 1.0:
 * <ul>
 * <li>keyword overlap: matched / total keywords * 0.4 (case-insensitive
 * substring of prompt and response)</li>
 * <li>domain match: +0.3 when the interaction is tagged with the domain</li>
 * <li>recency: max(0, 1 - ageInDays / 30) * 0.2</li>
 * <li>success: +0.1</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRelevanceService {

    private static final double KEYWORD_WEIGHT = 0.4;
    private static final double DOMAIN_WEIGHT = 0.3;
    private static final double RECENCY_WEIGHT = 0.2;
    private static final double SUCCESS_WEIGHT = 0.1;
    private static final double RECENCY_WINDOW_DAYS = 30.0;
    private static final double MAX_SCORE = 1.0;

    private final MemoryEngineProperties properties;
    private final Clock clock;

    public List<ScoredInteraction> getRelevantMemories(AgentMemory memory, RelevanceQuery query) {
        return getRelevantMemories(memory, query, properties.getRelevance().getLimit());
    }

    /**
     * Successful interactions scoring at least the query threshold, best first.
     * Equal scores keep insertion order. Returned interactions are detached
     * copies.
     */
    public List<ScoredInteraction> getRelevantMemories(AgentMemory memory, RelevanceQuery query, int limit) {
        Objects.requireNonNull(memory, "memory");
        RelevanceQuery effective = query != null ? query
                : RelevanceQuery.builder().threshold(properties.getRelevance().getThreshold()).build();
        Instant now = Instant.now(clock);

        List<ScoredInteraction> scored = new ArrayList<>();
        for (Interaction interaction : memory.getInteractions()) {
            if (!interaction.isSuccess()) {
                continue;
            }
            double score = calculateRelevance(interaction, effective.getKeywords(), effective.getDomain(), now);
            if (score >= effective.getThreshold()) {
                scored.add(ScoredInteraction.builder()
                        .interaction(interaction.copy())
                        .relevanceScore(score)
                        .build());
            }
        }

        scored.sort(Comparator.comparingDouble(ScoredInteraction::getRelevanceScore).reversed());
        memory.setLastAccessed(now);

        List<ScoredInteraction> result = scored.size() > Math.max(0, limit)
                ? new ArrayList<>(scored.subList(0, Math.max(0, limit)))
                : scored;
        log.debug("[MemoryRelevance] agent={} candidates={} returned={}",
                memory.getAgentId(), scored.size(), result.size());
        return result;
    }

    public double calculateRelevance(Interaction interaction, RelevanceQuery query) {
        return calculateRelevance(interaction, query.getKeywords(), query.getDomain(), Instant.now(clock));
    }

    double calculateRelevance(Interaction interaction, List<String> keywords, String domain, Instant now) {
        double score = 0.0;

        if (keywords != null && !keywords.isEmpty()) {
            String text = (interaction.getPrompt() + " " + interaction.getResponse()).toLowerCase(Locale.ROOT);
            long matches = keywords.stream()
                    .filter(Objects::nonNull)
                    .filter(keyword -> text.contains(keyword.toLowerCase(Locale.ROOT)))
                    .count();
            score += ((double) matches / keywords.size()) * KEYWORD_WEIGHT;
        }

        if (domain != null && interaction.hasTag(domain)) {
            score += DOMAIN_WEIGHT;
        }

        double ageInDays = ageInDays(interaction.getTimestamp(), now);
        score += Math.max(0, 1 - (ageInDays / RECENCY_WINDOW_DAYS)) * RECENCY_WEIGHT;

        if (interaction.isSuccess()) {
            score += SUCCESS_WEIGHT;
        }

        return Math.min(MAX_SCORE, score);
    }

    static double ageInDays(Instant timestamp, Instant now) {
        if (timestamp == null) {
            return 0;
        }
        return Duration.between(timestamp, now).toMillis() / ContextImportanceService.MILLIS_PER_DAY;
    }
}
