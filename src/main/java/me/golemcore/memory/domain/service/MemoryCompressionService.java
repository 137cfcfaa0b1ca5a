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
import me.golemcore.memory.domain.model.CompressionOptions;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.InteractionFeedback;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Shrinks an interaction history by keeping the newest entries plus the most
 * important older ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryCompressionService {

    private static final double SUCCESS_WEIGHT = 0.4;
    private static final double UNIQUENESS_WEIGHT = 0.3;
    private static final double SIMILARITY_PENALTY = 0.05;
    private static final double SIMILARITY_THRESHOLD = 0.7;
    private static final double RECENCY_WEIGHT = 0.2;
    private static final double RECENCY_DECAY_PER_DAY = 0.01;
    private static final double FEEDBACK_SCALE = 10.0;
    private static final double MAX_SCORE = 1.0;

    private final MemoryEngineProperties properties;
    private final MemoryRelevanceService relevanceService;
    private final Clock clock;

    public CompressionOptions defaultOptions() {
        MemoryEngineProperties.RetentionProperties retention = properties.getRetention();
        return CompressionOptions.builder()
                .keepRecentCount(retention.getKeepRecentCount())
                .compressionThreshold(retention.getCompressionThreshold())
                .build();
    }

    public boolean compressMemories(AgentMemory memory) {
        return compressMemories(memory, defaultOptions());
    }

    /**
     * Compresses the memory in place.
     *
     * @return whether the history changed
     */
    public boolean compressMemories(AgentMemory memory, CompressionOptions options) {
        List<Interaction> current = memory.getInteractions();
        if (current.size() <= options.getCompressionThreshold()) {
            return false;
        }
        List<Interaction> compressed = compress(current, options);
        memory.setInteractions(compressed);
        memory.setUpdated(Instant.now(clock));
        log.info("[MemoryCompression] agent={} interactions {} -> {}",
                memory.getAgentId(), current.size(), compressed.size());
        return true;
    }

    /**
     * Pure compression over an ordered history. Returns the input unchanged when
     * its size does not exceed the threshold; otherwise the selected older
     * interactions (best first) followed by the recent ones in their original
     * order.
     */
    public List<Interaction> compress(List<Interaction> interactions, CompressionOptions options) {
        if (interactions.size() <= options.getCompressionThreshold()) {
            return interactions;
        }

        int keepRecent = Math.max(0, Math.min(options.getKeepRecentCount(), interactions.size()));
        int split = interactions.size() - keepRecent;
        List<Interaction> older = interactions.subList(0, split);
        List<Interaction> recent = interactions.subList(split, interactions.size());

        Instant now = Instant.now(clock);
        List<Scored> scored = new ArrayList<>(older.size());
        for (Interaction interaction : older) {
            scored.add(new Scored(interaction, scoreImportance(interaction, interactions, now)));
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        int retained = Math.min(scored.size(), options.olderRetentionLimit());
        List<Interaction> result = new ArrayList<>(retained + recent.size());
        for (int i = 0; i < retained; i++) {
            result.add(scored.get(i).interaction());
        }
        result.addAll(recent);
        return result;
    }

    /**
     * Retention score in [0, 1]: success, uniqueness against the whole history,
     * recency and feedback rating.
     */
    public double scoreImportance(Interaction interaction, List<Interaction> history, Instant now) {
        double score = 0.0;

        if (interaction.isSuccess()) {
            score += SUCCESS_WEIGHT;
        }

        List<String> keywords = Arrays.asList(interaction.getPrompt().split("\\s+"));
        long similar = history.stream()
                .filter(other -> other != interaction)
                .filter(other -> relevanceService.calculateRelevance(other, keywords, null, now) > SIMILARITY_THRESHOLD)
                .count();
        score += Math.max(0, UNIQUENESS_WEIGHT - similar * SIMILARITY_PENALTY);

        double ageInDays = MemoryRelevanceService.ageInDays(interaction.getTimestamp(), now);
        score += Math.max(0, RECENCY_WEIGHT - ageInDays * RECENCY_DECAY_PER_DAY);

        InteractionFeedback feedback = interaction.getFeedback();
        if (feedback != null && feedback.getRating() != null && feedback.getRating() != 0) {
            score += feedback.getRating() / FEEDBACK_SCALE;
        }

        return Math.min(MAX_SCORE, score);
    }

    private record Scored(Interaction interaction, double score) {
    }
}
