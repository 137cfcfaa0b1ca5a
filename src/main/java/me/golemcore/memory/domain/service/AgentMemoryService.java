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
import me.golemcore.memory.domain.model.FeedbackRequest;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.InteractionFeedback;
import me.golemcore.memory.domain.model.KnowledgeConcept;
import me.golemcore.memory.domain.model.KnowledgeEntry;
import me.golemcore.memory.domain.model.KnowledgeGraph;
import me.golemcore.memory.domain.model.KnowledgeGraphSnapshot;
import me.golemcore.memory.domain.model.KnowledgeNode;
import me.golemcore.memory.domain.model.KnowledgeRequest;
import me.golemcore.memory.domain.model.LearningProfile;
import me.golemcore.memory.domain.model.MemoryPatterns;
import me.golemcore.memory.domain.model.MemoryPerformance;
import me.golemcore.memory.domain.model.MemoryStats;
import me.golemcore.memory.domain.model.CategoryRating;
import me.golemcore.memory.domain.model.ValidationException;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Mutations and read views of an {@link AgentMemory}: interaction recording,
 * knowledge reinforcement, feedback-driven learning and statistics.
 *
 * <p>
 * The service holds no state of its own. Callers that share a memory record
 * across threads must serialize access to it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentMemoryService {

    private static final double HELPFUL_DELTA = 0.02;
    private static final double UNHELPFUL_DELTA = -0.05;
    private static final int PATTERN_MIN_WORD_LENGTH = 4;
    private static final int PATTERN_TOP_KEYWORDS = 10;
    private static final int PATTERN_TOP_HOURS = 5;

    private final MemoryEngineProperties properties;
    private final MemoryInsightService insightService;
    private final EntityCodec entityCodec;
    private final Clock clock;

    public AgentMemory createMemory(String agentId, String userId, String sessionId) {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("agentId is required");
        }
        Instant now = Instant.now(clock);
        AgentMemory memory = new AgentMemory();
        memory.setId(entityCodec.newId());
        memory.setAgentId(agentId);
        memory.setUserId(userId);
        memory.setSessionId(sessionId);
        memory.setCreated(now);
        memory.setUpdated(now);
        memory.setLastAccessed(now);
        return memory;
    }

    /**
     * Records a sanitized copy of the interaction. On a full history the oldest
     * entry is evicted.
     *
     * @return the stored record
     */
    public Interaction addInteraction(AgentMemory memory, Interaction interaction) {
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(interaction, "interaction");
        Instant now = Instant.now(clock);
        MemoryEngineProperties.RetentionProperties retention = properties.getRetention();

        Interaction stored = interaction.copy();
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(entityCodec.newId());
        }
        if (stored.getTimestamp() == null) {
            stored.setTimestamp(now);
        }
        stored.setPrompt(truncate(stored.getPrompt(), retention.getPromptMaxLength()));
        stored.setResponse(truncate(stored.getResponse(), retention.getResponseMaxLength()));

        memory.appendInteraction(stored).ifPresent(evicted -> log.debug(
                "[AgentMemory] agent={} evicted interaction {}", memory.getAgentId(), evicted.getId()));

        updatePerformanceMetrics(memory);
        extractPatterns(memory, now);
        memory.setLastAccessed(now);
        memory.setUpdated(now);
        return stored;
    }

    /**
     * Upserts a concept under its domain and reinforces the knowledge graph.
     * The stored reinforcement count survives the upsert.
     */
    public void addKnowledge(AgentMemory memory, KnowledgeRequest request) {
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(request, "request");
        if (request.getDomain() == null || request.getConcept() == null) {
            throw new ValidationException("knowledge", List.of("domain and concept are required"));
        }
        Instant now = Instant.now(clock);

        Map<String, KnowledgeEntry> domainKnowledge = memory.getKnowledge()
                .computeIfAbsent(request.getDomain(), ignored -> new LinkedHashMap<>());
        KnowledgeEntry previous = domainKnowledge.get(request.getConcept());
        domainKnowledge.put(request.getConcept(), KnowledgeEntry.builder()
                .value(request.getValue())
                .confidence(request.getConfidence())
                .source(request.getSource())
                .reinforcements(previous != null ? previous.getReinforcements() : 0)
                .tags(request.getTags() != null ? new ArrayList<>(request.getTags()) : new ArrayList<>())
                .timestamp(now)
                .build());

        KnowledgeGraph graph = memory.getKnowledgeGraph();
        Optional<KnowledgeConcept> existing = graph.findConcept(request.getDomain(), request.getConcept());
        if (existing.isPresent()) {
            existing.get().reinforce();
        } else {
            graph.domainConcepts(request.getDomain()).add(KnowledgeConcept.builder()
                    .concept(request.getConcept())
                    .value(request.getValue())
                    .confidence(request.getConfidence())
                    .reinforcements(1)
                    .timestamp(now)
                    .build());
        }

        memory.setUpdated(now);
        log.debug("[AgentMemory] agent={} knowledge {}:{}", memory.getAgentId(),
                request.getDomain(), request.getConcept());
    }

    /**
     * Attaches feedback to the referenced interaction and feeds the learning
     * profile. Feedback for an unknown interaction still updates learning.
     */
    public void recordFeedback(AgentMemory memory, FeedbackRequest request) {
        Objects.requireNonNull(memory, "memory");
        Objects.requireNonNull(request, "request");
        Instant now = Instant.now(clock);
        String category = request.getCategory() != null ? request.getCategory() : FeedbackRequest.DEFAULT_CATEGORY;

        Optional<Interaction> target = memory.findInteraction(request.getInteractionId());
        if (target.isPresent()) {
            target.get().setFeedback(InteractionFeedback.builder()
                    .rating(request.getRating())
                    .category(category)
                    .comments(request.getComments() != null ? request.getComments() : "")
                    .helpful(request.getHelpful())
                    .timestamp(now)
                    .build());
        } else {
            log.debug("[AgentMemory] agent={} feedback for unknown interaction {}",
                    memory.getAgentId(), request.getInteractionId());
        }

        LearningProfile learning = memory.getLearning();
        if (request.getHelpful() != null) {
            learning.adjustAdaptationScore(request.getHelpful() ? HELPFUL_DELTA : UNHELPFUL_DELTA);
        }
        if (request.getRating() != null) {
            learning.getDomainExpertise()
                    .computeIfAbsent(category, ignored -> new CategoryRating())
                    .record(request.getRating());
        }

        memory.setUpdated(now);
    }

    public MemoryStats getStats(AgentMemory memory) {
        List<Interaction> interactions = memory.getInteractions();
        int total = interactions.size();
        int successful = (int) interactions.stream().filter(Interaction::isSuccess).count();
        int concepts = memory.getKnowledge().values().stream().mapToInt(Map::size).sum();
        long ageDays = memory.getCreated() != null
                ? Duration.between(memory.getCreated(), Instant.now(clock)).toDays()
                : 0;

        return MemoryStats.builder()
                .totalInteractions(total)
                .successfulInteractions(successful)
                .successRate(total > 0 ? MemoryInsightService.round2((double) successful / total) : 0)
                .knowledgeDomains(memory.getKnowledge().size())
                .knowledgeConcepts(concepts)
                .memoryAgeDays(ageDays)
                .lastAccessed(memory.getLastAccessed())
                .patterns(countPatterns(memory.getPatterns()))
                .adaptationScore(memory.getLearning().getAdaptationScore())
                .build();
    }

    /**
     * Flattened knowledge graph with concepts below {@code minConfidence}
     * omitted. Every domain is listed even when all its concepts are filtered.
     */
    public KnowledgeGraphSnapshot getKnowledgeGraph(AgentMemory memory, double minConfidence) {
        List<String> domains = new ArrayList<>();
        Map<String, KnowledgeNode> nodes = new LinkedHashMap<>();
        memory.getKnowledgeGraph().getConcepts().forEach((domain, concepts) -> {
            domains.add(domain);
            for (KnowledgeConcept concept : concepts) {
                if (concept.getConfidence() < minConfidence) {
                    continue;
                }
                String nodeId = domain + ":" + concept.getConcept();
                nodes.putIfAbsent(nodeId, KnowledgeNode.builder()
                        .id(nodeId)
                        .domain(domain)
                        .concept(concept.getConcept())
                        .value(concept.getValue())
                        .confidence(concept.getConfidence())
                        .reinforcements(concept.getReinforcements())
                        .build());
            }
        });
        return KnowledgeGraphSnapshot.builder()
                .agentId(memory.getAgentId())
                .domains(domains)
                .nodes(new ArrayList<>(nodes.values()))
                .build();
    }

    /**
     * Storage priority of the whole record in [0, 100], driven by success rate,
     * history size, knowledge breadth and recent access.
     */
    public double calculateMemoryImportance(AgentMemory memory) {
        double importance = 50;
        importance += memory.getPerformance().getSuccessRate() * 30;
        importance += Math.min(20, memory.interactionCount() * 0.5);
        importance += Math.min(10, memory.getKnowledge().size() * 2);
        if (memory.getLastAccessed() != null) {
            double daysSinceAccess = MemoryRelevanceService.ageInDays(memory.getLastAccessed(), Instant.now(clock));
            importance += Math.max(0, 10 - daysSinceAccess);
        }
        return Math.min(100, Math.max(0, importance));
    }

    public AgentMemory cloneMemory(AgentMemory source) {
        return cloneMemory(source, copy -> {
        });
    }

    /**
     * Deep copy with a fresh id and timestamps; {@code overrides} runs last.
     */
    public AgentMemory cloneMemory(AgentMemory source, Consumer<AgentMemory> overrides) {
        Objects.requireNonNull(source, "source");
        AgentMemory copy = entityCodec.deepCopy(source, AgentMemory.class);
        Instant now = Instant.now(clock);
        copy.setId(entityCodec.newId());
        copy.setCreated(now);
        copy.setUpdated(now);
        overrides.accept(copy);
        return copy;
    }

    private void updatePerformanceMetrics(AgentMemory memory) {
        List<Interaction> interactions = memory.getInteractions();
        int total = interactions.size();
        int successful = (int) interactions.stream().filter(Interaction::isSuccess).count();
        long totalTime = interactions.stream().mapToLong(Interaction::getDuration).sum();

        memory.setPerformance(MemoryPerformance.builder()
                .successRate(total > 0 ? (double) successful / total : 0)
                .averageResponseTime(total > 0 ? (double) totalTime / total : 0)
                .totalInteractions(total)
                .errorCount(total - successful)
                .improvementTrend(insightService.analyzeTrend(interactions,
                        properties.getTrends().getWindowSize()).getTrend())
                .build());
    }

    private void extractPatterns(AgentMemory memory, Instant now) {
        List<Interaction> recent = memory.latestInteractions(properties.getRetention().getPatternWindow());
        ZoneId zone = clock.getZone();

        Map<String, Integer> keywordCounts = new LinkedHashMap<>();
        Map<Integer, Integer> hourCounts = new LinkedHashMap<>();
        for (Interaction interaction : recent) {
            for (String word : interaction.getPrompt().toLowerCase(Locale.ROOT).split("\\s+")) {
                if (word.length() >= PATTERN_MIN_WORD_LENGTH) {
                    keywordCounts.merge(word, 1, Integer::sum);
                }
            }
            if (interaction.getTimestamp() != null) {
                hourCounts.merge(interaction.getTimestamp().atZone(zone).getHour(), 1, Integer::sum);
            }
        }

        memory.setPatterns(MemoryPatterns.builder()
                .keywords(topEntries(keywordCounts, PATTERN_TOP_KEYWORDS))
                .commonHours(topEntries(hourCounts, PATTERN_TOP_HOURS))
                .lastUpdated(now)
                .build());
    }

    private static <K> Map<K, Integer> topEntries(Map<K, Integer> counts, int limit) {
        Map<K, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<K, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        return top;
    }

    private static int countPatterns(MemoryPatterns patterns) {
        if (patterns == null) {
            return 0;
        }
        return patterns.getKeywords().size() + patterns.getCommonHours().size();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) : value;
    }
}
