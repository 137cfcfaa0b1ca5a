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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.AgentAnalytics;
import me.golemcore.memory.domain.model.AgentMemory;
import me.golemcore.memory.domain.model.AgentPerformanceStat;
import me.golemcore.memory.domain.model.CompressionOptions;
import me.golemcore.memory.domain.model.FeedbackRequest;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.KnowledgeGraphSnapshot;
import me.golemcore.memory.domain.model.KnowledgeRequest;
import me.golemcore.memory.domain.model.RelevanceQuery;
import me.golemcore.memory.domain.model.ScoredInteraction;
import me.golemcore.memory.domain.model.SystemStats;
import me.golemcore.memory.domain.model.ValidationException;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * In-process registry of agent memories keyed by
 * {@code agentId[:userId][:sessionId]}.
 *
 * <p>
 * Records live in an access-ordered cache; the least recently used record is
 * dropped once the cache exceeds {@code memory.registry.max-cache-size}. Every
 * mutation runs while holding the monitor of the affected record, so a record
 * never sees two writers at once.
 */
@Service
@Slf4j
public class AgentMemoryRegistry {

    private static final int TOP_AGENTS_LIMIT = 10;

    private final MemoryEngineProperties properties;
    private final AgentMemoryService memoryService;
    private final MemoryRelevanceService relevanceService;
    private final MemoryCompressionService compressionService;
    private final MemoryInsightService insightService;
    private final Clock clock;
    private final Map<String, AgentMemory> cache;

    public AgentMemoryRegistry(MemoryEngineProperties properties, AgentMemoryService memoryService,
            MemoryRelevanceService relevanceService, MemoryCompressionService compressionService,
            MemoryInsightService insightService, Clock clock) {
        this.properties = properties;
        this.memoryService = memoryService;
        this.relevanceService = relevanceService;
        this.compressionService = compressionService;
        this.insightService = insightService;
        this.clock = clock;
        int maxCacheSize = properties.getRegistry().getMaxCacheSize();
        this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, AgentMemory> eldest) {
                boolean evict = size() > maxCacheSize;
                if (evict) {
                    log.debug("[MemoryRegistry] evicting {}", eldest.getKey());
                }
                return evict;
            }
        });
    }

    public static String memoryKey(String agentId, String userId, String sessionId) {
        if (agentId == null || agentId.isBlank()) {
            throw new ValidationException("agentId is required");
        }
        StringBuilder key = new StringBuilder(agentId);
        if (userId != null && !userId.isBlank()) {
            key.append(':').append(userId);
        }
        if (sessionId != null && !sessionId.isBlank()) {
            key.append(':').append(sessionId);
        }
        return key.toString();
    }

    public AgentMemory getOrCreate(String agentId, String userId, String sessionId) {
        String key = memoryKey(agentId, userId, sessionId);
        AgentMemory memory;
        synchronized (cache) {
            memory = cache.get(key);
            if (memory == null) {
                memory = memoryService.createMemory(agentId, userId, sessionId);
                cache.put(key, memory);
                log.debug("[MemoryRegistry] created memory {}", key);
                return memory;
            }
        }
        synchronized (memory) {
            memory.setLastAccessed(Instant.now(clock));
        }
        return memory;
    }

    /**
     * Runs {@code action} against the record while holding its lock. A record
     * evicted between lookup and locking is never handed to {@code action}; the
     * lookup is repeated against the cache instead.
     */
    public <T> T withMemory(String agentId, String userId, String sessionId, Function<AgentMemory, T> action) {
        String key = memoryKey(agentId, userId, sessionId);
        while (true) {
            AgentMemory memory = getOrCreate(agentId, userId, sessionId);
            synchronized (memory) {
                if (cache.get(key) == memory) {
                    return action.apply(memory);
                }
            }
            log.debug("[MemoryRegistry] {} evicted before lock, retrying", key);
        }
    }

    /**
     * Records the interaction and compresses the history once it grows past
     * the registry threshold.
     */
    public Interaction recordInteraction(String agentId, String userId, String sessionId, Interaction interaction) {
        return withMemory(agentId, userId, sessionId, memory -> {
            Interaction stored = memoryService.addInteraction(memory, interaction);
            MemoryEngineProperties.RegistryProperties registry = properties.getRegistry();
            if (memory.interactionCount() > registry.getCompressionThreshold()) {
                compressionService.compressMemories(memory, registryCompressionOptions());
            }
            return stored;
        });
    }

    public void addKnowledge(String agentId, String userId, String sessionId, KnowledgeRequest request) {
        withMemory(agentId, userId, sessionId, memory -> {
            memoryService.addKnowledge(memory, request);
            return null;
        });
    }

    public void recordFeedback(String agentId, String userId, String sessionId, FeedbackRequest request) {
        withMemory(agentId, userId, sessionId, memory -> {
            memoryService.recordFeedback(memory, request);
            return null;
        });
    }

    public List<ScoredInteraction> getRelevantMemories(String agentId, String userId, String sessionId,
            RelevanceQuery query, int limit) {
        return withMemory(agentId, userId, sessionId,
                memory -> relevanceService.getRelevantMemories(memory, query, limit));
    }

    public KnowledgeGraphSnapshot getKnowledgeGraph(String agentId, String userId, String sessionId,
            double minConfidence) {
        return withMemory(agentId, userId, sessionId,
                memory -> memoryService.getKnowledgeGraph(memory, minConfidence));
    }

    /**
     * Compresses every cached record above the registry threshold.
     *
     * @return number of records that changed
     */
    public int compressAll() {
        int compressed = 0;
        for (AgentMemory memory : snapshot()) {
            synchronized (memory) {
                if (memory.interactionCount() > properties.getRegistry().getCompressionThreshold()
                        && compressionService.compressMemories(memory, registryCompressionOptions())) {
                    compressed++;
                }
            }
        }
        if (compressed > 0) {
            log.info("[MemoryRegistry] compressed {} memories", compressed);
        }
        return compressed;
    }

    /**
     * Aggregates all cached records of one agent.
     */
    public AgentAnalytics getAgentAnalytics(String agentId) {
        List<AgentMemory> memories = snapshot().stream()
                .filter(memory -> agentId.equals(memory.getAgentId()))
                .toList();
        AgentAnalytics analytics = AgentAnalytics.builder()
                .agentId(agentId)
                .totalMemories(memories.size())
                .build();
        if (memories.isEmpty()) {
            return analytics;
        }

        int totalInteractions = 0;
        double successRateSum = 0;
        for (AgentMemory memory : memories) {
            synchronized (memory) {
                totalInteractions += memory.getPerformance().getTotalInteractions();
                successRateSum += memory.getPerformance().getSuccessRate();
                for (String domain : memory.getKnowledge().keySet()) {
                    analytics.getDomainExpertise().computeIfAbsent(domain,
                            ignored -> insightService.getDomainExpertise(memory, domain));
                }
                if (analytics.getPerformanceTrends() == null) {
                    analytics.setPerformanceTrends(insightService.getPerformanceTrends(memory));
                }
            }
        }
        analytics.setTotalInteractions(totalInteractions);
        analytics.setAverageSuccessRate(successRateSum / memories.size());
        return analytics;
    }

    public SystemStats getSystemStats() {
        List<AgentMemory> memories = snapshot();
        Set<String> domains = new LinkedHashSet<>();
        Map<String, AgentPerformanceStat> agentStats = new LinkedHashMap<>();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        int totalInteractions = 0;

        for (AgentMemory memory : memories) {
            synchronized (memory) {
                int interactions = memory.interactionCount();
                double successRate = memoryService.getStats(memory).getSuccessRate();
                totalInteractions += interactions;
                domains.addAll(memory.getKnowledge().keySet());
                agentStats.computeIfAbsent(memory.getAgentId(),
                        id -> AgentPerformanceStat.builder().agentId(id).build())
                        .include(interactions, successRate);
                distribution.merge(memory.getAgentId(), interactions, Integer::sum);
            }
        }

        double averageSuccessRate = agentStats.values().stream()
                .mapToDouble(AgentPerformanceStat::getSuccessRate)
                .average()
                .orElse(0);
        List<AgentPerformanceStat> topAgents = agentStats.values().stream()
                .sorted(Comparator.comparingDouble(AgentPerformanceStat::getSuccessRate).reversed())
                .limit(TOP_AGENTS_LIMIT)
                .toList();

        return SystemStats.builder()
                .totalAgentMemories(memories.size())
                .totalInteractions(totalInteractions)
                .averageSuccessRate(averageSuccessRate)
                .knowledgeDomains(new ArrayList<>(domains))
                .topPerformingAgents(new ArrayList<>(topAgents))
                .memoryDistribution(distribution)
                .cacheSize(memories.size())
                .maxCacheSize(properties.getRegistry().getMaxCacheSize())
                .build();
    }

    public boolean evict(String agentId, String userId, String sessionId) {
        return cache.remove(memoryKey(agentId, userId, sessionId)) != null;
    }

    public int size() {
        return cache.size();
    }

    private CompressionOptions registryCompressionOptions() {
        MemoryEngineProperties.RegistryProperties registry = properties.getRegistry();
        return CompressionOptions.builder()
                .keepRecentCount(registry.getKeepRecentCount())
                .compressionThreshold(registry.getCompressionThreshold())
                .build();
    }

    private List<AgentMemory> snapshot() {
        synchronized (cache) {
            return new ArrayList<>(cache.values());
        }
    }
}
