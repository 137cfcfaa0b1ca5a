package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.AgentMemory;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.RelevanceQuery;
import me.golemcore.memory.domain.model.ScoredInteraction;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryRelevanceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final double EPSILON = 1e-9;

    private MemoryRelevanceService service;
    private AgentMemory memory;

    @BeforeEach
    void setUp() {
        service = new MemoryRelevanceService(new MemoryEngineProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        memory = new AgentMemory();
        memory.setAgentId("backend-developer");
    }

    // ==================== scoring ====================

    @Test
    void shouldScoreAllComponentsUpToCeiling() {
        Interaction interaction = interaction("i1", "Tune the cache eviction policy", true, NOW, "memory");
        RelevanceQuery query = query(List.of("cache", "EVICTION"), "memory");

        assertEquals(1.0, service.calculateRelevance(interaction, query), EPSILON);
    }

    @Test
    void shouldWeightPartialKeywordOverlapAndRecencyDecay() {
        Interaction interaction = interaction("i1", "Tune the cache", true, NOW.minus(Duration.ofDays(15)));
        RelevanceQuery query = query(List.of("cache", "index"), null);

        // 0.5 * 0.4 + (1 - 15/30) * 0.2 + 0.1
        assertEquals(0.4, service.calculateRelevance(interaction, query), EPSILON);
    }

    @Test
    void shouldMatchKeywordsInResponseText() {
        Interaction interaction = interaction("i1", "question", true, NOW.minus(Duration.ofDays(60)));
        interaction.setResponse("Use a partial index");

        assertEquals(0.5, service.calculateRelevance(interaction, query(List.of("index"), null)), EPSILON);
    }

    // ==================== retrieval ====================

    @Test
    void shouldNeverReturnFailedInteractions() {
        memory.appendInteraction(interaction("ok", "cache tuning", true, NOW, "memory"));
        memory.appendInteraction(interaction("failed", "cache tuning", false, NOW, "memory"));

        List<ScoredInteraction> result = service.getRelevantMemories(memory, query(List.of("cache"), "memory"));

        assertEquals(1, result.size());
        assertTrue(result.stream().allMatch(scored -> scored.getInteraction().isSuccess()));
        assertEquals("ok", result.get(0).getInteraction().getId());
    }

    @Test
    void shouldDropInteractionsBelowThreshold() {
        memory.appendInteraction(interaction("old", "unrelated", true, NOW.minus(Duration.ofDays(90))));

        assertTrue(service.getRelevantMemories(memory, query(List.of("cache"), null)).isEmpty());
    }

    @Test
    void shouldSortDescendingAndKeepInsertionOrderForTies() {
        memory.appendInteraction(interaction("partial", "cache", true, NOW));
        memory.appendInteraction(interaction("tie-1", "cache index", true, NOW));
        memory.appendInteraction(interaction("tie-2", "cache index", true, NOW));

        List<ScoredInteraction> result = service.getRelevantMemories(memory, query(List.of("cache", "index"), null));

        assertEquals(List.of("tie-1", "tie-2", "partial"), ids(result));
        assertTrue(result.get(0).getRelevanceScore() > result.get(2).getRelevanceScore());
    }

    @Test
    void shouldTruncateToLimit() {
        for (int i = 0; i < 8; i++) {
            memory.appendInteraction(interaction("i" + i, "cache", true, NOW));
        }

        assertEquals(5, service.getRelevantMemories(memory, query(List.of("cache"), null)).size());
        assertEquals(2, service.getRelevantMemories(memory, query(List.of("cache"), null), 2).size());
    }

    @Test
    void shouldReturnDetachedCopiesAndStampLastAccess() {
        Interaction stored = interaction("i1", "cache", true, NOW, "memory");
        memory.appendInteraction(stored);

        List<ScoredInteraction> result = service.getRelevantMemories(memory, query(List.of("cache"), null));
        Interaction returned = result.get(0).getInteraction();
        returned.getTags().add("mutated");
        returned.setPrompt("changed");

        assertNotSame(stored, returned);
        assertEquals(List.of("memory"), stored.getTags());
        assertEquals("cache", stored.getPrompt());
        assertEquals(NOW, memory.getLastAccessed());
    }

    private static RelevanceQuery query(List<String> keywords, String domain) {
        return RelevanceQuery.builder()
                .keywords(keywords)
                .domain(domain)
                .build();
    }

    private static List<String> ids(List<ScoredInteraction> scored) {
        return scored.stream().map(entry -> entry.getInteraction().getId()).toList();
    }

    static Interaction interaction(String id, String prompt, boolean success, Instant timestamp, String... tags) {
        return Interaction.builder()
                .id(id)
                .prompt(prompt)
                .response("")
                .success(success)
                .timestamp(timestamp)
                .tags(new ArrayList<>(List.of(tags)))
                .build();
    }
}
