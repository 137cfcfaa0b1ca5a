package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.AgentAnalytics;
import me.golemcore.memory.domain.model.AgentMemory;
import me.golemcore.memory.domain.model.CompressionOptions;
import me.golemcore.memory.domain.model.FeedbackRequest;
import me.golemcore.memory.domain.model.Interaction;
import me.golemcore.memory.domain.model.KnowledgeGraphSnapshot;
import me.golemcore.memory.domain.model.KnowledgeRequest;
import me.golemcore.memory.domain.model.RelevanceQuery;
import me.golemcore.memory.domain.model.ScoredInteraction;
import me.golemcore.memory.domain.model.SystemStats;
import me.golemcore.memory.domain.model.ValidationException;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class AgentMemoryRegistryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final double EPSILON = 1e-9;

    private MemoryEngineProperties properties;
    private AgentMemoryService memoryService;
    private AgentMemoryRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new MemoryEngineProperties();
        registry = newRegistry();
    }

    private AgentMemoryRegistry newRegistry() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EntityCodec codec = new EntityCodec(AutoConfiguration.objectMapper(), clock);
        MemoryInsightService insightService = new MemoryInsightService(properties);
        MemoryRelevanceService relevanceService = new MemoryRelevanceService(properties, clock);
        memoryService = new AgentMemoryService(properties, insightService, codec, clock);
        MemoryCompressionService compressionService = new MemoryCompressionService(properties, relevanceService,
                clock);
        return new AgentMemoryRegistry(properties, memoryService, relevanceService, compressionService,
                insightService, clock);
    }

    private static Interaction interaction(String prompt, boolean success) {
        return Interaction.builder()
                .prompt(prompt)
                .response("done")
                .success(success)
                .duration(1000)
                .build();
    }

    // ==================== keys and cache ====================

    @Test
    void shouldBuildMemoryKeys() {
        assertEquals("test-runner", AgentMemoryRegistry.memoryKey("test-runner", null, null));
        assertEquals("test-runner:u1", AgentMemoryRegistry.memoryKey("test-runner", "u1", ""));
        assertEquals("test-runner:s1", AgentMemoryRegistry.memoryKey("test-runner", null, "s1"));
        assertEquals("test-runner:u1:s1", AgentMemoryRegistry.memoryKey("test-runner", "u1", "s1"));
        assertThrows(ValidationException.class, () -> AgentMemoryRegistry.memoryKey(" ", "u1", null));
    }

    @Test
    void shouldReturnSameRecordForSameKey() {
        AgentMemory first = registry.getOrCreate("test-runner", "u1", null);
        AgentMemory second = registry.getOrCreate("test-runner", "u1", null);

        assertSame(first, second);
        assertEquals(1, registry.size());
        assertEquals("u1", first.getUserId());
        assertNull(first.getSessionId());
    }

    @Test
    void shouldEvictLeastRecentlyUsedRecord() {
        properties.getRegistry().setMaxCacheSize(2);
        registry = newRegistry();
        AgentMemory first = registry.getOrCreate("agent-a", null, null);
        AgentMemory second = registry.getOrCreate("agent-b", null, null);

        registry.getOrCreate("agent-a", null, null);
        registry.getOrCreate("agent-c", null, null);

        assertEquals(2, registry.size());
        assertSame(first, registry.getOrCreate("agent-a", null, null));
        assertNotSame(second, registry.getOrCreate("agent-b", null, null));
    }

    @Test
    void shouldEvictExplicitly() {
        registry.getOrCreate("agent-a", "u1", null);

        assertTrue(registry.evict("agent-a", "u1", null));
        assertFalse(registry.evict("agent-a", "u1", null));
        assertEquals(0, registry.size());
    }

    @Test
    void shouldApplyWriteToLiveRecordWhenEvictedBeforeLock() throws Exception {
        properties.getRegistry().setMaxCacheSize(1);
        registry = newRegistry();
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Thread writer = new Thread(() -> registry.recordInteraction("agent-a", null, null,
                interaction("late write", true)));
        try {
            Future<Object> holder = executor.submit(() -> registry.withMemory("agent-a", null, null, memory -> {
                holding.countDown();
                awaitUninterruptibly(release);
                return null;
            }));
            holding.await();

            writer.start();
            awaitBlocked(writer);
            registry.getOrCreate("agent-b", null, null);
            release.countDown();

            holder.get();
            writer.join(5000);
        } finally {
            executor.shutdownNow();
        }

        assertFalse(writer.isAlive());
        assertEquals(1, registry.getOrCreate("agent-a", null, null).interactionCount());
    }

    private static void awaitUninterruptibly(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void awaitBlocked(Thread thread) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (thread.getState() != Thread.State.BLOCKED && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(Thread.State.BLOCKED, thread.getState());
    }

    // ==================== routed operations ====================

    @Test
    void shouldCompressOncePastRegistryThreshold() {
        for (int i = 0; i < 80; i++) {
            registry.recordInteraction("test-runner", null, null, interaction("run suite " + i, true));
        }
        AgentMemory memory = registry.getOrCreate("test-runner", null, null);
        assertEquals(80, memory.interactionCount());

        registry.recordInteraction("test-runner", null, null, interaction("run suite 80", true));

        assertEquals(74, memory.interactionCount());
        assertEquals("run suite 80", memory.getInteractions().get(73).getPrompt());
    }

    @Test
    void shouldRouteKnowledgeAndFeedback() {
        Interaction stored = registry.recordInteraction("backend-developer", "u1", null,
                interaction("optimize query plan", true));
        registry.addKnowledge("backend-developer", "u1", null, KnowledgeRequest.builder()
                .domain("sql")
                .concept("explain-analyze")
                .value("Read the plan before indexing")
                .confidence(0.8)
                .build());
        registry.recordFeedback("backend-developer", "u1", null, FeedbackRequest.builder()
                .interactionId(stored.getId())
                .rating(8.0)
                .helpful(true)
                .build());

        AgentMemory memory = registry.getOrCreate("backend-developer", "u1", null);
        KnowledgeGraphSnapshot graph = registry.getKnowledgeGraph("backend-developer", "u1", null, 0.5);

        assertEquals(8.0, memory.findInteraction(stored.getId()).orElseThrow().getFeedback().getRating(), EPSILON);
        assertEquals(0.52, memory.getLearning().getAdaptationScore(), EPSILON);
        assertEquals(1, graph.getNodes().size());
    }

    @Test
    void shouldFindRelevantMemoriesThroughRegistry() {
        registry.recordInteraction("backend-developer", null, null, interaction("optimize query plan", true));
        registry.recordInteraction("backend-developer", null, null, interaction("deploy service", true));

        List<ScoredInteraction> results = registry.getRelevantMemories("backend-developer", null, null,
                RelevanceQuery.builder().keywords(List.of("query")).threshold(0.5).build(), 5);

        assertEquals(1, results.size());
        assertEquals("optimize query plan", results.get(0).getInteraction().getPrompt());
    }

    @Test
    void shouldCompressAllOversizedRecords() {
        AgentMemory large = registry.getOrCreate("file-analyzer", null, null);
        List<Interaction> history = new ArrayList<>();
        for (int i = 0; i < 90; i++) {
            history.add(Interaction.builder()
                    .id("i-" + i)
                    .prompt("scan file " + i)
                    .success(true)
                    .timestamp(NOW.minusSeconds(90L - i))
                    .build());
        }
        large.setInteractions(history);
        registry.getOrCreate("code-analyzer", null, null);

        int compressed = registry.compressAll();

        assertEquals(1, compressed);
        assertEquals(74, large.interactionCount());
        assertEquals(0, registry.compressAll());
    }

    @Test
    void shouldSerializeConcurrentWritersPerRecord() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                int offset = worker * 50;
                futures.add(executor.submit(() -> IntStream.range(0, 50).forEach(i -> registry.recordInteraction(
                        "parallel-worker", null, null, interaction("sync task " + (offset + i), true)))));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        AgentMemory memory = registry.getOrCreate("parallel-worker", null, null);
        assertEquals(74, memory.interactionCount());
    }

    @Test
    void shouldPassRegistryOptionsToCompression() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        MemoryCompressionService compressionService = mock(MemoryCompressionService.class);
        AgentMemoryRegistry mockedRegistry = new AgentMemoryRegistry(properties, memoryService,
                new MemoryRelevanceService(properties, clock), compressionService,
                new MemoryInsightService(properties), clock);

        for (int i = 0; i < 80; i++) {
            mockedRegistry.recordInteraction("code-analyzer", null, null, interaction("review " + i, true));
        }
        verify(compressionService, never()).compressMemories(any(), any());

        mockedRegistry.recordInteraction("code-analyzer", null, null, interaction("review 80", true));

        ArgumentCaptor<CompressionOptions> options = ArgumentCaptor.forClass(CompressionOptions.class);
        verify(compressionService).compressMemories(any(AgentMemory.class), options.capture());
        assertEquals(50, options.getValue().getKeepRecentCount());
        assertEquals(80, options.getValue().getCompressionThreshold());
    }

    // ==================== analytics ====================

    @Test
    void shouldAggregateSystemStats() {
        registry.recordInteraction("backend-developer", "u1", null, interaction("build api", true));
        registry.recordInteraction("backend-developer", "u1", null, interaction("write tests", true));
        registry.recordInteraction("backend-developer", "u2", null, interaction("fix bug", true));
        registry.recordInteraction("backend-developer", "u2", null, interaction("fix flaky bug", false));
        registry.recordInteraction("test-runner", null, null, interaction("run suite", false));
        registry.addKnowledge("backend-developer", "u1", null, KnowledgeRequest.builder()
                .domain("api")
                .concept("pagination")
                .value("cursor based")
                .build());

        SystemStats stats = registry.getSystemStats();

        assertEquals(3, stats.getTotalAgentMemories());
        assertEquals(5, stats.getTotalInteractions());
        assertEquals(0.375, stats.getAverageSuccessRate(), EPSILON);
        assertEquals(List.of("api"), stats.getKnowledgeDomains());
        assertEquals("backend-developer", stats.getTopPerformingAgents().get(0).getAgentId());
        assertEquals(0.75, stats.getTopPerformingAgents().get(0).getSuccessRate(), EPSILON);
        assertEquals(2, stats.getTopPerformingAgents().get(0).getMemories());
        assertEquals(4, stats.getMemoryDistribution().get("backend-developer"));
        assertEquals(1, stats.getMemoryDistribution().get("test-runner"));
        assertEquals(3, stats.getCacheSize());
        assertEquals(100, stats.getMaxCacheSize());
    }

    @Test
    void shouldReturnEmptyAnalyticsForUnknownAgent() {
        AgentAnalytics analytics = registry.getAgentAnalytics("database-optimizer");

        assertEquals(0, analytics.getTotalMemories());
        assertTrue(analytics.getDomainExpertise().isEmpty());
        assertNull(analytics.getPerformanceTrends());
    }

    @Test
    void shouldAggregateAgentAnalytics() {
        registry.recordInteraction("database-optimizer", "u1", null, interaction("tune index", true));
        registry.recordInteraction("database-optimizer", "u2", null, interaction("tune query", false));
        registry.addKnowledge("database-optimizer", "u1", null, KnowledgeRequest.builder()
                .domain("indexing")
                .concept("covering-index")
                .value("include selected columns")
                .build());

        AgentAnalytics analytics = registry.getAgentAnalytics("database-optimizer");

        assertEquals(2, analytics.getTotalMemories());
        assertEquals(2, analytics.getTotalInteractions());
        assertEquals(0.5, analytics.getAverageSuccessRate(), EPSILON);
        assertTrue(analytics.getDomainExpertise().containsKey("indexing"));
        assertTrue(analytics.getPerformanceTrends() != null);
    }
}
