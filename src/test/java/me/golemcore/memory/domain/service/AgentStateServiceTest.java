package me.golemcore.memory.domain.service;

import me.golemcore.memory.domain.model.AgentRuntimeState;
import me.golemcore.memory.domain.model.AgentStatus;
import me.golemcore.memory.domain.model.AgentType;
import me.golemcore.memory.domain.model.CleanupResult;
import me.golemcore.memory.domain.model.CurrentTask;
import me.golemcore.memory.domain.model.PerformanceSummary;
import me.golemcore.memory.domain.model.TaskAssignment;
import me.golemcore.memory.domain.model.TaskCompletion;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentStateServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");
    private static final double EPSILON = 1e-9;

    private MutableClock clock;
    private AgentStateService service;
    private AgentRuntimeState state;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        EntityCodec codec = new EntityCodec(AutoConfiguration.objectMapper(), clock);
        service = new AgentStateService(new MemoryEngineProperties(), codec, clock);
        state = service.createState(AgentType.DATABASE_OPTIMIZER);
    }

    // ==================== createState ====================

    @Test
    void shouldCreateIdleStateWithTypeDefaults() {
        assertEquals(AgentStatus.IDLE, state.getStatus());
        assertEquals(AgentType.DATABASE_OPTIMIZER, state.getType());
        assertTrue(service.hasCapability(state, "query-tuning"));
        assertEquals(NOW, state.getMemoryUsage().getLastCleanup());
        assertEquals(3_600_000L, state.getMemoryUsage().getCleanupFrequencyMs());
        assertFalse(state.getCurrentTask().isAssigned());
    }

    @Test
    void shouldDefaultToBackendDeveloper() {
        assertEquals(AgentType.BACKEND_DEVELOPER, service.createState(null).getType());
    }

    // ==================== task lifecycle ====================

    @Test
    void shouldStartAndCompleteTask() {
        service.startTask(state, TaskAssignment.builder()
                .taskId("task-1")
                .issueNumber(42)
                .stream("backend")
                .estimatedDurationMinutes(45)
                .build());

        assertEquals(AgentStatus.BUSY, state.getStatus());
        assertEquals(NOW, state.getCurrentTask().getStartedAt());
        assertEquals(NOW.plus(Duration.ofMinutes(45)), state.getCurrentTask().getEstimatedCompletion());

        service.completeTask(state, true, TaskCompletion.builder().executionTime(2_700_000L).build());

        assertEquals(1, state.getPerformanceMetrics().getTotalCompleted());
        assertEquals(1.0, state.getPerformanceMetrics().getSuccessRate(), EPSILON);
        assertEquals(2_700_000.0, state.getPerformanceMetrics().getAvgCompletionTime(), EPSILON);
        assertEquals(AgentStatus.ACTIVE, state.getStatus());
        assertFalse(state.getCurrentTask().isAssigned());
        assertNull(state.getCurrentTask().getTaskId());
        assertEquals(NOW, state.getPerformanceMetrics().getLastPerformanceUpdate());
    }

    @Test
    void shouldUseDefaultEstimateWhenNoneGiven() {
        service.startTask(state, TaskAssignment.builder().taskId("task-1").build());

        assertEquals(NOW.plus(Duration.ofMinutes(60)), state.getCurrentTask().getEstimatedCompletion());
    }

    @Test
    void shouldRejectStartWhileBusy() {
        service.startTask(state, TaskAssignment.builder().taskId("task-1").build());
        TaskAssignment second = TaskAssignment.builder().taskId("task-2").build();

        assertThrows(IllegalStateException.class, () -> service.startTask(state, second));
        assertEquals("task-1", state.getCurrentTask().getTaskId());
    }

    @Test
    void shouldRejectCompletionWithoutRunningTask() {
        assertThrows(IllegalStateException.class, () -> service.completeTask(state, true, null));
    }

    @Test
    void shouldRecordFailureAndAllowRestartFromError() {
        service.startTask(state, TaskAssignment.builder().taskId("task-1").build());
        clock.advance(Duration.ofMinutes(10));

        service.completeTask(state, false, null);

        assertEquals(AgentStatus.ERROR, state.getStatus());
        assertEquals(1, state.getPerformanceMetrics().getTotalFailed());
        assertEquals(0.0, state.getPerformanceMetrics().getSuccessRate(), EPSILON);
        assertEquals(0.0, state.getPerformanceMetrics().getAvgCompletionTime(), EPSILON);
        assertEquals(600_000L, state.getPerformanceMetrics().getTotalExecutionTime());

        service.startTask(state, TaskAssignment.builder().taskId("task-2").build());
        assertEquals(AgentStatus.BUSY, state.getStatus());
    }

    @Test
    void shouldAverageCompletionTimeOverCompletedTasks() {
        runTask(true, 1000L);
        runTask(true, 3000L);
        runTask(false, 2000L);

        assertEquals(2.0 / 3.0, state.getPerformanceMetrics().getSuccessRate(), EPSILON);
        assertEquals(3000.0, state.getPerformanceMetrics().getAvgCompletionTime(), EPSILON);
    }

    @Test
    void shouldRaisePeakMemoryAndRecomputeEfficiencyOnCompletion() {
        service.updateMemoryUsage(state, 10, 20.0);
        service.startTask(state, TaskAssignment.builder().taskId("task-1").build());

        service.completeTask(state, true, TaskCompletion.builder().executionTime(10L).memoryPeak(64.0).build());

        assertEquals(64.0, state.getMemoryUsage().getPeakMemorySizeMB(), EPSILON);
        assertEquals(0.5, state.getPerformanceMetrics().getContextEfficiency(), EPSILON);
    }

    @Test
    void shouldReturnRestingAgentToIdle() {
        runTask(true, 10L);

        service.markIdle(state);

        assertEquals(AgentStatus.IDLE, state.getStatus());
    }

    // ==================== memory usage and cleanup ====================

    @Test
    void shouldUpdateUsageAndKeepPeak() {
        service.updateMemoryUsage(state, 8, 16.0);
        service.updateMemoryUsage(state, null, 4.0);

        assertEquals(8, state.getMemoryUsage().getContextsActive());
        assertEquals(4.0, state.getMemoryUsage().getMemorySizeMB(), EPSILON);
        assertEquals(16.0, state.getMemoryUsage().getPeakMemorySizeMB(), EPSILON);
        assertEquals(2.0, state.getPerformanceMetrics().getContextEfficiency(), EPSILON);
    }

    @Test
    void shouldFloorCleanupAtZeroAndStampLastCleanup() {
        service.updateMemoryUsage(state, 5, 10.0);
        clock.advance(Duration.ofMinutes(5));

        service.performCleanup(state, CleanupResult.builder().contextsFreed(8).memoryFreed(4.0).build());

        assertEquals(0, state.getMemoryUsage().getContextsActive());
        assertEquals(6.0, state.getMemoryUsage().getMemorySizeMB(), EPSILON);
        assertEquals(0.0, state.getPerformanceMetrics().getContextEfficiency(), EPSILON);
        assertEquals(NOW.plus(Duration.ofMinutes(5)), state.getMemoryUsage().getLastCleanup());
        assertEquals(AgentStatus.IDLE, state.getStatus());
    }

    @Test
    void shouldNeedCleanupOnlyAfterFrequencyElapsed() {
        clock.advance(Duration.ofHours(1));
        assertFalse(service.needsCleanup(state));

        clock.advance(Duration.ofMillis(1));
        assertTrue(service.needsCleanup(state));

        service.performCleanup(state, null);
        assertFalse(service.needsCleanup(state));
    }

    // ==================== capabilities ====================

    @Test
    void shouldManageCapabilities() {
        service.addCapability(state, "sharding");
        service.addCapability(state, "sharding");
        service.removeCapability(state, "schema-design");
        service.removeCapability(state, "not-present");

        assertTrue(service.hasCapability(state, "sharding"));
        assertFalse(service.hasCapability(state, "schema-design"));
        assertEquals(6, state.getCapabilities().size());
    }

    // ==================== workload and summaries ====================

    @Test
    void shouldReportWorkloadPerStatus() {
        assertEquals(0.0, service.getWorkloadPercentage(state), EPSILON);

        service.startTask(state, TaskAssignment.builder().taskId("t").estimatedDurationMinutes(40).build());
        clock.advance(Duration.ofMinutes(10));
        assertEquals(25.0, service.getWorkloadPercentage(state), EPSILON);

        clock.advance(Duration.ofMinutes(60));
        assertEquals(100.0, service.getWorkloadPercentage(state), EPSILON);

        service.completeTask(state, true, null);
        assertEquals(50.0, service.getWorkloadPercentage(state), EPSILON);

        state.setStatus(AgentStatus.ERROR);
        assertEquals(100.0, service.getWorkloadPercentage(state), EPSILON);
    }

    @Test
    void shouldReportBusyWorkloadWithoutEstimate() {
        state.setStatus(AgentStatus.BUSY);
        state.setCurrentTask(CurrentTask.builder().taskId("t").startedAt(NOW).build());

        assertEquals(75.0, service.getWorkloadPercentage(state), EPSILON);
    }

    @Test
    void shouldFormatPerformanceSummary() {
        service.updateMemoryUsage(state, 3, 12.5);
        runTask(true, 90_000L);
        runTask(false, 1_000L);

        PerformanceSummary summary = service.getPerformanceSummary(state);

        assertEquals("50.0%", summary.getSuccessRate());
        assertEquals("1.5m", summary.getAvgCompletionTime());
        assertEquals("0.24", summary.getContextEfficiency());
        assertEquals(2, summary.getTotalTasks());
        assertEquals("12.5MB (3 contexts)", summary.getMemoryUsage());
    }

    @Test
    void shouldRenderOneLineSummary() {
        state.setId("abcdef0123456789");

        assertEquals("AgentState[abcdef01...] database-optimizer (idle) - Workload: 0%, Success: 0.0%, "
                + "Memory: 0.0MB (0 contexts), Tasks: 0", service.getSummary(state));
    }

    // ==================== cloneState ====================

    @Test
    void shouldCloneWithFreshIdentity() {
        runTask(true, 500L);
        clock.advance(Duration.ofMinutes(1));

        AgentRuntimeState copy = service.cloneState(state, clone -> clone.setStatus(AgentStatus.IDLE));

        assertNotEquals(state.getId(), copy.getId());
        assertEquals(clock.instant(), copy.getCreated());
        assertEquals(AgentStatus.IDLE, copy.getStatus());
        assertEquals(AgentStatus.ACTIVE, state.getStatus());
        assertEquals(state.getPerformanceMetrics(), copy.getPerformanceMetrics());
        assertEquals(state.getCapabilities(), copy.getCapabilities());

        copy.getCapabilities().add("extra");
        assertFalse(state.getCapabilities().contains("extra"));
    }

    private void runTask(boolean success, long executionTime) {
        service.startTask(state, TaskAssignment.builder().taskId("task").build());
        service.completeTask(state, success, TaskCompletion.builder().executionTime(executionTime).build());
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
