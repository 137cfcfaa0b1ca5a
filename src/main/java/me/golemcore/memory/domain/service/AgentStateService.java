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
import me.golemcore.memory.domain.model.AgentRuntimeState;
import me.golemcore.memory.domain.model.AgentStatus;
import me.golemcore.memory.domain.model.AgentType;
import me.golemcore.memory.domain.model.CleanupResult;
import me.golemcore.memory.domain.model.CurrentTask;
import me.golemcore.memory.domain.model.MemoryUsage;
import me.golemcore.memory.domain.model.PerformanceMetrics;
import me.golemcore.memory.domain.model.PerformanceSummary;
import me.golemcore.memory.domain.model.TaskAssignment;
import me.golemcore.memory.domain.model.TaskCompletion;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Task lifecycle and resource bookkeeping of an {@link AgentRuntimeState}.
 *
 * <p>
 * Transitions: {@code idle -> busy -> (active | error) -> busy | idle}. A task
 * can only be started when the agent is not busy and only completed while it
 * is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentStateService {

    private static final double ACTIVE_WORKLOAD = 50;
    private static final double BUSY_WORKLOAD_WITHOUT_ESTIMATE = 75;
    private static final double MAX_WORKLOAD = 100;
    private static final double MILLIS_PER_MINUTE = 60_000d;

    private final MemoryEngineProperties properties;
    private final EntityCodec entityCodec;
    private final Clock clock;

    public AgentRuntimeState createState(AgentType type) {
        AgentType effectiveType = type != null ? type : AgentType.BACKEND_DEVELOPER;
        Instant now = Instant.now(clock);
        return AgentRuntimeState.builder()
                .id(entityCodec.newId())
                .type(effectiveType)
                .status(AgentStatus.IDLE)
                .created(now)
                .updated(now)
                .capabilities(new LinkedHashSet<>(effectiveType.getDefaultCapabilities()))
                .memoryUsage(MemoryUsage.builder()
                        .lastCleanup(now)
                        .cleanupFrequencyMs(properties.getAgent().getCleanupFrequency().toMillis())
                        .build())
                .build();
    }

    public void startTask(AgentRuntimeState state, TaskAssignment assignment) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(assignment, "assignment");
        if (state.getStatus() == AgentStatus.BUSY) {
            throw new IllegalStateException("Agent " + state.getId() + " is already busy with task "
                    + state.getCurrentTask().getTaskId());
        }
        Instant now = Instant.now(clock);
        Duration estimate = assignment.getEstimatedDurationMinutes() != null
                ? Duration.ofMinutes(assignment.getEstimatedDurationMinutes())
                : properties.getAgent().getDefaultTaskDuration();

        state.setStatus(AgentStatus.BUSY);
        state.setCurrentTask(CurrentTask.builder()
                .taskId(assignment.getTaskId())
                .issueNumber(assignment.getIssueNumber())
                .stream(assignment.getStream())
                .startedAt(now)
                .estimatedCompletion(now.plus(estimate))
                .build());
        state.setUpdated(now);
        log.debug("[AgentState] {} started task {}", state.getId(), assignment.getTaskId());
    }

    /**
     * Ends the current task and folds its outcome into the cumulative metrics.
     *
     * @throws IllegalStateException
     *             when the agent is not busy
     */
    public void completeTask(AgentRuntimeState state, boolean success, TaskCompletion completion) {
        Objects.requireNonNull(state, "state");
        if (state.getStatus() != AgentStatus.BUSY) {
            throw new IllegalStateException("Agent " + state.getId() + " has no task in progress (status "
                    + state.getStatus().getCode() + ")");
        }
        TaskCompletion effective = completion != null ? completion : TaskCompletion.empty();
        Instant now = Instant.now(clock);
        Instant startedAt = state.getCurrentTask().getStartedAt() != null
                ? state.getCurrentTask().getStartedAt()
                : now;
        long executionTime = effective.getExecutionTime() != null
                ? effective.getExecutionTime()
                : Duration.between(startedAt, now).toMillis();

        PerformanceMetrics metrics = state.getPerformanceMetrics();
        if (success) {
            metrics.setTotalCompleted(metrics.getTotalCompleted() + 1);
        } else {
            metrics.setTotalFailed(metrics.getTotalFailed() + 1);
        }
        metrics.setTotalExecutionTime(metrics.getTotalExecutionTime() + executionTime);
        int totalTasks = metrics.totalTasks();
        metrics.setSuccessRate(totalTasks > 0 ? (double) metrics.getTotalCompleted() / totalTasks : 0);
        metrics.setAvgCompletionTime(metrics.getTotalCompleted() > 0
                ? (double) metrics.getTotalExecutionTime() / metrics.getTotalCompleted()
                : 0);
        metrics.setLastPerformanceUpdate(now);

        MemoryUsage usage = state.getMemoryUsage();
        if (effective.getMemoryPeak() != null && effective.getMemoryPeak() > usage.getPeakMemorySizeMB()) {
            usage.setPeakMemorySizeMB(effective.getMemoryPeak());
        }
        metrics.setContextEfficiency(usage.contextEfficiency());

        String taskId = state.getCurrentTask().getTaskId();
        state.setCurrentTask(CurrentTask.none());
        state.setStatus(success ? AgentStatus.ACTIVE : AgentStatus.ERROR);
        state.setUpdated(now);

        if (success) {
            log.debug("[AgentState] {} completed task {} in {}ms", state.getId(), taskId, executionTime);
        } else {
            log.warn("[AgentState] {} failed task {} after {}ms", state.getId(), taskId, executionTime);
        }
    }

    /**
     * Returns a resting agent to idle.
     *
     * @throws IllegalStateException
     *             when the agent is busy
     */
    public void markIdle(AgentRuntimeState state) {
        if (state.getStatus() == AgentStatus.BUSY) {
            throw new IllegalStateException("Agent " + state.getId() + " is busy");
        }
        state.setStatus(AgentStatus.IDLE);
        state.setUpdated(Instant.now(clock));
    }

    /**
     * Applies new usage figures; a null argument keeps the current value.
     */
    public void updateMemoryUsage(AgentRuntimeState state, Integer contextsActive, Double memorySizeMB) {
        MemoryUsage usage = state.getMemoryUsage();
        if (contextsActive != null) {
            usage.setContextsActive(Math.max(0, contextsActive));
        }
        if (memorySizeMB != null) {
            usage.setMemorySizeMB(Math.max(0, memorySizeMB));
            if (memorySizeMB > usage.getPeakMemorySizeMB()) {
                usage.setPeakMemorySizeMB(memorySizeMB);
            }
        }
        state.getPerformanceMetrics().setContextEfficiency(usage.contextEfficiency());
        state.setUpdated(Instant.now(clock));
    }

    public void performCleanup(AgentRuntimeState state, CleanupResult result) {
        CleanupResult effective = result != null ? result : new CleanupResult();
        Instant now = Instant.now(clock);
        MemoryUsage usage = state.getMemoryUsage();

        usage.setContextsActive(Math.max(0, usage.getContextsActive() - effective.getContextsFreed()));
        usage.setMemorySizeMB(Math.max(0, usage.getMemorySizeMB() - effective.getMemoryFreed()));
        usage.setLastCleanup(now);
        state.getPerformanceMetrics().setContextEfficiency(usage.contextEfficiency());
        state.setUpdated(now);
        log.debug("[AgentState] {} cleanup freed {} contexts, {}MB", state.getId(),
                effective.getContextsFreed(), effective.getMemoryFreed());
    }

    public boolean needsCleanup(AgentRuntimeState state) {
        Instant lastCleanup = state.getMemoryUsage().getLastCleanup();
        if (lastCleanup == null) {
            return true;
        }
        long sinceCleanup = Duration.between(lastCleanup, Instant.now(clock)).toMillis();
        return sinceCleanup > state.getMemoryUsage().getCleanupFrequencyMs();
    }

    public void addCapability(AgentRuntimeState state, String capability) {
        if (state.getCapabilities().add(capability)) {
            state.setUpdated(Instant.now(clock));
        }
    }

    public void removeCapability(AgentRuntimeState state, String capability) {
        if (state.getCapabilities().remove(capability)) {
            state.setUpdated(Instant.now(clock));
        } else {
            log.debug("[AgentState] {} has no capability {}", state.getId(), capability);
        }
    }

    public boolean hasCapability(AgentRuntimeState state, String capability) {
        return state.getCapabilities().contains(capability);
    }

    /**
     * Current load in percent. A busy agent reports the elapsed share of its
     * estimated task duration.
     */
    public double getWorkloadPercentage(AgentRuntimeState state) {
        return switch (state.getStatus()) {
        case IDLE -> 0;
        case ERROR -> MAX_WORKLOAD;
        case BUSY -> busyWorkload(state.getCurrentTask());
        case ACTIVE -> ACTIVE_WORKLOAD;
        };
    }

    public PerformanceSummary getPerformanceSummary(AgentRuntimeState state) {
        PerformanceMetrics metrics = state.getPerformanceMetrics();
        MemoryUsage usage = state.getMemoryUsage();
        return PerformanceSummary.builder()
                .successRate(String.format(Locale.ROOT, "%.1f%%", metrics.getSuccessRate() * 100))
                .avgCompletionTime(String.format(Locale.ROOT, "%.1fm",
                        metrics.getAvgCompletionTime() / MILLIS_PER_MINUTE))
                .contextEfficiency(String.format(Locale.ROOT, "%.2f", metrics.getContextEfficiency()))
                .totalTasks(metrics.totalTasks())
                .memoryUsage(String.format(Locale.ROOT, "%.1fMB (%d contexts)",
                        usage.getMemorySizeMB(), usage.getContextsActive()))
                .build();
    }

    public String getSummary(AgentRuntimeState state) {
        PerformanceSummary summary = getPerformanceSummary(state);
        String id = state.getId() != null ? state.getId() : "";
        return String.format(Locale.ROOT, "AgentState[%s...] %s (%s) - Workload: %.0f%%, Success: %s, Memory: %s, Tasks: %d",
                id.substring(0, Math.min(8, id.length())),
                state.getType().getCode(),
                state.getStatus().getCode(),
                getWorkloadPercentage(state),
                summary.getSuccessRate(),
                summary.getMemoryUsage(),
                summary.getTotalTasks());
    }

    public AgentRuntimeState cloneState(AgentRuntimeState source) {
        return cloneState(source, copy -> {
        });
    }

    /**
     * Deep copy with a fresh id and timestamps; {@code overrides} runs last.
     */
    public AgentRuntimeState cloneState(AgentRuntimeState source, Consumer<AgentRuntimeState> overrides) {
        Objects.requireNonNull(source, "source");
        AgentRuntimeState copy = entityCodec.deepCopy(source, AgentRuntimeState.class);
        Instant now = Instant.now(clock);
        copy.setId(entityCodec.newId());
        copy.setCreated(now);
        copy.setUpdated(now);
        overrides.accept(copy);
        return copy;
    }

    private double busyWorkload(CurrentTask task) {
        if (task.getEstimatedCompletion() == null || task.getStartedAt() == null) {
            return BUSY_WORKLOAD_WITHOUT_ESTIMATE;
        }
        long total = Duration.between(task.getStartedAt(), task.getEstimatedCompletion()).toMillis();
        long elapsed = Duration.between(task.getStartedAt(), Instant.now(clock)).toMillis();
        if (total <= 0) {
            return MAX_WORKLOAD;
        }
        return Math.min(MAX_WORKLOAD, Math.max(0, (double) elapsed / total * 100));
    }
}
