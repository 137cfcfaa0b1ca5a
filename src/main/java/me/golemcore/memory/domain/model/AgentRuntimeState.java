package me.golemcore.memory.domain.model;

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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Live status of one agent: current task, capabilities, cumulative performance
 * and memory pressure. Status changes only through the task lifecycle handled
 * by {@code AgentStateService}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentRuntimeState {

    private String id;

    @Builder.Default
    private AgentType type = AgentType.BACKEND_DEVELOPER;

    @Builder.Default
    private AgentStatus status = AgentStatus.IDLE;

    private Instant created;
    private Instant updated;

    @Builder.Default
    private CurrentTask currentTask = CurrentTask.none();

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> capabilities = new LinkedHashSet<>();

    @Builder.Default
    private PerformanceMetrics performanceMetrics = new PerformanceMetrics();

    @Builder.Default
    private MemoryUsage memoryUsage = new MemoryUsage();
}
