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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Cumulative task outcome metrics of an agent. Times are in milliseconds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceMetrics {

    private double successRate;
    private double avgCompletionTime;

    /**
     * Active contexts per MB of memory.
     */
    private double contextEfficiency;

    private int totalCompleted;
    private int totalFailed;
    private long totalExecutionTime;
    private Instant lastPerformanceUpdate;

    public int totalTasks() {
        return totalCompleted + totalFailed;
    }
}
