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

/**
 * Per-agent aggregate across all cached memory records of that agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AgentPerformanceStat {

    private String agentId;
    private int interactions;
    private double successRate;
    private int memories;

    /**
     * Folds one more record's success rate into the running mean.
     */
    public void include(int recordInteractions, double recordSuccessRate) {
        interactions += recordInteractions;
        successRate = ((successRate * memories) + recordSuccessRate) / (memories + 1);
        memories++;
    }
}
