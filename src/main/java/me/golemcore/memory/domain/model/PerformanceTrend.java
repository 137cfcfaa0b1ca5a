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
 * Result of comparing the most recent interaction window with the one before
 * it. {@code timeChange} is positive when responses got faster.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PerformanceTrend {

    private TrendDirection trend;
    private double confidence;
    private double recentSuccessRate;
    private long recentAvgTime;
    private double successChange;
    private double timeChange;

    public static PerformanceTrend insufficientData() {
        return PerformanceTrend.builder()
                .trend(TrendDirection.INSUFFICIENT_DATA)
                .confidence(0)
                .build();
    }
}
