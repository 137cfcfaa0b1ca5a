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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryUsage {

    public static final long DEFAULT_CLEANUP_FREQUENCY_MS = 3_600_000L;

    private int contextsActive;
    private double memorySizeMB;
    private double peakMemorySizeMB;
    private Instant lastCleanup;

    @Builder.Default
    private long cleanupFrequencyMs = DEFAULT_CLEANUP_FREQUENCY_MS;

    @Builder.Default
    private String retentionPolicy = ContextMetadata.DEFAULT_RETENTION_POLICY;

    public double contextEfficiency() {
        return memorySizeMB > 0 ? contextsActive / memorySizeMB : 0;
    }
}
