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
 * Reinforced concept entry of the per-domain knowledge graph.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeConcept {

    public static final double MAX_CONFIDENCE = 0.95;
    public static final double REINFORCEMENT_STEP = 0.05;

    private String concept;
    private String value;
    private double confidence;
    private int reinforcements;
    private Instant timestamp;

    public void reinforce() {
        reinforcements++;
        confidence = Math.min(MAX_CONFIDENCE, confidence + REINFORCEMENT_STEP);
    }
}
