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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Feedback-driven learning state of an agent memory.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LearningProfile {

    public static final double MIN_ADAPTATION_SCORE = 0.1;
    public static final double MAX_ADAPTATION_SCORE = 0.95;
    public static final double DEFAULT_ADAPTATION_SCORE = 0.5;

    @Builder.Default
    private double adaptationScore = DEFAULT_ADAPTATION_SCORE;

    @Builder.Default
    private Map<String, CategoryRating> domainExpertise = new LinkedHashMap<>();

    @Builder.Default
    private List<String> weaknesses = new ArrayList<>();

    @Builder.Default
    private List<String> strengths = new ArrayList<>();

    public void adjustAdaptationScore(double delta) {
        double adjusted = adaptationScore + delta;
        adaptationScore = Math.max(MIN_ADAPTATION_SCORE, Math.min(MAX_ADAPTATION_SCORE, adjusted));
    }
}
