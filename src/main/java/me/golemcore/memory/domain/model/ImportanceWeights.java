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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Scoring factors for context importance. Every field has a default, so
 * {@code ImportanceWeights.builder().build()} reproduces the reference scores.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ImportanceWeights {

    private static final Map<ContextType, Integer> DEFAULT_TYPE_BONUSES = buildDefaultTypeBonuses();

    @Builder.Default
    private double hierarchyBonus = 5;

    @Builder.Default
    private double childrenBonus = 3;

    @Builder.Default
    private double referencesBonus = 2;

    @Builder.Default
    private double tagBonus = 1;

    /**
     * Points subtracted per day since the last update.
     */
    @Builder.Default
    private double ageDecay = 0.1;

    @Builder.Default
    private Map<ContextType, Integer> typeBonuses = DEFAULT_TYPE_BONUSES;

    public static ImportanceWeights defaults() {
        return ImportanceWeights.builder().build();
    }

    public int typeBonus(ContextType type) {
        if (type == null) {
            return 0;
        }
        Integer bonus = typeBonuses != null ? typeBonuses.get(type) : null;
        return bonus != null ? bonus : type.getImportanceBonus();
    }

    private static Map<ContextType, Integer> buildDefaultTypeBonuses() {
        Map<ContextType, Integer> bonuses = new EnumMap<>(ContextType.class);
        for (ContextType type : ContextType.values()) {
            bonuses.put(type, type.getImportanceBonus());
        }
        return Collections.unmodifiableMap(bonuses);
    }
}
