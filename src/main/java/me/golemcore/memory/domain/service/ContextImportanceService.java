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
import me.golemcore.memory.domain.model.Context;
import me.golemcore.memory.domain.model.ContextType;
import me.golemcore.memory.domain.model.ImportanceWeights;
import me.golemcore.memory.infrastructure.config.MemoryEngineProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the 0-100 importance score of a {@link Context} from its structure,
 * type and age.
 *
 * <p>
 * score = base + depth * hierarchyBonus + children * childrenBonus + references
 * * referencesBonus + tags * tagBonus + typeBonus - ageInDays * ageDecay,
 * rounded to the nearest integer and clamped to [0, 100].
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextImportanceService {

    static final double MILLIS_PER_DAY = 86_400_000d;
    private static final int MIN_SCORE = 0;
    private static final int MAX_SCORE = 100;

    private final MemoryEngineProperties properties;
    private final Clock clock;

    /**
     * Weights bound from {@code memory.importance.*}.
     */
    public ImportanceWeights defaultWeights() {
        MemoryEngineProperties.ImportanceProperties importance = properties.getImportance();
        Map<ContextType, Integer> typeBonuses = new EnumMap<>(ContextType.class);
        for (ContextType type : ContextType.values()) {
            typeBonuses.put(type, type.getImportanceBonus());
        }
        if (importance.getTypeBonuses() != null) {
            typeBonuses.putAll(importance.getTypeBonuses());
        }
        return ImportanceWeights.builder()
                .hierarchyBonus(importance.getHierarchyBonus())
                .childrenBonus(importance.getChildrenBonus())
                .referencesBonus(importance.getReferencesBonus())
                .tagBonus(importance.getTagBonus())
                .ageDecay(importance.getAgeDecay())
                .typeBonuses(typeBonuses)
                .build();
    }

    public int calculateImportance(Context context) {
        return calculateImportance(context, defaultWeights());
    }

    public int calculateImportance(Context context, ImportanceWeights weights) {
        Objects.requireNonNull(context, "context");
        ImportanceWeights effective = weights != null ? weights : ImportanceWeights.defaults();

        double score = context.getImportance();
        score += sizeOf(context.getHierarchy()) * effective.getHierarchyBonus();
        score += sizeOf(context.getRelationships().getChildren()) * effective.getChildrenBonus();
        score += sizeOf(context.getRelationships().getReferences()) * effective.getReferencesBonus();
        score += sizeOf(context.getMetadata().getTags()) * effective.getTagBonus();
        score -= ageInDays(context.getUpdated()) * effective.getAgeDecay();
        score += effective.typeBonus(context.getType());

        return clamp(Math.round(score));
    }

    /**
     * Stores the recomputed score on the context and stamps its update time.
     */
    public Context updateImportance(Context context) {
        return updateImportance(context, defaultWeights());
    }

    public Context updateImportance(Context context, ImportanceWeights weights) {
        int score = calculateImportance(context, weights);
        log.debug("[Importance] {} -> {}", context.getId(), score);
        context.setImportance(score);
        context.setUpdated(Instant.now(clock));
        return context;
    }

    double ageInDays(Instant updated) {
        if (updated == null) {
            return 0;
        }
        return Duration.between(updated, Instant.now(clock)).toMillis() / MILLIS_PER_DAY;
    }

    private int sizeOf(Collection<?> collection) {
        return collection != null ? collection.size() : 0;
    }

    private int clamp(long score) {
        if (score < MIN_SCORE) {
            return MIN_SCORE;
        }
        if (score > MAX_SCORE) {
            return MAX_SCORE;
        }
        return (int) score;
    }
}
