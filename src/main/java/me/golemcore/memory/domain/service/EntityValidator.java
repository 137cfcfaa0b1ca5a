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

import me.golemcore.memory.domain.model.AgentStatus;
import me.golemcore.memory.domain.model.AgentType;
import me.golemcore.memory.domain.model.ContextType;
import me.golemcore.memory.domain.model.LearningProfile;
import me.golemcore.memory.domain.model.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structural validation of untyped entity payloads before they are converted
 * into domain models.
 *
 * <p>
 * Contexts: {@code type} must be a known context type, {@code hierarchy} a
 * non-empty list of at most {@value #MAX_HIERARCHY_DEPTH} non-blank strings,
 * {@code importance} a number in [0, 100]; metadata and relationship
 * collections must be lists of strings and the parent may not be one of the
 * children.
 *
 * <p>
 * Agent states: known {@code type} and {@code status}, list
 * {@code capabilities}, {@code successRate} in [0, 1], non-negative
 * {@code avgCompletionTime}, {@code memorySizeMB} and {@code contextsActive}.
 */
public final class EntityValidator {

    static final int MAX_HIERARCHY_DEPTH = 5;

    private EntityValidator() {
    }

    public static void requireValidContext(Map<String, Object> raw) {
        List<String> errors = validateContext(raw);
        if (!errors.isEmpty()) {
            throw new ValidationException("context", errors);
        }
    }

    public static void requireValidAgentState(Map<String, Object> raw) {
        List<String> errors = validateAgentState(raw);
        if (!errors.isEmpty()) {
            throw new ValidationException("agent state", errors);
        }
    }

    public static void requireValidAgentMemory(Map<String, Object> raw) {
        List<String> errors = validateAgentMemory(raw);
        if (!errors.isEmpty()) {
            throw new ValidationException("agent memory", errors);
        }
    }

    public static List<String> validateContext(Map<String, Object> raw) {
        List<String> errors = new ArrayList<>();
        if (raw == null) {
            errors.add("context data is required");
            return errors;
        }

        Object id = raw.get("id");
        if (id != null && !(id instanceof String)) {
            errors.add("id must be a string");
        }

        Object type = raw.get("type");
        if (type != null && (!(type instanceof String code) || ContextType.fromCode(code).isEmpty())) {
            errors.add("type must be one of: " + codes(ContextType.values()));
        }

        Object hierarchy = raw.get("hierarchy");
        if (!(hierarchy instanceof List<?> levels)) {
            errors.add("hierarchy is required and must be an array");
        } else {
            if (levels.isEmpty()) {
                errors.add("hierarchy cannot be empty");
            }
            if (levels.stream().anyMatch(level -> !(level instanceof String s) || s.isBlank())) {
                errors.add("all hierarchy levels must be non-empty strings");
            }
            if (levels.size() > MAX_HIERARCHY_DEPTH) {
                errors.add("hierarchy cannot exceed " + MAX_HIERARCHY_DEPTH + " levels");
            }
        }

        Object importance = raw.get("importance");
        if (importance != null && !isNumberInRange(importance, 0, 100)) {
            errors.add("importance must be a number between 0 and 100");
        }

        Object content = raw.get("content");
        if (content != null && !(content instanceof String)) {
            errors.add("content must be a string");
        }

        Object metadata = raw.get("metadata");
        if (metadata != null) {
            if (!(metadata instanceof Map<?, ?> meta)) {
                errors.add("metadata must be an object if provided");
            } else {
                requireOptionalString(meta, "agentId", "metadata.agentId", errors);
                requireOptionalString(meta, "retentionPolicy", "metadata.retentionPolicy", errors);
                requireOptionalStringList(meta, "tags", "metadata.tags", errors);
                requireOptionalStringList(meta, "dependencies", "metadata.dependencies", errors);
            }
        }

        Object relationships = raw.get("relationships");
        if (relationships != null) {
            if (!(relationships instanceof Map<?, ?> rel)) {
                errors.add("relationships must be an object if provided");
            } else {
                requireOptionalString(rel, "parent", "relationships.parent", errors);
                requireOptionalStringList(rel, "children", "relationships.children", errors);
                requireOptionalStringList(rel, "references", "relationships.references", errors);
                Object parent = rel.get("parent");
                if (parent != null && rel.get("children") instanceof List<?> children && children.contains(parent)) {
                    errors.add("relationships.parent cannot also be a child");
                }
            }
        }
        return errors;
    }

    public static List<String> validateAgentState(Map<String, Object> raw) {
        List<String> errors = new ArrayList<>();
        if (raw == null) {
            errors.add("agent state data is required");
            return errors;
        }

        Object id = raw.get("id");
        if (id != null && !(id instanceof String)) {
            errors.add("id must be a string");
        }

        Object type = raw.get("type");
        if (type != null && (!(type instanceof String code) || AgentType.fromCode(code).isEmpty())) {
            errors.add("Invalid agent type: " + type);
        }

        Object status = raw.get("status");
        if (status != null && (!(status instanceof String code) || AgentStatus.fromCode(code).isEmpty())) {
            errors.add("Invalid agent status: " + status);
        }

        requireOptionalStringList(raw, "capabilities", "capabilities", errors);

        Object metrics = raw.get("performanceMetrics");
        if (metrics != null) {
            if (!(metrics instanceof Map<?, ?> perf)) {
                errors.add("performanceMetrics must be an object if provided");
            } else {
                Object successRate = perf.get("successRate");
                if (successRate != null && !isNumberInRange(successRate, 0, 1)) {
                    errors.add("successRate must be a number between 0 and 1");
                }
                Object avgCompletionTime = perf.get("avgCompletionTime");
                if (avgCompletionTime != null && !isNumberInRange(avgCompletionTime, 0, Double.MAX_VALUE)) {
                    errors.add("avgCompletionTime must be a non-negative number");
                }
            }
        }

        Object usage = raw.get("memoryUsage");
        if (usage != null) {
            if (!(usage instanceof Map<?, ?> mem)) {
                errors.add("memoryUsage must be an object if provided");
            } else {
                Object memorySize = mem.get("memorySizeMB");
                if (memorySize != null && !isNumberInRange(memorySize, 0, Double.MAX_VALUE)) {
                    errors.add("memorySizeMB must be a non-negative number");
                }
                Object contextsActive = mem.get("contextsActive");
                if (contextsActive != null && !isNumberInRange(contextsActive, 0, Double.MAX_VALUE)) {
                    errors.add("contextsActive must be a non-negative number");
                }
            }
        }
        return errors;
    }

    public static List<String> validateAgentMemory(Map<String, Object> raw) {
        List<String> errors = new ArrayList<>();
        if (raw == null) {
            errors.add("agent memory data is required");
            return errors;
        }

        Object agentId = raw.get("agentId");
        if (!(agentId instanceof String s) || s.isBlank()) {
            errors.add("agentId is required and must be a string");
        }
        requireOptionalString(raw, "userId", "userId", errors);
        requireOptionalString(raw, "sessionId", "sessionId", errors);

        Object interactions = raw.get("interactions");
        if (interactions != null) {
            if (!(interactions instanceof List<?> entries)) {
                errors.add("interactions must be an array");
            } else {
                for (Object entry : entries) {
                    if (!(entry instanceof Map<?, ?> interaction)) {
                        errors.add("interactions must contain objects");
                        break;
                    }
                    requireOptionalString(interaction, "prompt", "interactions.prompt", errors);
                    requireOptionalString(interaction, "response", "interactions.response", errors);
                    requireOptionalStringList(interaction, "tags", "interactions.tags", errors);
                }
            }
        }

        Object performance = raw.get("performance");
        if (performance instanceof Map<?, ?> perf) {
            Object successRate = perf.get("successRate");
            if (successRate != null && !isNumberInRange(successRate, 0, 1)) {
                errors.add("performance.successRate must be a number between 0 and 1");
            }
        } else if (performance != null) {
            errors.add("performance must be an object if provided");
        }

        Object learning = raw.get("learning");
        if (learning instanceof Map<?, ?> profile) {
            Object score = profile.get("adaptationScore");
            if (score != null && !isNumberInRange(score,
                    LearningProfile.MIN_ADAPTATION_SCORE, LearningProfile.MAX_ADAPTATION_SCORE)) {
                errors.add("learning.adaptationScore must be a number between "
                        + LearningProfile.MIN_ADAPTATION_SCORE + " and " + LearningProfile.MAX_ADAPTATION_SCORE);
            }
        } else if (learning != null) {
            errors.add("learning must be an object if provided");
        }
        return errors;
    }

    private static boolean isNumberInRange(Object value, double min, double max) {
        if (!(value instanceof Number number)) {
            return false;
        }
        double numeric = number.doubleValue();
        return !Double.isNaN(numeric) && numeric >= min && numeric <= max;
    }

    private static void requireOptionalString(Map<?, ?> source, String key, String label, List<String> errors) {
        Object value = source.get(key);
        if (value != null && !(value instanceof String)) {
            errors.add(label + " must be a string if provided");
        }
    }

    private static void requireOptionalStringList(Map<?, ?> source, String key, String label, List<String> errors) {
        Object value = source.get(key);
        if (value == null) {
            return;
        }
        if (!(value instanceof List<?> list) || list.stream().anyMatch(item -> !(item instanceof String))) {
            errors.add(label + " must be an array of strings if provided");
        }
    }

    private static String codes(ContextType[] types) {
        return Arrays.stream(types)
                .map(ContextType::getCode)
                .collect(Collectors.joining(", "));
    }
}
