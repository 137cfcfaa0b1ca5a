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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Known agent roles with their default capability sets.
 */
public enum AgentType {
    BACKEND_ARCHITECT("backend-architect", List.of(
            "api-design", "service-architecture", "database-design",
            "caching-strategies", "security-patterns", "scalability-planning")),
    BACKEND_DEVELOPER("backend-developer", List.of(
            "code-implementation", "unit-testing", "debugging",
            "refactoring", "performance-optimization", "documentation")),
    DATABASE_OPTIMIZER("database-optimizer", List.of(
            "schema-design", "index-optimization", "query-tuning",
            "migration-scripts", "constraint-management", "performance-analysis")),
    FILE_ANALYZER("file-analyzer", List.of(
            "file-summarization", "log-analysis", "content-extraction",
            "size-reduction", "pattern-detection")),
    CODE_ANALYZER("code-analyzer", List.of(
            "bug-detection", "code-review", "security-analysis",
            "complexity-analysis", "dependency-tracking")),
    TEST_RUNNER("test-runner", List.of(
            "test-execution", "result-analysis", "coverage-reporting",
            "performance-testing", "integration-testing")),
    PARALLEL_WORKER("parallel-worker", List.of(
            "workflow-coordination", "task-distribution", "progress-tracking",
            "conflict-resolution", "synchronization"));

    private final String code;
    private final List<String> defaultCapabilities;

    AgentType(String code, List<String> defaultCapabilities) {
        this.code = code;
        this.defaultCapabilities = defaultCapabilities;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public List<String> getDefaultCapabilities() {
        return defaultCapabilities;
    }

    public static Optional<AgentType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
