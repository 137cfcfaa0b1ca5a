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
import java.util.Optional;

/**
 * Kinds of hierarchical context units, each with its fixed importance bonus.
 */
public enum ContextType {
    PROJECT("project", 20), EPIC("epic", 15), TASK("task", 10), SESSION("session", 5), AGENT("agent", 8);

    private final String code;
    private final int importanceBonus;

    ContextType(String code, int importanceBonus) {
        this.code = code;
        this.importanceBonus = importanceBonus;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getImportanceBonus() {
        return importanceBonus;
    }

    public static Optional<ContextType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
