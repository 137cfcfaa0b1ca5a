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

import java.util.List;
import java.util.Set;

/**
 * Partial update applied by {@link Context#update(ContextUpdate)}. Null fields
 * leave the current value untouched; metadata and relationship fields are
 * merged one by one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextUpdate {

    private ContextType type;
    private List<String> hierarchy;
    private Integer importance;
    private String content;

    private String agentId;
    private Set<String> tags;
    private List<String> dependencies;
    private String retentionPolicy;

    private String parent;
    private Set<String> children;
    private Set<String> references;
}
