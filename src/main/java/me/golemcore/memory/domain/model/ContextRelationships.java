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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parent, child and cross-reference links of a {@link Context}. Children and
 * references keep insertion order and never hold duplicates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextRelationships {

    private String parent;

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> children = new LinkedHashSet<>();

    @Builder.Default
    @JsonDeserialize(as = LinkedHashSet.class)
    private Set<String> references = new LinkedHashSet<>();
}
