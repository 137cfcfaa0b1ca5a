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
import java.util.Optional;

/**
 * Lightweight knowledge graph: a list of reinforced concepts per domain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class KnowledgeGraph {

    @Builder.Default
    private Map<String, List<KnowledgeConcept>> concepts = new LinkedHashMap<>();

    public Optional<KnowledgeConcept> findConcept(String domain, String concept) {
        List<KnowledgeConcept> domainConcepts = concepts.get(domain);
        if (domainConcepts == null) {
            return Optional.empty();
        }
        return domainConcepts.stream()
                .filter(entry -> entry.getConcept() != null && entry.getConcept().equals(concept))
                .findFirst();
    }

    public List<KnowledgeConcept> domainConcepts(String domain) {
        return concepts.computeIfAbsent(domain, ignored -> new ArrayList<>());
    }
}
