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

import lombok.AccessLevel;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent-scoped memory record for one agent/user/session triple. Interactions
 * are kept in a {@link BoundedHistory} of {@value #MAX_INTERACTIONS} entries,
 * so the oldest interaction is evicted when a new one arrives on a full
 * history.
 *
 * <p>
 * The record is owned by a single writer at a time; concurrent callers are
 * expected to serialize access (see {@code AgentMemoryRegistry}).
 */
@Data
@NoArgsConstructor
public class AgentMemory {

    public static final int MAX_INTERACTIONS = 100;

    private String id;
    private String agentId;
    private String userId;
    private String sessionId;

    private Instant created;
    private Instant updated;
    private Instant lastAccessed;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private BoundedHistory<Interaction> history = new BoundedHistory<>(MAX_INTERACTIONS);

    private MemoryPatterns patterns = new MemoryPatterns();
    private Map<String, Map<String, KnowledgeEntry>> knowledge = new LinkedHashMap<>();
    private Map<String, String> preferences = new LinkedHashMap<>();
    private MemoryPerformance performance = new MemoryPerformance();
    private List<String> contextAssociations = new ArrayList<>();
    private KnowledgeGraph knowledgeGraph = new KnowledgeGraph();
    private LearningProfile learning = new LearningProfile();

    /**
     * Interactions oldest first. The returned list is a read-only snapshot.
     */
    public List<Interaction> getInteractions() {
        return history.snapshot();
    }

    public void setInteractions(List<Interaction> interactions) {
        history.replaceAll(interactions);
    }

    /**
     * Appends an interaction and returns the evicted one when the history was
     * full.
     */
    public Optional<Interaction> appendInteraction(Interaction interaction) {
        return history.append(interaction);
    }

    public Optional<Interaction> findInteraction(String interactionId) {
        if (interactionId == null) {
            return Optional.empty();
        }
        return history.find(interaction -> interactionId.equals(interaction.getId()));
    }

    public List<Interaction> latestInteractions(int count) {
        return history.latest(count);
    }

    public int interactionCount() {
        return history.size();
    }
}
