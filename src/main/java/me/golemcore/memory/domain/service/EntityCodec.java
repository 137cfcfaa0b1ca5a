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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.AgentMemory;
import me.golemcore.memory.domain.model.AgentRuntimeState;
import me.golemcore.memory.domain.model.Context;
import me.golemcore.memory.domain.model.DeserializationException;
import me.golemcore.memory.domain.model.ValidationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Canonical JSON form of contexts, agent memories and agent states.
 *
 * <p>
 * {@code serialize}/{@code deserialize*} round-trip every field. The
 * {@code *FromObject} factories validate an untyped payload first (see
 * {@link EntityValidator}) and fill in generated identifiers and timestamps
 * that are missing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public String serialize(Object entity) {
        Objects.requireNonNull(entity, "entity");
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + entity.getClass().getSimpleName(), e);
        }
    }

    public Map<String, Object> toObject(Object entity) {
        Objects.requireNonNull(entity, "entity");
        return objectMapper.convertValue(entity, MAP_TYPE_REF);
    }

    public Context deserializeContext(String json) {
        return deserialize(json, Context.class, "context");
    }

    public AgentMemory deserializeAgentMemory(String json) {
        return deserialize(json, AgentMemory.class, "agent memory");
    }

    public AgentRuntimeState deserializeAgentState(String json) {
        return deserialize(json, AgentRuntimeState.class, "agent state");
    }

    public Context contextFromObject(Map<String, Object> raw) {
        EntityValidator.requireValidContext(raw);
        Context context = convert(raw, Context.class, "context");
        Instant now = Instant.now(clock);
        if (context.getId() == null) {
            context.setId(newId());
        }
        if (context.getCreated() == null) {
            context.setCreated(now);
        }
        if (context.getUpdated() == null) {
            context.setUpdated(now);
        }
        return context;
    }

    public AgentRuntimeState agentStateFromObject(Map<String, Object> raw) {
        EntityValidator.requireValidAgentState(raw);
        AgentRuntimeState state = convert(raw, AgentRuntimeState.class, "agent state");
        Instant now = Instant.now(clock);
        if (state.getId() == null) {
            state.setId(newId());
        }
        if (state.getCreated() == null) {
            state.setCreated(now);
        }
        if (state.getUpdated() == null) {
            state.setUpdated(now);
        }
        if (!raw.containsKey("capabilities")) {
            state.setCapabilities(new LinkedHashSet<>(state.getType().getDefaultCapabilities()));
        }
        if (state.getMemoryUsage().getLastCleanup() == null) {
            state.getMemoryUsage().setLastCleanup(now);
        }
        return state;
    }

    public AgentMemory agentMemoryFromObject(Map<String, Object> raw) {
        EntityValidator.requireValidAgentMemory(raw);
        AgentMemory memory = convert(raw, AgentMemory.class, "agent memory");
        Instant now = Instant.now(clock);
        if (memory.getId() == null) {
            memory.setId(newId());
        }
        if (memory.getCreated() == null) {
            memory.setCreated(now);
        }
        if (memory.getUpdated() == null) {
            memory.setUpdated(now);
        }
        if (memory.getLastAccessed() == null) {
            memory.setLastAccessed(now);
        }
        return memory;
    }

    /**
     * Deep copy through the canonical form, so the copy shares no mutable state
     * with the source.
     */
    public <T> T deepCopy(T entity, Class<T> type) {
        Objects.requireNonNull(entity, "entity");
        return objectMapper.convertValue(entity, type);
    }

    String newId() {
        return UUID.randomUUID().toString();
    }

    private <T> T deserialize(String json, Class<T> type, String entityName) {
        if (json == null || json.isBlank()) {
            throw new DeserializationException(entityName, new IllegalArgumentException("payload is empty"));
        }
        try {
            T entity = objectMapper.readValue(json, type);
            if (entity == null) {
                throw new DeserializationException(entityName, new IllegalArgumentException("payload is null"));
            }
            return entity;
        } catch (JsonProcessingException e) {
            log.debug("[Codec] Failed to parse {}: {}", entityName, e.getOriginalMessage());
            throw new DeserializationException(entityName, e);
        }
    }

    private <T> T convert(Map<String, Object> raw, Class<T> type, String entityName) {
        try {
            return objectMapper.convertValue(new LinkedHashMap<>(raw), type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(entityName, List.of(String.valueOf(e.getMessage())));
        }
    }
}
