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
import me.golemcore.memory.domain.model.ContextMetadata;
import me.golemcore.memory.domain.model.ContextType;
import me.golemcore.memory.domain.model.ContextUpdate;
import me.golemcore.memory.domain.model.ValidationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Creates, mutates and copies {@link Context} records. Every change is stamped
 * with the injected clock so that importance aging stays consistent with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContextService {

    private final EntityCodec entityCodec;
    private final Clock clock;

    public Context createContext(ContextType type, List<String> hierarchy, String content) {
        return createContext(type, hierarchy, content, ignored -> {
        });
    }

    /**
     * Builds a new context and validates it after {@code customizer} ran.
     *
     * @throws ValidationException
     *             when the resulting context breaks a structural rule
     */
    public Context createContext(ContextType type, List<String> hierarchy, String content,
            Consumer<Context> customizer) {
        Instant now = Instant.now(clock);
        Context context = Context.builder()
                .id(entityCodec.newId())
                .type(type != null ? type : ContextType.TASK)
                .hierarchy(hierarchy != null ? new ArrayList<>(hierarchy) : new ArrayList<>())
                .content(content != null ? content : "")
                .metadata(new ContextMetadata())
                .created(now)
                .updated(now)
                .build();
        customizer.accept(context);
        EntityValidator.requireValidContext(entityCodec.toObject(context));
        log.debug("[Context] created {} at {}", context.getId(), context.getHierarchyPath());
        return context;
    }

    public Context addChild(Context context, String childId) {
        return context.addChild(childId, Instant.now(clock));
    }

    public Context removeChild(Context context, String childId) {
        return context.removeChild(childId, Instant.now(clock));
    }

    public Context assignParent(Context context, String parentId) {
        return context.assignParent(parentId, Instant.now(clock));
    }

    public Context removeParent(Context context) {
        return context.removeParent(Instant.now(clock));
    }

    public Context addReference(Context context, String referenceId) {
        return context.addReference(referenceId, Instant.now(clock));
    }

    public Context removeReference(Context context, String referenceId) {
        return context.removeReference(referenceId, Instant.now(clock));
    }

    public Context addTag(Context context, String tag) {
        return context.addTag(tag, Instant.now(clock));
    }

    public Context removeTag(Context context, String tag) {
        return context.removeTag(tag, Instant.now(clock));
    }

    /**
     * Applies a partial update stamped with the service clock.
     *
     * @throws ValidationException
     *             when the update would break a structural rule; the context is
     *             left unchanged
     */
    public Context updateContext(Context context, ContextUpdate update) {
        Context updated = context.update(update, Instant.now(clock));
        log.debug("[Context] updated {}", context.getId());
        return updated;
    }

    public Context cloneContext(Context source) {
        return cloneContext(source, copy -> {
        });
    }

    /**
     * Deep copy with a fresh id and timestamps; {@code overrides} runs last.
     */
    public Context cloneContext(Context source, Consumer<Context> overrides) {
        Objects.requireNonNull(source, "source");
        Context copy = entityCodec.deepCopy(source, Context.class);
        Instant now = Instant.now(clock);
        copy.setId(entityCodec.newId());
        copy.setCreated(now);
        copy.setUpdated(now);
        overrides.accept(copy);
        return copy;
    }
}
