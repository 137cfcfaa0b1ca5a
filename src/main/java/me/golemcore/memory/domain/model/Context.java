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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Hierarchical, taggable unit of stored knowledge. Structural mutators stamp
 * {@code updated} with the caller's instant only when they actually change
 * something; the importance score is never changed by them and is recomputed
 * on demand by {@code ContextImportanceService}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Context {

    private String id;

    @Builder.Default
    private ContextType type = ContextType.TASK;

    @Builder.Default
    private List<String> hierarchy = new ArrayList<>();

    private int importance;

    @Builder.Default
    private String content = "";

    @Builder.Default
    private ContextMetadata metadata = new ContextMetadata();

    @Builder.Default
    private ContextRelationships relationships = new ContextRelationships();

    private Instant created;
    private Instant updated;

    /**
     * Hierarchy segments joined root-to-leaf, e.g. {@code project/epic/task}.
     */
    @JsonIgnore
    public String getHierarchyPath() {
        return String.join("/", hierarchy);
    }

    @JsonIgnore
    public String getStorageKey() {
        return getHierarchyPath() + "/" + type.getCode() + "/" + id;
    }

    public boolean hasParent() {
        return relationships.getParent() != null;
    }

    public boolean hasChildren() {
        return !relationships.getChildren().isEmpty();
    }

    public boolean hasReferences() {
        return !relationships.getReferences().isEmpty();
    }

    public Context addChild(String childId, Instant now) {
        Objects.requireNonNull(childId, "childId");
        if (childId.equals(relationships.getParent()) || childId.equals(id)) {
            throw new ValidationException("context " + id + " cannot list its parent or itself as a child");
        }
        if (relationships.getChildren().add(childId)) {
            touch(now);
        }
        return this;
    }

    public Context removeChild(String childId, Instant now) {
        if (relationships.getChildren().remove(childId)) {
            touch(now);
        }
        return this;
    }

    public Context assignParent(String parentId, Instant now) {
        Objects.requireNonNull(parentId, "parentId");
        if (parentId.equals(id) || relationships.getChildren().contains(parentId)) {
            throw new ValidationException("context " + id + " cannot use a child or itself as parent");
        }
        relationships.setParent(parentId);
        touch(now);
        return this;
    }

    public Context removeParent(Instant now) {
        relationships.setParent(null);
        touch(now);
        return this;
    }

    public Context addReference(String referenceId, Instant now) {
        Objects.requireNonNull(referenceId, "referenceId");
        if (relationships.getReferences().add(referenceId)) {
            touch(now);
        }
        return this;
    }

    public Context removeReference(String referenceId, Instant now) {
        if (relationships.getReferences().remove(referenceId)) {
            touch(now);
        }
        return this;
    }

    public Context addTag(String tag, Instant now) {
        Objects.requireNonNull(tag, "tag");
        if (metadata.getTags().add(tag)) {
            touch(now);
        }
        return this;
    }

    public Context removeTag(String tag, Instant now) {
        if (metadata.getTags().remove(tag)) {
            touch(now);
        }
        return this;
    }

    /**
     * Applies a partial update. {@code id} and {@code created} are immutable; the
     * update timestamp is always refreshed. The whole update is checked before
     * any field changes, so a rejected update leaves the context untouched.
     */
    public Context update(ContextUpdate update, Instant now) {
        Objects.requireNonNull(update, "update");
        Objects.requireNonNull(now, "now");
        validateUpdate(update);

        if (update.getType() != null) {
            type = update.getType();
        }
        if (update.getHierarchy() != null) {
            hierarchy = new ArrayList<>(update.getHierarchy());
        }
        if (update.getImportance() != null) {
            importance = update.getImportance();
        }
        if (update.getContent() != null) {
            content = update.getContent();
        }
        if (update.getAgentId() != null) {
            metadata.setAgentId(update.getAgentId());
        }
        if (update.getTags() != null) {
            metadata.setTags(new LinkedHashSet<>(update.getTags()));
        }
        if (update.getDependencies() != null) {
            metadata.setDependencies(new ArrayList<>(update.getDependencies()));
        }
        if (update.getRetentionPolicy() != null) {
            metadata.setRetentionPolicy(update.getRetentionPolicy());
        }
        if (update.getChildren() != null) {
            relationships.setChildren(new LinkedHashSet<>(update.getChildren()));
        }
        if (update.getReferences() != null) {
            relationships.setReferences(new LinkedHashSet<>(update.getReferences()));
        }
        if (update.getParent() != null) {
            relationships.setParent(update.getParent());
        }
        touch(now);
        return this;
    }

    public boolean matches(ContextQuery query) {
        if (query == null) {
            return true;
        }
        if (query.getType() != null && query.getType() != type) {
            return false;
        }
        if (query.getTags() != null && !metadata.getTags().containsAll(query.getTags())) {
            return false;
        }
        if (query.getHierarchy() != null && !query.getHierarchy().isEmpty()) {
            List<String> prefix = query.getHierarchy();
            if (hierarchy.size() < prefix.size() || !hierarchy.subList(0, prefix.size()).equals(prefix)) {
                return false;
            }
        }
        if (query.getMinImportance() != null && importance < query.getMinImportance()) {
            return false;
        }
        if (query.getContentSearch() != null && !query.getContentSearch().isEmpty()) {
            String needle = query.getContentSearch().toLowerCase(Locale.ROOT);
            String haystack = content != null ? content.toLowerCase(Locale.ROOT) : "";
            return haystack.contains(needle);
        }
        return true;
    }

    /**
     * Short single-line description used in log statements.
     */
    @JsonIgnore
    public String getSummary() {
        String shortId = id != null && id.length() > 8 ? id.substring(0, 8) : String.valueOf(id);
        return String.format(Locale.ROOT,
                "Context[%s...] %s at %s (importance: %d, children: %d, refs: %d, tags: %d)",
                shortId, type.getCode(), getHierarchyPath(), importance,
                relationships.getChildren().size(),
                relationships.getReferences().size(),
                metadata.getTags().size());
    }

    private void validateUpdate(ContextUpdate update) {
        if (update.getImportance() != null
                && (update.getImportance() < 0 || update.getImportance() > 100)) {
            throw new ValidationException("importance must be a number between 0 and 100");
        }
        String parent = update.getParent() != null ? update.getParent() : relationships.getParent();
        Set<String> children = update.getChildren() != null ? update.getChildren() : relationships.getChildren();
        if (parent != null && parent.equals(id)) {
            throw new ValidationException("context " + id + " cannot use itself as parent");
        }
        if (parent != null && children.contains(parent)) {
            throw new ValidationException("context " + id + " cannot list its parent " + parent + " as a child");
        }
        if (id != null && children.contains(id)) {
            throw new ValidationException("context " + id + " cannot list itself as a child");
        }
    }

    private void touch(Instant now) {
        this.updated = Objects.requireNonNull(now, "now");
    }
}
