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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fixed-capacity, insertion-ordered history. Appending to a full history evicts
 * the oldest entry, so the size never exceeds the capacity.
 *
 * @param <T>
 *            entry type
 */
public final class BoundedHistory<T> implements Iterable<T> {

    private final int capacity;
    private final ArrayDeque<T> entries;

    public BoundedHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an entry and returns the evicted one, if the history was full.
     */
    public Optional<T> append(T entry) {
        Objects.requireNonNull(entry, "entry");
        T evicted = null;
        if (entries.size() == capacity) {
            evicted = entries.pollFirst();
        }
        entries.addLast(entry);
        return Optional.ofNullable(evicted);
    }

    /**
     * Replaces the content, keeping only the newest {@code capacity} entries of
     * the given sequence.
     */
    public void replaceAll(Collection<? extends T> newEntries) {
        entries.clear();
        if (newEntries == null) {
            return;
        }
        for (T entry : newEntries) {
            append(entry);
        }
    }

    public Optional<T> find(Predicate<? super T> predicate) {
        for (T entry : entries) {
            if (predicate.test(entry)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Newest {@code count} entries, oldest first.
     */
    public List<T> latest(int count) {
        List<T> all = snapshot();
        int from = Math.max(0, all.size() - Math.max(0, count));
        return all.subList(from, all.size());
    }

    public List<T> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public Iterator<T> iterator() {
        return snapshot().iterator();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof BoundedHistory<?> that)) {
            return false;
        }
        return capacity == that.capacity && snapshot().equals(that.snapshot());
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, snapshot());
    }

    @Override
    public String toString() {
        return "BoundedHistory(capacity=" + capacity + ", size=" + entries.size() + ")";
    }
}
