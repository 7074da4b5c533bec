package dev.mars.eventline.api.domain;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The fields that differ between two snapshots of the same entity, mapped to their new values.
 */
public final class ChangeSet {

    private static final ChangeSet EMPTY = new ChangeSet(Map.of());

    private final Map<String, Object> changes;

    private ChangeSet(Map<String, Object> changes) {
        this.changes = changes;
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public static ChangeSet between(StateSnapshot before, StateSnapshot after) {
        Objects.requireNonNull(after, "after cannot be null");
        Map<String, Object> previous = before == null ? Map.of() : before.fields();
        Map<String, Object> changed = new LinkedHashMap<>();
        after.fields().forEach((field, value) -> {
            if (!previous.containsKey(field) || !Objects.equals(previous.get(field), value)) {
                changed.put(field, value);
            }
        });
        return changed.isEmpty() ? EMPTY : new ChangeSet(Collections.unmodifiableMap(changed));
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public boolean contains(String field) {
        return changes.containsKey(field);
    }

    public Object get(String field) {
        return changes.get(field);
    }

    public Set<String> fields() {
        return changes.keySet();
    }

    public Map<String, Object> asMap() {
        return changes;
    }

    @Override
    public String toString() {
        return "ChangeSet" + changes;
    }
}
