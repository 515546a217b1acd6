package io.github.goodees.projections.aggregation;

/*-
 * #%L
 * projections
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renames entity roles when several events are folded into one. Two aggregated events may both reference a
 * {@code bread}, but one as the bread plastered with butter and the other as the bread with a sausage on it.
 * The mapping tells under which role each of them appears in the aggregation.
 *
 * <p>Roles without a rule keep their name.</p>
 */
public class EntityMapping {
    private final Map<String, Map<String, String>> eventToEntityMapping = new HashMap<>();

    /**
     * Map a role of an event type to another role. Replaces previous rule for the same pair.
     * @param eventType the name of the event
     * @param original the role in the event
     * @param target the role in the aggregation
     * @return this
     */
    public EntityMapping set(String eventType, String original, String target) {
        Objects.requireNonNull(eventType, "Event type must be specified");
        Objects.requireNonNull(original, "Original entity must be specified");
        Objects.requireNonNull(target, "Target entity must be specified");
        eventToEntityMapping.computeIfAbsent(eventType, t -> new HashMap<>()).put(original, target);
        return this;
    }

    /**
     * Get the role an entity of an event type appears under in the aggregation.
     * @param eventType the name of the event
     * @param original the role in the event
     * @return the mapped role, or {@code original} when there is no rule for it
     */
    public String get(String eventType, String original) {
        Map<String, String> entityMapping = eventToEntityMapping.get(eventType);
        if (entityMapping == null) {
            return original;
        }
        return entityMapping.getOrDefault(original, original);
    }

    @Override
    public String toString() {
        return "EntityMapping" + eventToEntityMapping;
    }
}
