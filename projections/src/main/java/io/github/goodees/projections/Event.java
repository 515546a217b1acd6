package io.github.goodees.projections;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable fact, sent from the domain model to the outer world, that something has happened in it.
 *
 * <p>Since entities of the domain model gain and lose attributes frequently, events do not carry their attributes.
 * An event only references the entities related to it, by their role in the event, with an object that identifies
 * each of them. That may be an ID in applications with simple identities, or a specification describing the entity
 * in bigger ones.</p>
 *
 * <p>Subclasses may add typed accessors for the roles of a specific kind of event. Two events are equal when they are
 * of same class, have the same name, and reference the same entities.</p>
 *
 * @param <T> type of the entity identifiers
 */
public class Event<T> {
    private final String name;
    private final Map<String, T> entityToId;

    /**
     * Create an event.
     * @param name the name of the event, used for matching
     * @param entityToId all entities related to the event, keyed by their role. The map is copied.
     */
    public Event(String name, Map<String, ? extends T> entityToId) {
        this.name = Objects.requireNonNull(name, "Event name must be specified");
        this.entityToId = Collections.unmodifiableMap(
                new LinkedHashMap<>(Objects.requireNonNull(entityToId, "Entities must be specified")));
    }

    /**
     * Create an event named after a type description.
     * @param type event type description, converted by {@link EventNames#nameOf(Object)}
     * @param entityToId all entities related to the event, keyed by their role
     * @param <T> type of the entity identifiers
     * @return new event
     */
    public static <T> Event<T> of(Object type, Map<String, ? extends T> entityToId) {
        return new Event<>(EventNames.nameOf(type), entityToId);
    }

    public String getName() {
        return name;
    }

    /**
     * Get the identifier of the entity in given role.
     * @param entity the role of the entity in this event
     * @return the identifier, or null if no entity has that role
     */
    public T getIdOf(String entity) {
        return entityToId.get(entity);
    }

    /**
     * @return copy of the entities related to this event and their identifiers
     */
    public Map<String, T> toMap() {
        return new LinkedHashMap<>(entityToId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Event<?> other = (Event<?>) o;
        return name.equals(other.name) && entityToId.equals(other.entityToId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, entityToId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", entities=" + entityToId + "]";
    }
}
