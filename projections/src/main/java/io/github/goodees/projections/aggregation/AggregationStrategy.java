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

import io.github.goodees.projections.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rule folding several related events, occurring over time, into one synthetic event.
 * Implementations are usually stateful, and are fed the events one by one in order they happened.
 *
 * @param <T> type of the entity identifiers
 * @see Sequential
 */
@FunctionalInterface
public interface AggregationStrategy<T> {

    /**
     * Consider next event.
     * @param event the event that just happened
     * @return the aggregated event if this event completed an aggregation, empty otherwise
     */
    Optional<Event<T>> tryToAggregateOn(Event<T> event);

    /**
     * Fold events into one. Every entity of every event is put into the aggregation under the role given by the
     * mapping. When two events map an entity to the same role, the later one in iteration order wins.
     * @param events the events to fold
     * @param aggregatedName the name of the aggregated event
     * @param mapping renames of the entity roles
     * @return the aggregated event
     */
    default Event<T> aggregate(Iterable<? extends Event<T>> events, String aggregatedName, EntityMapping mapping) {
        Map<String, T> entityToId = new LinkedHashMap<>();
        for (Event<T> event : events) {
            for (Map.Entry<String, T> entity : event.toMap().entrySet()) {
                entityToId.put(mapping.get(event.getName(), entity.getKey()), entity.getValue());
            }
        }
        return new Event<>(aggregatedName, entityToId);
    }
}
