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
import io.github.goodees.projections.EventNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Aggregates events of a set of types, once every one of the types has occurred.
 *
 * <p>The strategy collects events of the expected types. When all the types are covered, the collected events are
 * {@linkplain AggregationStrategy#aggregate(Iterable, String, EntityMapping) folded} into one event, and the
 * collection starts from scratch. Coverage is tested by type, so an expected type occurring more than once before the
 * others does not block the aggregation. Of two different events of the same type, the one that occurred later wins
 * for the roles they share.</p>
 *
 * <p>With a timeout set, collected events are discarded once no expected event has occurred for longer than the
 * timeout. The check happens when the next event arrives, before that event is considered.</p>
 *
 * <p>Only handles occurrences that follow each other. Aggregations of the same types that overlap in time are not
 * told apart.</p>
 *
 * @param <T> type of the entity identifiers
 */
public class Sequential<T> implements AggregationStrategy<T> {
    private static final Logger logger = LoggerFactory.getLogger(Sequential.class);

    private final Set<String> expectedTypes;
    private final String aggregatedName;
    private final EntityMapping mapping;
    private final long timeoutMillis;
    private final Clock clock;

    private final Set<Event<T>> collectedEvents = new LinkedHashSet<>();
    private long lastMatchTimestamp;

    /**
     * Create strategy without timeout and entity mapping.
     * @param expectedTypes event name or names that must occur, see {@link EventNames#normalize(Object)}
     * @param aggregatedName name of the aggregated event, see {@link EventNames#nameOf(Object)}
     */
    public Sequential(Object expectedTypes, Object aggregatedName) {
        this(builder(expectedTypes, aggregatedName));
    }

    /**
     * Create strategy without timeout.
     * @param expectedTypes event name or names that must occur
     * @param aggregatedName name of the aggregated event
     * @param mapping renames of entity roles in aggregation
     */
    public Sequential(Object expectedTypes, Object aggregatedName, EntityMapping mapping) {
        this(builder(expectedTypes, aggregatedName).mapping(mapping));
    }

    /**
     * Create strategy.
     * @param expectedTypes event name or names that must occur
     * @param aggregatedName name of the aggregated event
     * @param mapping renames of entity roles in aggregation
     * @param timeout time after last expected event, after which collected events are discarded. 0 for never
     * @param unit unit of the timeout
     */
    public Sequential(Object expectedTypes, Object aggregatedName, EntityMapping mapping, long timeout,
            TimeUnit unit) {
        this(builder(expectedTypes, aggregatedName).mapping(mapping).timeout(timeout, unit));
    }

    private Sequential(Builder builder) {
        this.expectedTypes = builder.expectedTypes;
        this.aggregatedName = builder.aggregatedName;
        this.mapping = builder.mapping;
        this.timeoutMillis = builder.timeoutMillis;
        this.clock = builder.clock;
    }

    public static Builder builder(Object expectedTypes, Object aggregatedName) {
        return new Builder(expectedTypes, aggregatedName);
    }

    @Override
    public synchronized Optional<Event<T>> tryToAggregateOn(Event<T> event) {
        long now = clock.millis();
        if (timeoutMillis > 0 && now - lastMatchTimestamp > timeoutMillis && !collectedEvents.isEmpty()) {
            logger.debug("{} timed out, discarding {}", this, collectedEvents);
            collectedEvents.clear();
        }
        if (expectedTypes.contains(event.getName())) {
            // re-adding moves an equal event to the end, keeping iteration in order of occurrence
            collectedEvents.remove(event);
            collectedEvents.add(event);
            lastMatchTimestamp = now;
        }
        if (occurredTypes().containsAll(expectedTypes)) {
            Event<T> aggregation = aggregate(collectedEvents, aggregatedName, mapping);
            collectedEvents.clear();
            logger.debug("{} aggregated {}", this, aggregation);
            return Optional.of(aggregation);
        }
        return Optional.empty();
    }

    private Set<String> occurredTypes() {
        return collectedEvents.stream().map(Event::getName).collect(Collectors.toSet());
    }

    public Set<String> getExpectedTypes() {
        return expectedTypes;
    }

    public String getAggregatedName() {
        return aggregatedName;
    }

    @Override
    public String toString() {
        return "Sequential[" + expectedTypes + " -> " + aggregatedName + ", timeout=" + timeoutMillis + "ms]";
    }

    /**
     * Optional settings of {@link Sequential}.
     */
    public static class Builder {
        private final Set<String> expectedTypes;
        private final String aggregatedName;
        private EntityMapping mapping = new EntityMapping();
        private long timeoutMillis = 0;
        private Clock clock = Clock.systemUTC();

        private Builder(Object expectedTypes, Object aggregatedName) {
            this.expectedTypes = EventNames.normalize(expectedTypes);
            this.aggregatedName = EventNames.nameOf(aggregatedName);
        }

        /**
         * @param mapping renames of entity roles, no renames by default
         * @return this
         */
        public Builder mapping(EntityMapping mapping) {
            this.mapping = Objects.requireNonNull(mapping, "Entity mapping must be specified");
            return this;
        }

        /**
         * @param timeout time after last expected event, after which collected events are discarded. 0, the default,
         *                disables the timeout. Positive timeouts are rounded up to whole milliseconds
         * @param unit unit of timeout
         * @return this
         */
        public Builder timeout(long timeout, TimeUnit unit) {
            if (timeout < 0) {
                throw new IllegalArgumentException("Timeout must not be negative: " + timeout);
            }
            Objects.requireNonNull(unit, "Timeout unit must be specified");
            long millis = unit.toMillis(timeout);
            // both conversions saturate at Long.MAX_VALUE, so only a remainder below a millisecond rounds up
            if (unit.toNanos(timeout) > TimeUnit.MILLISECONDS.toNanos(millis)) {
                millis++;
            }
            this.timeoutMillis = millis;
            return this;
        }

        /**
         * @param clock source of current time, system clock by default
         * @return this
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "Clock must be specified");
            return this;
        }

        public <T> Sequential<T> build() {
            return new Sequential<>(this);
        }
    }
}
