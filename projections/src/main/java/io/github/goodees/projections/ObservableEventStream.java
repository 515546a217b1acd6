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

import io.github.goodees.projections.aggregation.AggregationStrategy;
import io.github.goodees.projections.broadcast.Broadcast;
import io.github.goodees.projections.broadcast.Broadcaster;
import io.github.goodees.projections.broadcast.Delivery;
import io.github.goodees.projections.broadcast.DerivedBroadcast;

import java.util.Objects;

/**
 * Event stream that can also be listened to. Owned by the application wiring, which hands the publishing side to the
 * domain model and the {@linkplain #stream() listening side} to projections.
 *
 * @param <T> type of the entity identifiers
 */
public class ObservableEventStream<T> extends EventStream<T> {
    private final Broadcast<Event<T>> view;

    /**
     * Create stream over new broadcaster.
     * @param delivery how events reach the listeners
     */
    public ObservableEventStream(Delivery delivery) {
        this(new Broadcaster<>("events", delivery));
    }

    /**
     * Create stream over existing broadcaster.
     * @param broadcaster broadcaster of the events
     */
    public ObservableEventStream(Broadcaster<Event<T>> broadcaster) {
        super(broadcaster);
        this.view = broadcaster::subscribe;
    }

    /**
     * @return read-only view of the events published to this stream
     */
    public Broadcast<Event<T>> stream() {
        return view;
    }

    /**
     * Derive a stream of aggregated events. Every event published to this stream is passed to the strategy, and the
     * aggregations it produces are published on the returned stream in order of the events that completed them.
     * <p>The strategy is fed only while the returned stream has listeners.</p>
     * @param strategy the aggregation strategy, should not be shared with other streams
     * @return stream of aggregated events
     */
    public Broadcast<Event<T>> aggregate(AggregationStrategy<T> strategy) {
        Objects.requireNonNull(strategy, "Aggregation strategy must be specified");
        String name = "aggregation of " + broadcaster.getName() + " by " + strategy;
        return new DerivedBroadcast<Event<T>, Event<T>>(name, view, strategy::tryToAggregateOn);
    }
}
