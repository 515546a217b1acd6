package io.github.goodees.projections.query;

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

import io.github.goodees.projections.ObservableEventStream;
import io.github.goodees.projections.broadcast.Delivery;

import java.util.Objects;

/**
 * Creates projections listening to one shared event stream.
 *
 * @param <T> type of the entity identifiers in events
 */
public class ProjectionFactory<T> {
    private final ObservableEventStream<T> eventStream;
    private final Delivery delivery;

    /**
     * Create factory of projections with deferred delivery of results.
     * @param eventStream the stream the projections will listen to
     */
    public ProjectionFactory(ObservableEventStream<T> eventStream) {
        this(eventStream, Delivery.deferred());
    }

    /**
     * Create factory of projections.
     * @param eventStream the stream the projections will listen to
     * @param delivery how results of created projections reach their listeners
     */
    public ProjectionFactory(ObservableEventStream<T> eventStream, Delivery delivery) {
        this.eventStream = Objects.requireNonNull(eventStream, "Event stream must be specified");
        this.delivery = Objects.requireNonNull(delivery, "Delivery must be specified");
    }

    /**
     * Create and start a projection. Does not wait for the first execution of the query, its result and failure are
     * published on the projection's stream.
     * @param query the query of the projection
     * @param eventNames name of the event, or iterable of names, that trigger the query
     * @param <D> type of the query result
     * @return started projection
     */
    public <D> Projection<T, D> create(Query<T, D> query, Object eventNames) {
        Projection<T, D> projection = new Projection<>(query, eventNames, delivery);
        projection.start(eventStream.stream());
        return projection;
    }
}
