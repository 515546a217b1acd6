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

import io.github.goodees.projections.broadcast.Broadcast;
import io.github.goodees.projections.broadcast.Broadcaster;
import io.github.goodees.projections.broadcast.Listener;
import io.github.goodees.projections.broadcast.Subscription;

import java.util.Objects;

/**
 * Publish-only access to a {@link Broadcaster} of events.
 *
 * <p>This is what should be passed to domain model classes: it allows them to publish events and errors, but not to
 * listen, nor to close the underlying broadcaster.</p>
 *
 * @param <T> type of the entity identifiers
 */
public class EventStream<T> {
    protected final Broadcaster<Event<T>> broadcaster;

    /**
     * Create a sink publishing to the broadcaster.
     * @param broadcaster the broadcaster to publish to
     */
    public EventStream(Broadcaster<Event<T>> broadcaster) {
        this.broadcaster = Objects.requireNonNull(broadcaster, "Broadcaster must be specified");
    }

    /**
     * Publish an event to everyone currently listening.
     * @param event the event
     */
    public void publish(Event<T> event) {
        broadcaster.publish(Objects.requireNonNull(event, "Event must be specified"));
    }

    /**
     * Publish an error to everyone currently listening.
     * @param exception the error
     */
    public void error(Exception exception) {
        broadcaster.error(Objects.requireNonNull(exception, "Exception must be specified"));
    }

    /**
     * Republish everything that happens on another broadcast, e. g. events produced by
     * {@link ObservableEventStream#aggregate(io.github.goodees.projections.aggregation.AggregationStrategy)}.
     * Completion of the source is not propagated.
     * @param source the broadcast to republish
     * @return subscription to the source, cancel it to stop republishing
     */
    public Subscription publishAll(Broadcast<? extends Event<T>> source) {
        return source.subscribe(new Listener<Event<T>>() {
            @Override
            public void onNext(Event<T> event) {
                broadcaster.publish(event);
            }

            @Override
            public void onError(Throwable error) {
                broadcaster.error(error);
            }
        });
    }
}
