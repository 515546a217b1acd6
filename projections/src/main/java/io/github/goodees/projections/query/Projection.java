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

import io.github.goodees.projections.Event;
import io.github.goodees.projections.EventNames;
import io.github.goodees.projections.broadcast.Broadcast;
import io.github.goodees.projections.broadcast.Broadcaster;
import io.github.goodees.projections.broadcast.Delivery;
import io.github.goodees.projections.broadcast.Listener;
import io.github.goodees.projections.broadcast.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Projection of a stream of events onto the results of a {@link Query}.
 *
 * <p>A projection is a persistent query of data that keeps changing. You create it once, and it keeps notifying its
 * listeners about the queried data. It reacts to events with specific names: when such event arrives, the query is
 * {@linkplain Query#executeOn(Event) executed against it} and the result is published on the projection's
 * {@linkplain #stream() stream}. The query is also {@linkplain Query#execute() executed} once when the projection
 * starts.</p>
 *
 * <h2>Ordering</h2>
 * <p>Events are processed one at a time: the query for the next event is executed only after the result for the
 * previous one was published. The result of the initial execution may come before or after results of events that
 * arrive while it runs.</p>
 *
 * <h2>Errors</h2>
 * <p>Failures of the query, as well as errors arriving on the incoming stream, are published as errors on the
 * projection's stream. They do not stop the projection.</p>
 *
 * <h2>Lifecycle</h2>
 * <p>{@link #start(Broadcast)} subscribes to the incoming stream. Starting a running projection cancels the previous
 * subscription. {@link #stop()} cancels the subscription and completes the projection's stream; results of queries
 * still running at that time are discarded. A stopped projection cannot be started again.</p>
 *
 * @param <T> type of the entity identifiers in events
 * @param <D> type of the query result
 */
public class Projection<T, D> {
    private static final Logger logger = LoggerFactory.getLogger(Projection.class);

    private final Query<T, D> query;
    private final Set<String> eventNames;
    private final Broadcaster<D> outgoing;
    private final Broadcast<D> stream;
    private volatile Subscription subscription;
    private CompletableFuture<Void> lastExecution = CompletableFuture.completedFuture(null);

    /**
     * Create a projection with deferred delivery of results.
     * @param query the query to execute
     * @param eventNames name of the event, or iterable of names, that trigger the query.
     *                   See {@link EventNames#normalize(Object)}
     */
    public Projection(Query<T, D> query, Object eventNames) {
        this(query, eventNames, Delivery.deferred());
    }

    /**
     * Create a projection.
     * @param query the query to execute
     * @param eventNames name of the event, or iterable of names, that trigger the query
     * @param delivery how results reach the listeners of {@link #stream()}
     */
    public Projection(Query<T, D> query, Object eventNames, Delivery delivery) {
        this.query = Objects.requireNonNull(query, "Query must be specified");
        this.eventNames = EventNames.normalize(eventNames);
        this.outgoing = new Broadcaster<>("projection of " + this.eventNames, delivery);
        this.stream = outgoing::subscribe;
    }

    /**
     * @return true if this projection is subscribed to an incoming stream
     */
    public boolean isStarted() {
        return subscription != null;
    }

    public Set<String> getEventNames() {
        return eventNames;
    }

    /**
     * Stream of all query results and of failures that occurred in the query.
     * @return read-only stream of results
     */
    public Broadcast<D> stream() {
        return stream;
    }

    /**
     * Start listening to events on the stream and execute the query for the first time.
     * <p>The subscription is in place when this method returns.</p>
     * @param incoming the stream of events
     * @return stage completing once the result of the first execution, or its failure, was published
     * @throws IllegalStateException when the projection was stopped
     */
    public synchronized CompletableFuture<Void> start(Broadcast<Event<T>> incoming) {
        Objects.requireNonNull(incoming, "Incoming stream must be specified");
        if (outgoing.isClosed()) {
            throw new IllegalStateException("Projection of " + eventNames + " was stopped and cannot start again");
        }
        Subscription previous = subscription;
        if (previous != null) {
            logger.warn("Projection of {} started while running, cancelling its previous subscription", eventNames);
            previous.cancel();
        }
        subscription = incoming.subscribe(new IncomingEvents());
        logger.debug("Projection of {} started", eventNames);
        return publishResult(invoke(query::execute));
    }

    /**
     * Stop listening to events and complete the stream. Safe to call when not started, or repeatedly.
     * @return completed stage
     */
    public synchronized CompletableFuture<Void> stop() {
        Subscription current = subscription;
        if (current != null) {
            current.cancel();
            subscription = null;
            logger.debug("Projection of {} stopped", eventNames);
        }
        outgoing.close();
        return CompletableFuture.completedFuture(null);
    }

    private synchronized void process(Event<T> event) {
        lastExecution = lastExecution.thenCompose(previous -> publishResult(invoke(() -> query.executeOn(event))));
    }

    private synchronized void forwardError(Throwable error) {
        lastExecution = lastExecution.thenRun(() -> outgoing.error(error));
    }

    /**
     * Invoke the query, turning a synchronous failure into failed stage.
     */
    private CompletableFuture<D> invoke(Supplier<CompletionStage<D>> execution) {
        CompletableFuture<D> result = new CompletableFuture<>();
        try {
            Objects.requireNonNull(execution.get(), "Query returned null instead of a completion stage")
                    .whenComplete((data, t) -> {
                        if (t == null) {
                            result.complete(data);
                        } else {
                            result.completeExceptionally(t);
                        }
                    });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    private CompletableFuture<Void> publishResult(CompletableFuture<D> execution) {
        return execution.handle((data, t) -> {
            if (t != null) {
                Throwable cause = unwrapCompletionException(t);
                logger.debug("Query of projection {} failed", eventNames, cause);
                outgoing.error(cause);
            } else if (data != null) {
                outgoing.publish(data);
            }
            return null;
        });
    }

    static Throwable unwrapCompletionException(Throwable ex) {
        while (ex != null && ex.getCause() != null && ex instanceof CompletionException) {
            ex = ex.getCause();
        }
        return ex;
    }

    @Override
    public String toString() {
        return "Projection[events=" + eventNames + ", query=" + query + ", started=" + isStarted() + "]";
    }

    private class IncomingEvents implements Listener<Event<T>> {
        @Override
        public void onNext(Event<T> event) {
            if (eventNames.contains(event.getName())) {
                process(event);
            }
        }

        @Override
        public void onError(Throwable error) {
            forwardError(error);
        }

        @Override
        public void onComplete() {
            logger.debug("Incoming stream of projection {} completed", eventNames);
        }
    }
}
