package io.github.goodees.projections.broadcast;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Broadcast computed from another one. Every upstream value is passed to the transformation once, no matter how many
 * listeners are attached, and present results are republished in upstream order. A transformation that throws
 * publishes the exception as an error. Upstream errors and completion pass through.
 *
 * <p>The upstream is attached when the first listener subscribes and detached when the last one cancels.</p>
 *
 * @param <S> type of upstream values
 * @param <T> type of derived values
 */
public class DerivedBroadcast<S, T> implements Broadcast<T> {
    private static final Logger logger = LoggerFactory.getLogger(DerivedBroadcast.class);

    private final Broadcast<S> upstream;
    private final Function<? super S, ? extends Optional<? extends T>> transformation;
    private final Broadcaster<T> downstream;
    private Subscription upstreamSubscription;
    private int listeners;

    public DerivedBroadcast(String name, Broadcast<S> upstream,
                            Function<? super S, ? extends Optional<? extends T>> transformation) {
        this.upstream = Objects.requireNonNull(upstream, "Upstream must be specified");
        this.transformation = Objects.requireNonNull(transformation, "Transformation must be specified");
        this.downstream = new Broadcaster<>(name, Delivery.immediate());
    }

    @Override
    public synchronized Subscription subscribe(Listener<? super T> listener) {
        Subscription subscription = downstream.subscribe(listener);
        if (subscription.isCancelled()) {
            return subscription;
        }
        listeners++;
        if (upstreamSubscription == null) {
            logger.debug("Attaching {} to upstream", downstream.getName());
            upstreamSubscription = upstream.subscribe(new Relay());
        }
        return new Subscription() {
            @Override
            public void cancel() {
                release(subscription);
            }

            @Override
            public boolean isCancelled() {
                return subscription.isCancelled();
            }
        };
    }

    private synchronized void release(Subscription subscription) {
        if (subscription.isCancelled()) {
            return;
        }
        subscription.cancel();
        if (--listeners == 0 && upstreamSubscription != null) {
            logger.debug("Last listener of {} left, detaching from upstream", downstream.getName());
            upstreamSubscription.cancel();
            upstreamSubscription = null;
        }
    }

    private class Relay implements Listener<S> {
        @Override
        public void onNext(S value) {
            Optional<? extends T> result;
            try {
                result = transformation.apply(value);
            } catch (RuntimeException e) {
                downstream.error(e);
                return;
            }
            result.ifPresent(downstream::publish);
        }

        @Override
        public void onError(Throwable error) {
            downstream.error(error);
        }

        @Override
        public void onComplete() {
            downstream.close();
        }
    }
}
