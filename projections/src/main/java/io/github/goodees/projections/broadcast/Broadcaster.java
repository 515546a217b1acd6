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

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Publishing side of a multicast source. Fans every published value or error out to all currently attached
 * listeners. Listeners attaching later do not see earlier notifications.
 *
 * <p>Once {@linkplain #close() closed}, every listener receives {@link Listener#onComplete()} after the
 * notifications published before closing, and is detached. Anything published afterwards is dropped.</p>
 *
 * <p>An exception thrown by a listener is logged and does not affect other listeners, nor the publisher.</p>
 *
 * @param <T> type of published values
 */
public class Broadcaster<T> implements Broadcast<T> {
    private static final Logger logger = LoggerFactory.getLogger(Broadcaster.class);

    private final String name;
    private final Delivery delivery;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Create broadcaster delivering immediately.
     * @param name name used in log messages
     */
    public Broadcaster(String name) {
        this(name, Delivery.immediate());
    }

    /**
     * Create broadcaster.
     * @param name name used in log messages
     * @param delivery how notifications reach the listeners
     */
    public Broadcaster(String name, Delivery delivery) {
        this.name = Objects.requireNonNull(name, "Name must be specified");
        this.delivery = Objects.requireNonNull(delivery, "Delivery must be specified");
    }

    @Override
    public Subscription subscribe(Listener<? super T> listener) {
        Registration registration = new Registration(Objects.requireNonNull(listener, "Listener must be specified"));
        registrations.add(registration);
        if (closed.get()) {
            // closed while or before we registered, close() might have missed us
            registrations.remove(registration);
            registration.complete();
        } else {
            logger.debug("Listener {} subscribed to {}", listener, name);
        }
        return registration;
    }

    /**
     * Publish a value to all attached listeners.
     * @param value the value to publish
     */
    public void publish(T value) {
        Objects.requireNonNull(value, "Published value must not be null");
        if (isClosed()) {
            logger.debug("{} is closed, dropping {}", name, value);
            return;
        }
        notifyAll(l -> l.onNext(value));
    }

    /**
     * Publish an error to all attached listeners. The broadcast stays open.
     * @param error the error to publish
     */
    public void error(Throwable error) {
        Objects.requireNonNull(error, "Published error must not be null");
        if (isClosed()) {
            logger.debug("{} is closed, dropping error", name, error);
            return;
        }
        notifyAll(l -> l.onError(error));
    }

    /**
     * Complete all listeners and refuse further notifications. Calling it repeatedly has no effect.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            logger.debug("Closing {}, completing {} listeners", name, registrations.size());
            for (Registration registration : registrations) {
                registration.complete();
            }
            registrations.clear();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean hasListeners() {
        return !registrations.isEmpty();
    }

    public String getName() {
        return name;
    }

    private void notifyAll(Consumer<Listener<? super T>> notification) {
        for (Registration registration : registrations) {
            registration.deliver(notification);
        }
    }

    @Override
    public String toString() {
        return "Broadcaster[name=" + name + ", delivery=" + delivery + ", listeners=" + registrations.size()
                + ", closed=" + closed + "]";
    }

    /**
     * Single attached listener, its mailbox when delivery is deferred, and its subscription state.
     */
    private class Registration implements Subscription {
        private final Listener<? super T> listener;
        private final Mailbox mailbox;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        Registration(Listener<? super T> listener) {
            this.listener = listener;
            this.mailbox = delivery.newMailbox(name);
        }

        void deliver(Consumer<Listener<? super T>> notification) {
            run(() -> {
                if (!cancelled.get()) {
                    invoke(notification);
                }
            });
        }

        void complete() {
            run(() -> {
                if (cancelled.compareAndSet(false, true)) {
                    invoke(Listener::onComplete);
                }
            });
        }

        private void run(Runnable action) {
            if (mailbox == null) {
                action.run();
            } else {
                mailbox.enqueue(action);
            }
        }

        private void invoke(Consumer<Listener<? super T>> notification) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} of {} failed to handle notification", listener, name, e);
            }
        }

        @Override
        public void cancel() {
            if (cancelled.compareAndSet(false, true)) {
                registrations.remove(this);
                logger.debug("Listener {} unsubscribed from {}", listener, name);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
