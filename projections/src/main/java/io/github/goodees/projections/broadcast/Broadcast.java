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

/**
 * Read-only side of a multicast source. Every listener attached to it receives the same sequence of notifications,
 * independently of other listeners. There is no replay: a listener only sees what is published after it subscribed.
 *
 * @param <T> type of published values
 * @see Broadcaster the publishing side
 */
@FunctionalInterface
public interface Broadcast<T> {

    /**
     * Attach a listener. If the broadcast is already closed, the listener only receives
     * {@link Listener#onComplete()}.
     * @param listener the listener to notify
     * @return handle for detaching the listener
     */
    Subscription subscribe(Listener<? super T> listener);
}
