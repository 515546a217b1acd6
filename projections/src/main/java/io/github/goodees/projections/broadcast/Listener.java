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
 * Receiver of notifications of a {@link Broadcast}.
 *
 * <p>A listener receives values and errors in the order they were published, one at a time, until the broadcast
 * completes or the listener's {@link Subscription} is cancelled. Completion is delivered at most once and nothing
 * follows it.</p>
 *
 * @param <T> type of published values
 */
@FunctionalInterface
public interface Listener<T> {

    /**
     * A value was published.
     * @param value the value, never null
     */
    void onNext(T value);

    /**
     * An error was published. The broadcast continues afterwards.
     * @param error the published error
     */
    default void onError(Throwable error) {
    }

    /**
     * The broadcast was closed. No further notifications will follow.
     */
    default void onComplete() {
    }
}
