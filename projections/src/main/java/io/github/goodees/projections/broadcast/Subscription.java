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
 * Handle of a listener attached to a {@link Broadcast}.
 */
public interface Subscription {

    /**
     * Detach the listener. Notifications not yet delivered to it are dropped. Calling it repeatedly has no effect.
     */
    void cancel();

    /**
     * @return true when the listener no longer receives notifications, either because it was cancelled or because
     * the broadcast completed
     */
    boolean isCancelled();
}
