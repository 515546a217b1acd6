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

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * How a {@link Broadcaster} hands notifications to its listeners. Chosen once, when the broadcaster is created.
 * <ul>
 *     <li>{@linkplain #immediate() Immediate} delivery invokes the listeners on the publishing thread, before
 *     {@code publish} returns.</li>
 *     <li>{@linkplain #deferred(Executor) Deferred} delivery passes the notifications to an executor. Every listener
 *     has its own mailbox, so it still receives them in publish order and never concurrently.</li>
 * </ul>
 */
public final class Delivery {
    private static final Delivery IMMEDIATE = new Delivery(null);

    private final Executor executor;

    private Delivery(Executor executor) {
        this.executor = executor;
    }

    /**
     * @return delivery within the publish call
     */
    public static Delivery immediate() {
        return IMMEDIATE;
    }

    /**
     * Deferred delivery on the {@linkplain ForkJoinPool#commonPool() common pool}.
     * @return delivery on later turn
     */
    public static Delivery deferred() {
        return deferred(ForkJoinPool.commonPool());
    }

    /**
     * Deferred delivery on given executor.
     * @param executor the executor listeners are invoked on
     * @return delivery on later turn
     */
    public static Delivery deferred(Executor executor) {
        return new Delivery(Objects.requireNonNull(executor, "Executor must be specified"));
    }

    public boolean isImmediate() {
        return executor == null;
    }

    Mailbox newMailbox(String name) {
        return isImmediate() ? null : new Mailbox(name, executor);
    }

    @Override
    public String toString() {
        return isImmediate() ? "Delivery[immediate]" : "Delivery[deferred, executor=" + executor + "]";
    }
}
