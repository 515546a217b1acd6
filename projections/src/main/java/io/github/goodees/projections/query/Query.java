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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * A query a {@link Projection} executes asynchronously.
 *
 * <p>This is a typical query you would send to a data source. The difference is that it is executed again every time
 * an event signals that the queried data might have changed.</p>
 *
 * <p>A result of {@code null} means there is nothing to report, and the projection does not notify its listeners.
 * Failing the returned stage is reserved for actual errors, which the projection passes on to its listeners.</p>
 *
 * @param <T> type of the entity identifiers in events
 * @param <D> type of the query result
 */
public interface Query<T, D> {

    /**
     * Execute the query when its projection starts. Does nothing by default.
     * @return stage completing with the result, or with null if there is nothing to report
     */
    default CompletionStage<D> execute() {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Execute the query when its projection receives a matching event. The event happening may or may not mean that
     * the queried data changed. Does nothing by default.
     * @param event the event that happened
     * @return stage completing with the result, or with null if there is nothing to report
     */
    default CompletionStage<D> executeOn(Event<T> event) {
        return CompletableFuture.completedFuture(null);
    }
}
