/**
 * Small library of observable queries over in-process event streams.
 *
 * <h2>Events</h2>
 * <p>The domain model tells the outer world that something happened by publishing an
 * {@link io.github.goodees.projections.Event} into an {@link io.github.goodees.projections.EventStream}. An event has a
 * name, and references the entities it relates to by their role, with an object identifying each of them. It does
 * not carry any attributes of the entities.</p>
 * <p>The application wiring owns an {@link io.github.goodees.projections.ObservableEventStream}. The domain model only
 * gets its publishing side, everybody else listens to its {@linkplain io.github.goodees.projections.ObservableEventStream#stream() stream}.
 * Streams are {@linkplain io.github.goodees.projections.broadcast.Broadcast broadcasts}: every listener sees the same
 * events, and nobody sees events published before it started listening. Nothing is persisted or sent outside the
 * JVM.</p>
 *
 * <h2>Projections</h2>
 * <p>A {@link io.github.goodees.projections.query.Projection} is a query that keeps answering. It binds a
 * {@link io.github.goodees.projections.query.Query} to event names, executes the query when it starts and every time
 * a matching event happens, and publishes the results on its own stream. The
 * {@link io.github.goodees.projections.query.ProjectionFactory} creates projections already started against a
 * shared stream.</p>
 *
 * <h2>Aggregations</h2>
 * <p>Several events happening over time may together mean one thing: the bread was plastered with butter, then a
 * sausage was placed on it, so a sandwich is ready.
 * {@link io.github.goodees.projections.ObservableEventStream#aggregate(io.github.goodees.projections.aggregation.AggregationStrategy)}
 * derives a stream of such synthetic events by an {@link io.github.goodees.projections.aggregation.AggregationStrategy}.
 * The derived stream can be {@linkplain io.github.goodees.projections.EventStream#publishAll(io.github.goodees.projections.broadcast.Broadcast)
 * republished} into an event stream and projected like any other.</p>
 *
 * @see io.github.goodees.projections.query.Projection
 * @see io.github.goodees.projections.aggregation.Sequential
 * @see io.github.goodees.projections.broadcast.Broadcaster
 */
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
