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

import io.github.goodees.projections.aggregation.AggregationStrategy;
import io.github.goodees.projections.aggregation.EntityMapping;
import io.github.goodees.projections.aggregation.MutableClock;
import io.github.goodees.projections.aggregation.Sequential;
import io.github.goodees.projections.broadcast.Broadcast;
import io.github.goodees.projections.broadcast.Delivery;
import io.github.goodees.projections.broadcast.RecordingListener;
import io.github.goodees.projections.broadcast.Subscription;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;

public class ObservableEventStreamTest {
    private static final int BREAD1 = 1, BUTTER1 = 2, SAUSAGE1 = 3, BREAD2 = 4, BUTTER2 = 5, SAUSAGE2 = 6;
    private static final String BREAD_IS_PLASTERED_WITH_BUTTER = "bread is plastered with butter";
    private static final String SAUSAGE_IS_PLACED_ON_BREAD = "sausage is placed on bread";
    private static final String SANDWICH_IS_READY = "sandwich is ready";
    private static final List<String> SANDWICH_STEPS = Arrays.asList(BREAD_IS_PLASTERED_WITH_BUTTER,
            SAUSAGE_IS_PLACED_ON_BREAD);

    private final List<Event<Integer>> events = Arrays.asList(
            event(BREAD_IS_PLASTERED_WITH_BUTTER, "bread", BREAD1, "butter", BUTTER1),
            event(SAUSAGE_IS_PLACED_ON_BREAD, "bread", BREAD1, "sausage", SAUSAGE1),
            new Event<>("some random event", Collections.<String, Integer>emptyMap()),
            event(BREAD_IS_PLASTERED_WITH_BUTTER, "bread", BREAD2, "butter", BUTTER2),
            new Event<>("some random event", Collections.<String, Integer>emptyMap()),
            event(SAUSAGE_IS_PLACED_ON_BREAD, "bread", BREAD2, "sausage", SAUSAGE2));

    private final Event<Integer> firstSandwich = sandwich(BREAD1, BUTTER1, SAUSAGE1);
    private final Event<Integer> secondSandwich = sandwich(BREAD2, BUTTER2, SAUSAGE2);

    private final EntityMapping mapping = new EntityMapping();
    private final MutableClock clock = new MutableClock(Instant.parse("2017-11-13T20:18:40Z"));
    private final ObservableEventStream<Integer> eventStream = new ObservableEventStream<>(Delivery.immediate());
    private final RecordingListener<Event<Integer>> listener = new RecordingListener<>();

    private static Event<Integer> event(String name, String role1, int id1, String role2, int id2) {
        Map<String, Integer> entityToId = new LinkedHashMap<>();
        entityToId.put(role1, id1);
        entityToId.put(role2, id2);
        return new Event<>(name, entityToId);
    }

    private static Event<Integer> sandwich(int bread, int butter, int sausage) {
        Map<String, Integer> entityToId = new LinkedHashMap<>();
        entityToId.put("breadWithSausage", bread);
        entityToId.put("breadPlasteredWithButter", bread);
        entityToId.put("butter", butter);
        entityToId.put("sausage", sausage);
        return new Event<>(SANDWICH_IS_READY, entityToId);
    }

    @Before
    public void setUpMapping() {
        mapping.set(BREAD_IS_PLASTERED_WITH_BUTTER, "bread", "breadPlasteredWithButter");
        mapping.set(SAUSAGE_IS_PLACED_ON_BREAD, "bread", "breadWithSausage");
    }

    private void publishAll() {
        events.forEach(eventStream::publish);
    }

    @Test
    public void stream_delivers_published_events() {
        eventStream.stream().subscribe(listener);

        publishAll();

        assertEquals(events, listener.values());
    }

    @Test
    public void aggregates_multiple_events_into_one_sequentially() {
        eventStream.aggregate(new Sequential<>(SANDWICH_STEPS, SANDWICH_IS_READY, mapping)).subscribe(listener);

        publishAll();

        assertThat(listener.values(), contains(firstSandwich, secondSandwich));
    }

    @Test
    public void aggregates_sequentially_keeping_track_of_timeout() {
        Sequential<Integer> strategy = Sequential.builder(SANDWICH_STEPS, SANDWICH_IS_READY)
                .mapping(mapping)
                .timeout(500, TimeUnit.MILLISECONDS)
                .clock(clock)
                .build();
        eventStream.aggregate(strategy).subscribe(listener);

        publishAll();

        assertThat(listener.values(), contains(firstSandwich, secondSandwich));
    }

    @Test
    public void aggregates_multiple_events_without_explicit_mapping() {
        Map<String, Integer> first = new LinkedHashMap<>();
        first.put("bread", BREAD1);
        first.put("butter", BUTTER1);
        first.put("sausage", SAUSAGE1);
        Map<String, Integer> second = new LinkedHashMap<>();
        second.put("bread", BREAD2);
        second.put("butter", BUTTER2);
        second.put("sausage", SAUSAGE2);

        eventStream.aggregate(new Sequential<>(SANDWICH_STEPS, SANDWICH_IS_READY)).subscribe(listener);
        publishAll();

        assertThat(listener.values(), contains(new Event<>(SANDWICH_IS_READY, first),
                new Event<>(SANDWICH_IS_READY, second)));
    }

    @Test
    public void first_portion_times_out_but_second_portion_is_aggregated() {
        Sequential<Integer> strategy = Sequential.builder(SANDWICH_STEPS, SANDWICH_IS_READY)
                .mapping(mapping)
                .timeout(500, TimeUnit.MILLISECONDS)
                .clock(clock)
                .build();
        eventStream.aggregate(strategy).subscribe(listener);

        for (int i = 0; i < events.size(); i++) {
            if (i == 1) {
                // sausage never makes it on the first bread
                clock.advance(Duration.ofMillis(600));
                continue;
            }
            eventStream.publish(events.get(i));
        }

        assertThat(listener.values(), contains(secondSandwich));
    }

    @Test
    public void errors_pass_through_aggregation() {
        IllegalStateException error = new IllegalStateException("kitchen on fire");
        eventStream.aggregate(new Sequential<>(SANDWICH_STEPS, SANDWICH_IS_READY, mapping)).subscribe(listener);

        eventStream.publish(events.get(0));
        eventStream.error(error);
        eventStream.publish(events.get(1));

        assertThat(listener.notifications(), contains((Object) error, firstSandwich));
    }

    @Test
    public void strategy_sees_each_event_once_regardless_of_listener_count() {
        AtomicInteger invocations = new AtomicInteger();
        AggregationStrategy<Integer> counting = event -> {
            invocations.incrementAndGet();
            return Optional.empty();
        };
        Broadcast<Event<Integer>> aggregated = eventStream.aggregate(counting);
        aggregated.subscribe(listener);
        aggregated.subscribe(new RecordingListener<>());

        publishAll();

        assertEquals(events.size(), invocations.get());
    }

    @Test
    public void strategy_is_not_fed_without_listeners() {
        AtomicInteger invocations = new AtomicInteger();
        AggregationStrategy<Integer> counting = event -> {
            invocations.incrementAndGet();
            return Optional.empty();
        };
        Subscription subscription = eventStream.aggregate(counting).subscribe(listener);
        eventStream.publish(events.get(0));

        subscription.cancel();
        publishAll();

        assertEquals(1, invocations.get());
        assertThat(listener.values(), empty());
    }

    @Test
    public void aggregations_can_be_republished_to_the_stream() {
        eventStream.publishAll(eventStream.aggregate(new Sequential<>(SANDWICH_STEPS, SANDWICH_IS_READY, mapping)));
        eventStream.stream().subscribe(listener);

        publishAll();

        List<Event<Integer>> sandwiches = listener.values().stream()
                .filter(e -> SANDWICH_IS_READY.equals(e.getName()))
                .collect(Collectors.toList());
        assertThat(sandwiches, contains(firstSandwich, secondSandwich));
        assertEquals(events.size() + 2, listener.values().size());
    }
}
