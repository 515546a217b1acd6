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

import io.github.goodees.projections.broadcast.Broadcaster;
import io.github.goodees.projections.broadcast.RecordingListener;
import io.github.goodees.projections.broadcast.Subscription;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class EventStreamTest {
    private final Broadcaster<Event<String>> broadcaster = new Broadcaster<>("test");
    private final EventStream<String> eventStream = new EventStream<>(broadcaster);
    private final RecordingListener<Event<String>> listener = new RecordingListener<>();

    private final Event<String> first = new Event<>("first", Collections.singletonMap("user", "alice"));
    private final Event<String> second = new Event<>("second", Collections.singletonMap("user", "bob"));

    @Before
    public void listen() {
        broadcaster.subscribe(listener);
    }

    @Test
    public void published_events_reach_listeners() {
        eventStream.publish(first);
        eventStream.publish(second);

        assertThat(listener.values(), contains(first, second));
    }

    @Test
    public void errors_reach_listeners_in_order_with_events() {
        IllegalStateException error = new IllegalStateException("broken");

        eventStream.publish(first);
        eventStream.error(error);
        eventStream.publish(second);

        assertThat(listener.notifications(), contains((Object) first, error, second));
        assertFalse(listener.isCompleted());
    }

    @Test(expected = NullPointerException.class)
    public void null_event_is_rejected() {
        eventStream.publish(null);
    }

    @Test
    public void republishes_values_and_errors_of_another_broadcast() {
        Broadcaster<Event<String>> source = new Broadcaster<>("source");
        IllegalStateException error = new IllegalStateException("broken");
        eventStream.publishAll(source);

        source.publish(first);
        source.error(error);
        source.publish(second);

        assertThat(listener.notifications(), contains((Object) first, error, second));
    }

    @Test
    public void completion_of_republished_broadcast_does_not_complete_the_stream() {
        Broadcaster<Event<String>> source = new Broadcaster<>("source");
        eventStream.publishAll(source);

        source.close();
        eventStream.publish(first);

        assertEquals(0, listener.completions());
        assertThat(listener.values(), contains(first));
    }

    @Test
    public void cancelled_republishing_stops() {
        Broadcaster<Event<String>> source = new Broadcaster<>("source");
        Subscription subscription = eventStream.publishAll(source);

        subscription.cancel();
        source.publish(first);

        assertThat(listener.values(), empty());
    }
}
