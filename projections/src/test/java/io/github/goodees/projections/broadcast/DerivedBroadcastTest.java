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

import org.junit.Before;
import org.junit.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class DerivedBroadcastTest {
    private Broadcaster<Integer> upstream;
    private AtomicInteger transformations;
    private DerivedBroadcast<Integer, String> evenNumbers;

    @Before
    public void setUp() {
        upstream = new Broadcaster<>("numbers");
        transformations = new AtomicInteger();
        evenNumbers = new DerivedBroadcast<Integer, String>("even numbers", upstream, n -> {
            transformations.incrementAndGet();
            if (n < 0) {
                throw new IllegalArgumentException("Negative number " + n);
            }
            return n % 2 == 0 ? Optional.of("even " + n) : Optional.<String>empty();
        });
    }

    @Test
    public void publishes_only_present_results_in_upstream_order() {
        RecordingListener<String> listener = new RecordingListener<>();
        evenNumbers.subscribe(listener);

        for (int i = 1; i <= 5; i++) {
            upstream.publish(i);
        }

        assertThat(listener.values(), contains("even 2", "even 4"));
    }

    @Test
    public void transformation_runs_once_per_value_regardless_of_listeners() {
        RecordingListener<String> first = new RecordingListener<>();
        RecordingListener<String> second = new RecordingListener<>();
        evenNumbers.subscribe(first);
        evenNumbers.subscribe(second);

        upstream.publish(2);
        upstream.publish(3);

        assertEquals(2, transformations.get());
        assertThat(first.values(), contains("even 2"));
        assertThat(second.values(), contains("even 2"));
    }

    @Test
    public void upstream_is_attached_only_while_there_are_listeners() {
        assertFalse(upstream.hasListeners());
        Subscription first = evenNumbers.subscribe(new RecordingListener<>());
        Subscription second = evenNumbers.subscribe(new RecordingListener<>());
        assertTrue(upstream.hasListeners());

        first.cancel();
        first.cancel();
        assertTrue(upstream.hasListeners());
        second.cancel();
        assertFalse(upstream.hasListeners());

        upstream.publish(2);
        assertEquals(0, transformations.get());
    }

    @Test
    public void failing_transformation_is_published_as_error() {
        RecordingListener<String> listener = new RecordingListener<>();
        evenNumbers.subscribe(listener);

        upstream.publish(-1);
        upstream.publish(2);

        assertEquals(1, listener.errors().size());
        assertThat(listener.errors().get(0), instanceOf(IllegalArgumentException.class));
        assertThat(listener.values(), contains("even 2"));
    }

    @Test
    public void upstream_errors_and_completion_pass_through() {
        RecordingListener<String> listener = new RecordingListener<>();
        Subscription subscription = evenNumbers.subscribe(listener);
        IllegalStateException error = new IllegalStateException("upstream failed");

        upstream.error(error);
        upstream.close();

        assertThat(listener.errors(), contains((Throwable) error));
        assertEquals(1, listener.completions());
        assertTrue(subscription.isCancelled());
    }
}
