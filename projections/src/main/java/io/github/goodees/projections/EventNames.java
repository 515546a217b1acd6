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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Conversion of event type descriptions to the event names events are matched by.
 *
 * <p>A description is either a single value, or an {@link Iterable} or array of values. Single values convert as
 * follows:</p>
 * <ul>
 *     <li>a {@link String} is the name itself,</li>
 *     <li>a {@link Class} becomes its simple name, stripped from suffix Event. {@code UserSentMessageEvent.class}
 *     becomes {@code UserSentMessage},</li>
 *     <li>an {@link Enum} constant becomes its {@linkplain Enum#name() name},</li>
 *     <li>anything else becomes its {@code toString()}.</li>
 * </ul>
 *
 * <p>Names are compared as plain strings. The suffix is stripped from classes only, so {@code FooEvent.class}
 * matches events named {@code "Foo"}, and is a different key than the string {@code "FooEvent"}.</p>
 */
public final class EventNames {
    private EventNames() {

    }

    /**
     * Convert single event type description to an event name.
     * @param type the description
     * @return the event name
     */
    public static String nameOf(Object type) {
        Objects.requireNonNull(type, "Event type must be specified");
        if (type instanceof String) {
            return (String) type;
        } else if (type instanceof Class) {
            return defaultTypeName((Class<?>) type);
        } else if (type instanceof Enum) {
            return ((Enum<?>) type).name();
        } else {
            return type.toString();
        }
    }

    /**
     * Convert single description, iterable or array of descriptions to set of event names.
     * @param types the description(s)
     * @return unmodifiable, non-empty set of names in order of appearance
     * @throws IllegalArgumentException when no name is described
     */
    public static Set<String> normalize(Object types) {
        Objects.requireNonNull(types, "Event types must be specified");
        Set<String> names = new LinkedHashSet<>();
        if (types instanceof Iterable) {
            for (Object type : (Iterable<?>) types) {
                names.add(nameOf(type));
            }
        } else if (types instanceof Object[]) {
            for (Object type : (Object[]) types) {
                names.add(nameOf(type));
            }
        } else {
            names.add(nameOf(types));
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("At least one event name must be specified");
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Default name of event class. Strips suffix Event.
     * @param clazz the event class
     * @return simple name without the suffix
     */
    public static String defaultTypeName(Class<?> clazz) {
        return fromSimpleClassnameStripping(clazz.getSimpleName(), "", "Event");
    }

    public static String fromSimpleClassnameStripping(String simpleClassName, String prefix, String suffix) {
        int start = simpleClassName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleClassName.endsWith(suffix) && simpleClassName.length() > suffix.length()
                ? simpleClassName.length() - suffix.length() : simpleClassName.length();
        return simpleClassName.substring(start, end);
    }
}
