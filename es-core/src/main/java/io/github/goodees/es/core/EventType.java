package io.github.goodees.es.core;

/*-
 * #%L
 * es-core
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
 * Naming convention for event kinds. The kind is the simple class name without the {@code Event} suffix, so
 * {@code CartOpenedEvent} is stored as {@code CartOpened}. Implementations generated by Immutables additionally lose
 * their {@code Immutable} prefix, so that the abstract event type and its generated implementation share the kind.
 */
public final class EventType {
    private static final String SUFFIX = "Event";
    private static final String IMMUTABLE_PREFIX = "Immutable";

    private EventType() {
    }

    /**
     * Kind of a handwritten event class.
     * @param eventClass the event class
     * @return class name stripped from suffix Event
     */
    public static String of(Class<?> eventClass) {
        return strip(eventClass.getSimpleName(), "", SUFFIX);
    }

    /**
     * Kind of an event class that is either an abstract value type or its generated {@code Immutable*} implementation.
     * @param eventClass the event class
     * @return class name stripped from prefix Immutable and suffix Event
     */
    public static String ofValueType(Class<?> eventClass) {
        return strip(eventClass.getSimpleName(), IMMUTABLE_PREFIX, SUFFIX);
    }

    static String strip(String simpleName, String prefix, String suffix) {
        int start = !prefix.isEmpty() && simpleName.startsWith(prefix) ? prefix.length() : 0;
        int end = simpleName.endsWith(suffix) ? simpleName.length() - suffix.length() : simpleName.length();
        return simpleName.substring(start, end);
    }
}
