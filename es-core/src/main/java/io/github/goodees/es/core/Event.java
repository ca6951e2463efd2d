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

import java.time.Instant;

/**
 * Immutable fact about business domain relevant fact that became true.
 *
 * <p>Every event sourced aggregate class defines its own closed set of events. Once appended to a stream an event is
 * never changed nor deleted.</p>
 *
 * <p>The serialization and deserialization format is not prescribed, but events may define annotations to support specific
 * serialization kinds, e. g. Jackson annotations. The actual serialization and deserialization process is task of
 * actual EventStore implementation</p>
 *
 * <p>The methods provided in this interface define metadata that will be stored outside the journaled payload to enable
 * querying and deserialization.</p>
 *
 * Support for events based on <a href="http://immutables.github.io">Immutables</a> is in package {@link io.github.goodees.es.core.immutables}.
 */
public interface Event {
    /**
     * The kind of event. For every aggregate class this must uniquely identify the event to be created.
     * @return textual description of the type of event, uses class name by default, stripped from suffix Event
     */
    default String getType() {
        return EventType.of(getClass());
    }

    /**
     * The id of the stream (and therefore the aggregate instance) this event belongs to.
     * @return the stream id
     */
    String streamId();

    /**
     * The time when an event occurred.
     * @return the instant of event creation
     */
    Instant getOccurredAt();

}
