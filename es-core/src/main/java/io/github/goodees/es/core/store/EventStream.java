package io.github.goodees.es.core.store;

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

import io.github.goodees.es.core.Event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Events read from a stream along with version of the stream at time of reading. The version is the optimistic
 * concurrency token the reader needs to pass to {@link EventStore#append(String, long, List)}.
 *
 * @param <E> type of events
 */
public final class EventStream<E extends Event> {
    private final String streamId;
    private final long version;
    private final List<E> events;

    public EventStream(String streamId, long version, List<? extends E> events) {
        this.streamId = Objects.requireNonNull(streamId);
        this.version = version;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public static <E extends Event> EventStream<E> empty(String streamId) {
        return new EventStream<>(streamId, 0, Collections.emptyList());
    }

    public String getStreamId() {
        return streamId;
    }

    public long getVersion() {
        return version;
    }

    public List<E> getEvents() {
        return events;
    }

    /**
     * @return true if anything was ever appended to the stream
     */
    public boolean exists() {
        return version > 0;
    }

    @Override
    public String toString() {
        return "EventStream{" + "streamId=" + streamId + ", version=" + version + ", events=" + events.size() + '}';
    }
}
