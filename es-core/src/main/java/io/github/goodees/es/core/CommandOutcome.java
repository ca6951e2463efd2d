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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Successful outcome of a command: the events that were appended and version of the stream after the append.
 */
public final class CommandOutcome<E extends Event> {
    private final String streamId;
    private final long version;
    private final List<E> events;

    CommandOutcome(String streamId, long version, List<? extends E> events) {
        this.streamId = streamId;
        this.version = version;
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public String getStreamId() {
        return streamId;
    }

    /**
     * @return version to pass as expected version of the next command on the stream
     */
    public long getVersion() {
        return version;
    }

    public List<E> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "CommandOutcome{" + "streamId=" + streamId + ", version=" + version + ", events=" + events + '}';
    }
}
