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
import java.util.Objects;

public class TestEvent implements Event {
    private final String streamId;
    private final Instant occurredAt;
    private final int payload;

    public TestEvent(String streamId, Instant occurredAt, int payload) {
        this.streamId = streamId;
        this.occurredAt = occurredAt;
        this.payload = payload;
    }

    public TestEvent(String streamId, int payload) {
        this(streamId, Instant.parse("2017-05-03T10:15:30Z"), payload);
    }

    @Override
    public String streamId() {
        return streamId;
    }

    @Override
    public Instant getOccurredAt() {
        return occurredAt;
    }

    public int getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        TestEvent that = (TestEvent) o;
        return payload == that.payload && streamId.equals(that.streamId) && occurredAt.equals(that.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, payload);
    }

    @Override
    public String toString() {
        return getType() + "{" + streamId + ", " + payload + '}';
    }

    /**
     * Kind no aggregate knows.
     */
    public static class Rogue extends TestEvent {
        public Rogue(String streamId) {
            super(streamId, 0);
        }

        @Override
        public String getType() {
            return "Rogue";
        }
    }
}
