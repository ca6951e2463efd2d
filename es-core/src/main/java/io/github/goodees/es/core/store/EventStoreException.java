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


/**
 * Exception generated when reading or appending events fails.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        OPTIMISTIC_LOCK, TX_ERROR, PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public boolean isOptimisticLock() {
        return fault == Fault.OPTIMISTIC_LOCK;
    }

    public static EventStoreException optimisticLock(String streamId, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId
                + " was modified concurrently, expected version " + expectedVersion, null);
    }

    public static EventStoreException optimisticLock(String streamId, long actualVersion, long expectedVersion) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId + " append expected version "
                + expectedVersion + " while current version is " + actualVersion, null);
    }

    public static EventStoreException concurrentCreation(String streamId, Throwable cause) {
        return new EventStoreException(Fault.OPTIMISTIC_LOCK, "Stream " + streamId
                + " was appended concurrently. " + cause.getMessage(), cause);
    }

    public static EventStoreException storeFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of stream " + streamId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String streamId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Reading of " + (streamId == null ? "all streams" : "stream " + streamId) + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException multipleStreams(String expected, Event violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Appended events span multiple streams: " + expected
                + " and " + violating.streamId(), null);
    }

    public static EventStoreException emptyBatch(String streamId) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "No events to append to stream " + streamId, null);
    }

    public static EventStoreException invalidVersion(String streamId, long expectedVersion) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Stream " + streamId
                + " cannot be expected at negative version " + expectedVersion, null);
    }

    public static EventStoreException unsupported(Event event, Throwable cause) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Unsupported event type: " + event, cause);
    }
}
