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

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Append-only log of events, organized in streams. Every stream has a version, that equals the number of events
 * appended to it; stream that was never appended to has version 0.
 *
 * <p>{@link #append(String, long, List)} is the single serialization point of the whole system. It must behave as an
 * atomic compare-and-append even under concurrent callers targeting the same stream: exactly one of appenders sharing
 * an expected version succeeds, others fail with {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.</p>
 *
 * @param <E> type of events stored
 */
public interface EventStore<E extends Event> {

    /**
     * Read entire stream.
     * @param streamId the id of a stream
     * @return events in order they were appended, and current version. Empty with version 0 for unknown stream
     * @throws EventStoreException when the storage cannot be accessed
     */
    default EventStream<E> read(String streamId) throws EventStoreException {
        return read(streamId, 0);
    }

    /**
     * Read events of a stream that were appended after specified version.
     * @param streamId the id of a stream
     * @param afterVersion events that happened after this version. 0 stands for entire history
     * @return events after given version, and current version of the stream
     * @throws EventStoreException when the storage cannot be accessed
     */
    EventStream<E> read(String streamId, long afterVersion) throws EventStoreException;

    /**
     * Conditionally append events to a stream.
     * @param streamId the id of a stream
     * @param expectedVersion version the caller observed when it read the stream, 0 for a new stream
     * @param events events to append, all belonging to {@code streamId}
     * @return new version of the stream, {@code expectedVersion + events.size()}
     * @throws EventStoreException with fault OPTIMISTIC_LOCK when the current version differs from expected, in that
     *         case nothing is appended
     */
    long append(String streamId, long expectedVersion, List<? extends E> events) throws EventStoreException;

    /**
     * Read events of all streams in order they were committed.
     * @return single-pass accessor, that must be closed
     * @throws EventStoreException when the storage cannot be accessed
     */
    StoredEvents<E> readAll() throws EventStoreException;

    /**
     * Accessor that enables single iteration over found events.
     * The underlying idea is, that the events needs not to be materialized at once, rather it could for example wrap a JDBC
     * ResultSet. This also means that only one of methods foreach and reduce may be called on single instance, and
     * only once.
     */
    interface StoredEvents<E extends Event> extends AutoCloseable {
        /**
         * Iterate over all found events. Consumer may call {@link #stop()} to stop the iteration.
         * @param consumer consumer that will receive the events
         */
        void foreach(Consumer<? super E> consumer);

        /**
         * Perform a reduction over all found events. Reducer may call {@link #stop()} to stop the process.
         * @param initial Initial value for reduction
         * @param reducer the reducer function
         * @param <R> type of result
         * @return result of reduction.
         */
        <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer);

        /**
         * Can be called from within the lambda functions to stop the iteration after current step.
         */
        void stop();

        // will not throw exception
        @Override
        void close();
    }

    /**
     * Check that a batch of events may be appended to a stream. Common validation for implementations.
     * @param streamId target stream
     * @param expectedVersion expected version
     * @param events the batch
     * @throws EventStoreException PROGRAMMATIC_ERROR on invalid batch
     */
    static void checkBatch(String streamId, long expectedVersion, List<? extends Event> events)
            throws EventStoreException {
        if (expectedVersion < 0) {
            throw EventStoreException.invalidVersion(streamId, expectedVersion);
        }
        if (events == null || events.isEmpty()) {
            throw EventStoreException.emptyBatch(streamId);
        }
        for (Event event : events) {
            if (!streamId.equals(event.streamId())) {
                throw EventStoreException.multipleStreams(streamId, event);
            }
        }
    }
}
