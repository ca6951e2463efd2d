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

import io.github.goodees.es.core.projection.ProjectionEngine;
import io.github.goodees.es.core.store.EventStore;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.function.Supplier;

/**
 * Executes commands against event sourced aggregates. A unit of work loads the stream, replays it into a fresh
 * aggregate, runs the behavior and appends produced events, expecting the version observed at load. Appended events
 * are then passed to the projections, while holding the monitor of the {@link ProjectionEngine}.
 *
 * <p>No lock is held between read and append; when another writer appended in between, the command fails with
 * {@link Result.Fault#CONCURRENCY_CONFLICT} and is not retried. Caller is expected to reload and decide again.</p>
 *
 * <p>Infrastructure failures of the store are not domain outcomes and are propagated as {@link EventStoreException}.</p>
 *
 * @param <A> aggregate type
 * @param <E> events of the aggregate
 */
public class CommandHandler<A extends EventSourcedAggregate<E>, E extends Event> {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final EventStore<E> eventStore;
    private final Supplier<A> initial;
    private final ProjectionEngine<E> projections;

    public CommandHandler(EventStore<E> eventStore, Supplier<A> initial, ProjectionEngine<E> projections) {
        this.eventStore = eventStore;
        this.initial = initial;
        this.projections = projections;
    }

    /**
     * Load current state of an aggregate.
     * @param streamId the stream
     * @return the aggregate, NOT_FOUND when the stream doesn't exist, INCONSISTENCY when its history cannot be replayed
     * @throws EventStoreException when the store cannot be read
     */
    public Result<A> load(String streamId) throws EventStoreException {
        EventStream<E> stream = eventStore.read(streamId);
        if (!stream.exists()) {
            return Result.notFound("Stream " + streamId + " does not exist");
        }
        try {
            return Result.success(rehydrate(stream));
        } catch (InconsistencyException e) {
            logger.error("Cannot replay stream {}", streamId, e);
            return Result.inconsistency(e.getMessage());
        }
    }

    /**
     * Execute a command that starts a new stream.
     * @param streamId id of new stream
     * @param behavior the decision, executed on initial state
     * @return outcome, or VALIDATION failure when the stream already exists
     * @throws EventStoreException on infrastructure failure
     */
    public Result<CommandOutcome<E>> create(String streamId, AggregateBehavior<? super A> behavior)
            throws EventStoreException {
        EventStream<E> stream = eventStore.read(streamId);
        if (stream.exists()) {
            return Result.validation("Stream " + streamId + " already exists");
        }
        return execute(stream, behavior);
    }

    /**
     * Execute a command on existing stream.
     * @param streamId the stream
     * @param expectedVersion version the caller based its intent on, if it has one
     * @param behavior the decision
     * @return outcome, NOT_FOUND when the stream does not exist, CONCURRENCY_CONFLICT when the stream is not at expected
     *         version or changed before the append
     * @throws EventStoreException on infrastructure failure
     */
    public Result<CommandOutcome<E>> update(String streamId, OptionalLong expectedVersion,
            AggregateBehavior<? super A> behavior) throws EventStoreException {
        EventStream<E> stream = eventStore.read(streamId);
        if (!stream.exists()) {
            return Result.notFound("Stream " + streamId + " does not exist");
        }
        if (expectedVersion.isPresent() && expectedVersion.getAsLong() != stream.getVersion()) {
            logger.debug("Stream {} is at version {}, command expected {}", streamId, stream.getVersion(),
                expectedVersion.getAsLong());
            return Result.conflict("Stream " + streamId + " is at version " + stream.getVersion()
                    + ", expected " + expectedVersion.getAsLong());
        }
        return execute(stream, behavior);
    }

    protected A rehydrate(EventStream<E> stream) {
        return EventSourcedAggregate.replay(initial, stream.getEvents());
    }

    private Result<CommandOutcome<E>> execute(EventStream<E> stream, AggregateBehavior<? super A> behavior)
            throws EventStoreException {
        String streamId = stream.getStreamId();
        A aggregate;
        try {
            aggregate = rehydrate(stream);
        } catch (InconsistencyException e) {
            logger.error("Cannot replay stream {}", streamId, e);
            return Result.inconsistency(e.getMessage());
        }
        Result<?> decision = behavior.execute(aggregate);
        if (decision.isFailure()) {
            logger.debug("Command on {} rejected: {}", streamId, decision);
            return decision.propagate();
        }
        List<E> events = aggregate.dequeuePendingEvents();
        if (events.isEmpty()) {
            return Result.success(new CommandOutcome<>(streamId, aggregate.getVersion(), Collections.emptyList()));
        }
        long newVersion;
        // appends of this handler reach the projections in the order they were stored
        synchronized (projections) {
            try {
                newVersion = eventStore.append(streamId, aggregate.getVersion(), events);
            } catch (EventStoreException e) {
                if (e.isOptimisticLock()) {
                    logger.debug("Concurrent modification of {}: {}", streamId, e.getMessage());
                    return Result.conflict(e.getMessage());
                }
                throw e;
            }
            aggregate.committed(newVersion);
            try {
                projections.project(events);
            } catch (InconsistencyException e) {
                logger.error("Projection of {} at version {} failed", streamId, newVersion, e);
                return Result.inconsistency(e.getMessage());
            }
        }
        return Result.success(new CommandOutcome<>(streamId, newVersion, events));
    }
}
