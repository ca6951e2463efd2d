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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * A single event sourced aggregate. The aggregate is constructed fresh for every unit of work, its state recovered by
 * replaying the history of its stream, and discarded after the work completes.
 *
 * <p>An aggregate preserves its internal state. This state can <strong>only</strong> change as result of an event
 * passed to method {@link #updateState(Event)}. The state of the aggregate, and the system in general <strong>may
 * not</strong> change in other methods, especially not in methods that validate commands.</p>
 *
 * <p>Behaviors validate the current state and either reject the command, or {@linkplain #enqueue(Event) enqueue} an
 * event. Enqueued event is applied immediately, so that subsequent behaviors within the same unit of work see up to date
 * state, and is kept among {@linkplain #getPendingEvents() pending events} until the
 * {@linkplain CommandHandler command handler} appends them to the store.</p>
 *
 * <p>Subclasses must be deterministic: replaying the same events onto {@code initial} state must always yield equal
 * state, therefore they shall implement {@link Object#equals(Object)} over their state.</p>
 *
 * @param <E> the closed set of events of this aggregate
 */
public abstract class EventSourcedAggregate<E extends Event> {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private long version;
    private final List<E> pendingEvents = new ArrayList<>();
    private final List<E> readOnlyPendingView = Collections.unmodifiableList(pendingEvents);

    /**
     * Version of an aggregate. Corresponds to number of persisted events folded into this instance, and is the expected
     * version of the next append.
     * @return current aggregate version
     */
    public final long getVersion() {
        return version;
    }

    /**
     * Events produced by behaviors since the aggregate was loaded, not yet appended to the store.
     * @return read-only view of pending events
     */
    public final List<E> getPendingEvents() {
        return readOnlyPendingView;
    }

    /**
     * Apply an event from the stream history.
     * @param event past event from the event store
     */
    final void replayEvent(E event) {
        updateState(event);
        version++;
    }

    /**
     * Record an event produced by a behavior, and apply it to the state.
     * @param event new event
     */
    protected final void enqueue(E event) {
        updateState(event);
        pendingEvents.add(event);
        logger.debug("Enqueued {} on version {}", event.getType(), version);
    }

    /**
     * Hand over pending events for appending.
     * @return events produced since load, in order
     */
    final List<E> dequeuePendingEvents() {
        List<E> result = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return result;
    }

    /**
     * Called by command handler after events were appended.
     * @param newVersion the version the store reported
     */
    final void committed(long newVersion) {
        this.version = newVersion;
    }

    /**
     * Update the state as result of application of an event. This method must be deterministic and total over all kinds
     * of {@code E}; receiving an event it doesn't know is a programming error that shall be reported with
     * {@link InconsistencyException#unknownEvent(Object, Event)}.
     *
     * @param event event to apply
     */
    protected abstract void updateState(E event);

    /**
     * Fold single event into state. The aggregate is mutable, therefore the very same instance is returned.
     * @param state the state to fold into
     * @param event the event
     * @param <A> aggregate type
     * @param <E> event type
     * @return state after the event
     */
    public static <A extends EventSourcedAggregate<E>, E extends Event> A fold(A state, E event) {
        state.replayEvent(event);
        return state;
    }

    /**
     * Left fold of events starting from {@code initial} state.
     * @param initial factory for zero state
     * @param events the history, in order
     * @param <A> aggregate type
     * @param <E> event type
     * @return recovered aggregate
     */
    public static <A extends EventSourcedAggregate<E>, E extends Event> A replay(Supplier<A> initial,
            Iterable<? extends E> events) {
        A state = initial.get();
        for (E event : events) {
            fold(state, event);
        }
        return state;
    }
}
