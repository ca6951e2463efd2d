package io.github.goodees.es.core.projection;

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
import io.github.goodees.es.core.store.EventStore.StoredEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Applies events to registered projections, synchronously and in order. Every event is passed to all projections
 * before next event is processed.
 *
 * <p>Projections read and rewrite shared rows, so application is serialized on the monitor of the engine. Writers
 * that need events projected in the order they were appended hold the same monitor across append and
 * {@link #project(List)}.</p>
 *
 * @param <E> type of events
 */
public class ProjectionEngine<E extends Event> {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionEngine.class);

    private final List<Projection<? super E>> projections = new CopyOnWriteArrayList<>();

    public ProjectionEngine<E> register(Projection<? super E> projection) {
        projections.add(projection);
        return this;
    }

    /**
     * Apply newly appended events.
     * @param events events in commit order
     */
    public synchronized void project(List<? extends E> events) {
        for (E event : events) {
            apply(event);
        }
    }

    /**
     * Replay full history into projections. Read models are expected to be empty before the call.
     * @param history all events, will be closed
     * @return number of events processed
     */
    public synchronized long rebuild(StoredEvents<? extends E> history) {
        try (StoredEvents<? extends E> events = history) {
            long count = events.reduce(0L, (processed, event) -> {
                apply(event);
                return processed + 1;
            });
            logger.info("Rebuilt {} projections from {} events", projections.size(), count);
            return count;
        }
    }

    private void apply(E event) {
        logger.debug("Projecting {} of {}", event.getType(), event.streamId());
        for (Projection<? super E> projection : projections) {
            projection.handle(event);
        }
    }
}
