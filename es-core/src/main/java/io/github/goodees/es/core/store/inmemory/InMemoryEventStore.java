package io.github.goodees.es.core.store.inmemory;

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
import io.github.goodees.es.core.store.EventStore;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store keeping everything in memory. Suitable for tests and single-JVM applications that can afford to lose
 * their history on restart.
 *
 * <p>Compare-and-append is atomic per stream, appends to different streams do not block each other. Commit order
 * across streams is kept in a global log, used by {@link #readAll()}.</p>
 */
public class InMemoryEventStore<E extends Event> implements EventStore<E> {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<String, List<E>> storage = new ConcurrentHashMap<>();
    private final List<E> commitLog = new ArrayList<>();

    private List<E> streamLog(String streamId) {
        return storage.computeIfAbsent(streamId, (i) -> new ArrayList<>());
    }

    @Override
    public EventStream<E> read(String streamId, long afterVersion) {
        List<E> log = storage.get(streamId);
        if (log == null) {
            return EventStream.empty(streamId);
        }
        synchronized (log) {
            int from = (int) Math.min(Math.max(afterVersion, 0), log.size());
            return new EventStream<>(streamId, log.size(), log.subList(from, log.size()));
        }
    }

    @Override
    public long append(String streamId, long expectedVersion, List<? extends E> events) throws EventStoreException {
        EventStore.checkBatch(streamId, expectedVersion, events);
        List<E> log = streamLog(streamId);
        synchronized (log) {
            long currentVersion = log.size();
            if (currentVersion != expectedVersion) {
                logger.debug("Rejecting append to {}: expected {}, current {}", streamId, expectedVersion,
                    currentVersion);
                throw EventStoreException.optimisticLock(streamId, currentVersion, expectedVersion);
            }
            log.addAll(events);
            synchronized (commitLog) {
                commitLog.addAll(events);
            }
            return log.size();
        }
    }

    @Override
    public StoredEvents<E> readAll() {
        List<E> snapshot;
        synchronized (commitLog) {
            snapshot = new ArrayList<>(commitLog);
        }
        return new ListStoredEvents<>(snapshot);
    }

    static class ListStoredEvents<E extends Event> implements StoredEvents<E> {
        private final List<E> events;
        private boolean iterating;
        private boolean stop;

        ListStoredEvents(List<E> events) {
            this.events = events;
        }

        private void startIteration() {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
        }

        @Override
        public void foreach(Consumer<? super E> consumer) {
            startIteration();
            for (E event : events) {
                if (stop) {
                    break;
                }
                consumer.accept(event);
            }
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer) {
            startIteration();
            R result = initial;
            for (E event : events) {
                if (stop) {
                    break;
                }
                result = reducer.apply(result, event);
            }
            return result;
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
        }
    }
}
