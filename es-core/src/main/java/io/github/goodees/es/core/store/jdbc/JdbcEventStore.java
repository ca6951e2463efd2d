package io.github.goodees.es.core.store.jdbc;

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
import io.github.goodees.es.core.InconsistencyException;
import io.github.goodees.es.core.store.EventStore;
import io.github.goodees.es.core.store.EventStoreException;
import io.github.goodees.es.core.store.EventStream;
import io.github.goodees.es.core.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Event store backed by relational database, with table layout defined by {@link JdbcSchema} and payloads produced by
 * {@link Serialization}.
 *
 * <p>Append runs in single transaction: the stream version is checked, events are inserted, and the version row is
 * updated under condition that it still holds the expected version. When the conditional update does not touch exactly
 * one row, or the database reports violation of a unique constraint, another writer won and the append fails with
 * {@link EventStoreException.Fault#OPTIMISTIC_LOCK}.</p>
 *
 * <p>The store is strict: an event that cannot be deserialized, either because of error in payload serialization, or
 * because it belongs to a future version of the system, is reported as {@link InconsistencyException}. Skipping it
 * would silently produce a wrong state.</p>
 */
public class JdbcEventStore<E extends Event> implements EventStore<E> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<E> serialization;
    private final TxHandler txHandler;

    /**
     * Create a store that manages its own local transactions.
     * @param dataSource the database
     * @param schema the table layout
     * @param serialization payload serialization for the events
     */
    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization) {
        this(dataSource, schema, serialization, LOCAL_TRANSACTION);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<E> serialization, TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
    }

    protected E checkCast(Event event) throws EventStoreException {
        E cast = serialization.toSerializable(event);
        if (cast == null) {
            throw EventStoreException.unsupported(event, null);
        } else {
            return cast;
        }
    }

    protected SerializedEvent serialize(Event event) throws EventStoreException {
        E cast = checkCast(event);
        try {
            return new SerializedEvent(event, serialization.payloadVersion(cast), serialization.serialize(cast));
        } catch (RuntimeException e) {
            throw EventStoreException.unsupported(event, e);
        }
    }

    @Override
    public EventStream<E> read(String streamId, long afterVersion) throws EventStoreException {
        try (Connection connection = dataSource.getConnection()) {
            long version = currentVersion(connection, streamId);
            if (version <= 0) {
                return EventStream.empty(streamId);
            }
            List<E> events = new ArrayList<>();
            try (PreparedStatement select = schema.selectEvents(connection, streamId, afterVersion);
                    ResultSet rs = select.executeQuery()) {
                while (rs.next()) {
                    // rows committed after version was read are not part of this snapshot
                    if (schema.readEventVersion(rs) > version) {
                        break;
                    }
                    events.add(decode(rs));
                }
            }
            return new EventStream<>(streamId, version, events);
        } catch (SQLException e) {
            throw EventStoreException.readFailed(streamId, e);
        }
    }

    @Override
    public long append(String streamId, long expectedVersion, List<? extends E> events) throws EventStoreException {
        EventStore.checkBatch(streamId, expectedVersion, events);
        List<SerializedEvent> serialized = new ArrayList<>(events.size());
        for (E event : events) {
            serialized.add(serialize(event));
        }
        long newVersion = expectedVersion + events.size();
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try {
                checkSourceVersion(connection, streamId, expectedVersion);
                storeEvents(connection, streamId, expectedVersion, serialized);
                updateVersion(connection, streamId, expectedVersion, newVersion);
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException | EventStoreException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException ex) {
            if (isConstraintViolation(ex)) {
                logger.debug("Append to {} lost race on unique constraint", streamId, ex);
                throw EventStoreException.concurrentCreation(streamId, ex);
            }
            logger.error("Append to stream {} failed", streamId, ex);
            throw EventStoreException.storeFailed(streamId, ex);
        }
        logger.debug("Appended {} events to {}, version {}", events.size(), streamId, newVersion);
        return newVersion;
    }

    @Override
    public StoredEvents<E> readAll() throws EventStoreException {
        try {
            return new JdbcStoredEvents();
        } catch (SQLException e) {
            throw EventStoreException.readFailed(null, e);
        }
    }

    private long currentVersion(Connection connection, String streamId) throws SQLException {
        try (PreparedStatement selectVersion = schema.selectStreamVersion(connection, streamId);
                ResultSet rs = selectVersion.executeQuery()) {
            return rs.next() ? schema.readStreamVersion(rs) : -1;
        }
    }

    private void checkSourceVersion(Connection connection, String streamId, long expectedVersion)
            throws SQLException, EventStoreException {
        long version = currentVersion(connection, streamId);
        if (version < 0) {
            if (expectedVersion != 0) {
                throw EventStoreException.optimisticLock(streamId, 0, expectedVersion);
            }
            // no stream yet - create a new one. Concurrent creator will fail on primary key.
            try (PreparedStatement createVersion = schema.createStreamVersion(connection, streamId, 0)) {
                createVersion.executeUpdate();
            }
        } else if (version != expectedVersion) {
            throw EventStoreException.optimisticLock(streamId, version, expectedVersion);
        }
    }

    private void storeEvents(Connection connection, String streamId, long expectedVersion,
            List<SerializedEvent> events) throws SQLException {
        try (PreparedStatement insertEvent = schema.insertEvent(connection, streamId)) {
            long version = expectedVersion;
            for (SerializedEvent event : events) {
                schema.prepareInsert(insertEvent, event.event, ++version, event.payloadVersion, event.payload);
                insertEvent.addBatch();
            }
            insertEvent.executeBatch();
        }
    }

    private void updateVersion(Connection connection, String streamId, long expectedVersion, long newVersion)
            throws SQLException, EventStoreException {
        try (PreparedStatement updateVersion = schema.updateStreamVersion(connection, streamId, expectedVersion,
            newVersion)) {
            int result = updateVersion.executeUpdate();
            if (result != 1) {
                throw EventStoreException.optimisticLock(streamId, expectedVersion);
            }
        }
    }

    private E decode(ResultSet rs) throws SQLException {
        String streamId = schema.readEventStreamId(rs);
        long version = schema.readEventVersion(rs);
        String type = schema.readEventType(rs);
        E event;
        try {
            event = serialization.deserialize(schema.readEventPayloadVersion(rs), schema.readEventPayload(rs), type);
        } catch (RuntimeException e) {
            throw InconsistencyException.undecodableEvent(streamId, version, type, e);
        }
        if (event == null) {
            throw InconsistencyException.undecodableEvent(streamId, version, type, null);
        }
        return event;
    }

    static boolean isConstraintViolation(SQLException ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (t instanceof SQLException) {
                SQLException sqle = (SQLException) t;
                if (sqle.getSQLState() != null && sqle.getSQLState().startsWith("23")) {
                    return true;
                }
                if (sqle.getNextException() != null && isConstraintViolation(sqle.getNextException())) {
                    return true;
                }
            }
        }
        return false;
    }

    protected static final class SerializedEvent {
        private final Event event;
        private final int payloadVersion;
        private final String payload;

        SerializedEvent(Event event, int payloadVersion, String payload) {
            this.event = event;
            this.payloadVersion = payloadVersion;
            this.payload = payload;
        }
    }

    class JdbcStoredEvents implements StoredEvents<E> {
        private Connection connection;
        private PreparedStatement statement;
        private ResultSet resultSet;
        private boolean iterating;
        private boolean stop;

        JdbcStoredEvents() throws SQLException {
            try {
                connection = dataSource.getConnection();
                statement = schema.selectAllEvents(connection);
                resultSet = statement.executeQuery();
            } catch (SQLException e) {
                close();
                throw e;
            }
        }

        @Override
        public void foreach(Consumer<? super E> consumer) {
            reduce(null, (r, e) -> {
                consumer.accept(e);
                return r;
            });
        }

        @Override
        public <R> R reduce(R initial, BiFunction<R, ? super E, R> reducer) {
            if (iterating) {
                throw new IllegalStateException("Iteration has already been done");
            }
            iterating = true;
            R result = initial;
            try {
                while (!stop && resultSet.next()) {
                    result = reducer.apply(result, decode(resultSet));
                }
                return result;
            } catch (SQLException e) {
                throw new IllegalStateException("Cannot read events", e);
            } finally {
                close();
            }
        }

        @Override
        public void stop() {
            stop = true;
        }

        @Override
        public void close() {
            try {
                if (resultSet != null) {
                    resultSet.close();
                }
                if (statement != null) {
                    statement.close();
                }
                if (connection != null) {
                    connection.close();
                }
            } catch (SQLException e) {
                logger.warn("Failed to close event cursor", e);
            } finally {
                resultSet = null;
                statement = null;
                connection = null;
            }
        }
    }

    /**
     * Transaction demarcation of append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Store manages its own transactions on the connection.
     */
    public static final TxHandler LOCAL_TRANSACTION = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };
}
