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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * SQL dialect and table layout used by {@link JdbcEventStore}. Every method creates a statement with parameters
 * already bound; the store is responsible for executing and closing it.
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement selectStreamVersion(Connection connection, String streamId)
            throws SQLException;

    protected abstract long readStreamVersion(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException;

    protected abstract PreparedStatement updateStreamVersion(Connection connection, String streamId,
            long expectedVersion, long newVersion) throws SQLException;

    protected abstract PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, Event event, long version, int payloadVersion,
            String payload) throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException;

    protected abstract PreparedStatement selectAllEvents(Connection connection) throws SQLException;

    protected abstract String readEventStreamId(ResultSet rs) throws SQLException;

    protected abstract long readEventVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventType(ResultSet rs) throws SQLException;

    protected abstract int readEventPayloadVersion(ResultSet rs) throws SQLException;

    protected abstract String readEventPayload(ResultSet rs) throws SQLException;
}
