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
import java.sql.Timestamp;

/**
 * JDBC schema with two tables. Following tables are expected to exist:
 * <ul>
 * <li><em>eventTable</em>(GLOBAL_POSITION, STREAM_ID, VERSION, OCCURRED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD), where
 * GLOBAL_POSITION is generated in commit order, and (STREAM_ID, VERSION) is unique</li>
 * <li><em>streamTable</em>(STREAM_ID, VERSION) primary key (STREAM_ID)</li>
 * </ul>
 */
public class DefaultJdbcSchema extends JdbcSchema {

    private final String eventTable;
    private final String streamTable;

    public DefaultJdbcSchema(String eventTable, String streamTable) {
        this.eventTable = eventTable;
        this.streamTable = streamTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getStreamTable() {
        return streamTable;
    }

    @Override
    protected PreparedStatement selectStreamVersion(Connection connection, String streamId) throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT VERSION FROM " + getStreamTable()
                + " WHERE STREAM_ID=?");
        st.setString(1, streamId);
        return st;
    }

    @Override
    protected long readStreamVersion(ResultSet rs) throws SQLException {
        return rs.getLong(1);
    }

    @Override
    protected PreparedStatement createStreamVersion(Connection connection, String streamId, long version)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("INSERT INTO " + getStreamTable()
                + " (STREAM_ID, VERSION) VALUES (?, ?)");
        st.setString(1, streamId);
        st.setLong(2, version);
        return st;
    }

    @Override
    protected PreparedStatement updateStreamVersion(Connection connection, String streamId, long expectedVersion,
            long newVersion) throws SQLException {
        PreparedStatement st = connection.prepareStatement("UPDATE " + getStreamTable()
                + " SET VERSION=? WHERE STREAM_ID=? AND VERSION=?");
        st.setLong(1, newVersion);
        st.setString(2, streamId);
        st.setLong(3, expectedVersion);
        return st;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection, String streamId) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable()
                + " (STREAM_ID, VERSION, OCCURRED_AT, TYPE, PAYLOAD_VERSION, PAYLOAD) VALUES (?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, Event event, long version, int payloadVersion,
            String payload) throws SQLException {
        insertEvent.setString(1, event.streamId());
        insertEvent.setLong(2, version);
        insertEvent.setTimestamp(3, Timestamp.from(event.getOccurredAt()));
        insertEvent.setString(4, event.getType());
        insertEvent.setInt(5, payloadVersion);
        insertEvent.setString(6, payload);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String streamId, long afterVersion)
            throws SQLException {
        PreparedStatement st = connection.prepareStatement("SELECT STREAM_ID, VERSION, TYPE, PAYLOAD_VERSION, PAYLOAD "
                + "FROM " + getEventTable() + " WHERE STREAM_ID=? AND VERSION > ? ORDER BY VERSION");
        st.setString(1, streamId);
        st.setLong(2, afterVersion);
        return st;
    }

    @Override
    protected PreparedStatement selectAllEvents(Connection connection) throws SQLException {
        return connection.prepareStatement("SELECT STREAM_ID, VERSION, TYPE, PAYLOAD_VERSION, PAYLOAD "
                + "FROM " + getEventTable() + " ORDER BY GLOBAL_POSITION");
    }

    @Override
    protected String readEventStreamId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected long readEventVersion(ResultSet rs) throws SQLException {
        return rs.getLong(2);
    }

    @Override
    protected String readEventType(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected int readEventPayloadVersion(ResultSet rs) throws SQLException {
        return rs.getInt(4);
    }

    @Override
    protected String readEventPayload(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }
}
