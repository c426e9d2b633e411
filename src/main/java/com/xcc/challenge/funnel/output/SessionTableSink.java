package com.xcc.challenge.funnel.output;

import com.xcc.challenge.funnel.exception.SessionStoreException;
import com.xcc.challenge.funnel.model.Event;
import com.xcc.challenge.funnel.model.SessionedEvent;
import com.xcc.challenge.funnel.model.TimedEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists the sessioned events table to SQLite.
 *
 * Columns: id, type, "customer-id", timestamp, time_diff, session.
 * Each run replaces the whole table in a single transaction, and the table
 * reads back in write order.
 */
@Slf4j
@Component
public class SessionTableSink {

    static final String TABLE = "sessioned_events";

    private final String databasePath;

    private Connection connection;

    public SessionTableSink(@Value("${output.database.path:./output/funnel.db}") String databasePath) {
        this.databasePath = databasePath;
    }

    @PostConstruct
    public void initialize() throws SQLException {
        log.info("Initializing session table sink with database: {}", databasePath);

        File parent = new File(databasePath).getAbsoluteFile().getParentFile();
        if (parent != null) {
            parent.mkdirs();
        }

        connection = DriverManager.getConnection("jdbc:sqlite:" + databasePath);
        connection.setAutoCommit(true);

        createTable();
        log.info("Session table sink initialized successfully");
    }

    private void createTable() throws SQLException {
        String createTableSql = """
            CREATE TABLE IF NOT EXISTS sessioned_events (
                id TEXT NOT NULL,
                type TEXT NOT NULL,
                "customer-id" TEXT NOT NULL,
                timestamp TEXT NOT NULL,
                time_diff REAL NOT NULL,
                session INTEGER NOT NULL
            )
            """;

        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.debug("Table '{}' created or already exists", TABLE);
        }
    }

    /**
     * Replace the table content with the events of one run.
     * On failure the previous content stays in place.
     *
     * @param events sessioned events in canonical order
     */
    public synchronized void replaceAll(List<SessionedEvent> events) {
        String insertSql = """
            INSERT INTO sessioned_events
            (id, type, "customer-id", timestamp, time_diff, session)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try {
            connection.setAutoCommit(false);
            try (Statement delete = connection.createStatement();
                 PreparedStatement insert = connection.prepareStatement(insertSql)) {

                delete.executeUpdate("DELETE FROM " + TABLE);

                for (SessionedEvent event : events) {
                    insert.setString(1, event.id());
                    insert.setString(2, event.type());
                    insert.setString(3, event.customerId());
                    insert.setString(4, event.timestamp().toString());
                    insert.setDouble(5, event.timeDiff());
                    insert.setLong(6, event.sessionId());
                    insert.addBatch();
                }
                insert.executeBatch();
                connection.commit();
            } catch (SQLException e) {
                rollbackQuietly(e);
                throw e;
            } finally {
                connection.setAutoCommit(true);
            }
            log.info("Replaced table '{}' with {} sessioned events", TABLE, events.size());
        } catch (SQLException e) {
            log.error("Failed to replace table '{}'", TABLE, e);
            throw new SessionStoreException("Database write failed", e);
        }
    }

    /**
     * Read the table back, in the order it was written.
     */
    public synchronized List<SessionedEvent> loadAll() {
        String selectSql = """
            SELECT id, type, "customer-id", timestamp, time_diff, session
            FROM sessioned_events
            ORDER BY rowid
            """;
        List<SessionedEvent> events = new ArrayList<>();
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {
            while (rs.next()) {
                Event event = new Event(
                        rs.getString(1),
                        rs.getString(2),
                        rs.getString(3),
                        Instant.parse(rs.getString(4))
                );
                events.add(SessionedEvent.of(new TimedEvent(event, rs.getDouble(5)), rs.getLong(6)));
            }
        } catch (SQLException e) {
            log.error("Failed to read table '{}'", TABLE, e);
            throw new SessionStoreException("Database read failed", e);
        }
        log.debug("Loaded {} sessioned events from '{}'", events.size(), TABLE);
        return events;
    }

    private void rollbackQuietly(SQLException cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @PreDestroy
    public void close() {
        try {
            if (connection != null) {
                connection.close();
            }
            log.info("Session table sink closed");
        } catch (SQLException e) {
            log.error("Error closing session table sink", e);
        }
    }
}
