package com.acme.publisher.integration;

import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.stream.Collectors;

/**
 * Shared PostgreSQL container with the event store schema loaded from schema.sql.
 * Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
abstract class PostgresTestBase {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @BeforeAll
    static void initSchema() throws Exception {
        String sql;
        try (var reader = new BufferedReader(new InputStreamReader(
                PostgresTestBase.class.getClassLoader().getResourceAsStream("schema.sql"), StandardCharsets.UTF_8))) {
            sql = reader.lines().collect(Collectors.joining("\n"));
        }
        try (Connection conn = open(); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    static Connection open() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }

    static void exec(String sql) throws SQLException {
        try (Connection conn = open(); Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }

    static void storeEvent(String aggregateId, int version, String typeCode, String payload, boolean publish)
            throws SQLException {
        try (Connection conn = open()) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "insert into t_aeev_events(aggregate_id, version, typecode, payload) values (?,?,?,?)")) {
                ps.setString(1, aggregateId);
                ps.setInt(2, version);
                ps.setString(3, typeCode);
                ps.setBytes(4, payload.getBytes(StandardCharsets.UTF_8));
                ps.executeUpdate();
            }
            if (publish) {
                queueRef(conn, aggregateId, version);
            }
        }
    }

    static void queueRef(String aggregateId, int version) throws SQLException {
        try (Connection conn = open()) {
            queueRef(conn, aggregateId, version);
        }
    }

    private static void queueRef(Connection conn, String aggregateId, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "insert into t_aepb_publish(aggregate_id, version) values (?,?)")) {
            ps.setString(1, aggregateId);
            ps.setInt(2, version);
            ps.executeUpdate();
        }
    }

    static int count(String sql) throws SQLException {
        try (Connection conn = open(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
