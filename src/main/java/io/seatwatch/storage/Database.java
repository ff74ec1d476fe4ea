package io.seatwatch.storage;

import io.seatwatch.config.SeatWatchConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final SeatWatchConfig config;
    private final String jdbcUrl;

    public Database(SeatWatchConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.securityRoot());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        job_id TEXT PRIMARY KEY,
                        owner_id TEXT NOT NULL,
                        term TEXT NOT NULL,
                        polling_interval_sec INTEGER NOT NULL,
                        seat_threshold INTEGER NOT NULL DEFAULT 0,
                        monitoring_mode TEXT NOT NULL DEFAULT 'INCLUDE',
                        credential_ct TEXT NOT NULL,
                        credential_nonce TEXT NOT NULL,
                        is_active INTEGER NOT NULL DEFAULT 0,
                        is_connected INTEGER NOT NULL DEFAULT 0,
                        last_check_at_ms INTEGER,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS targets (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_id TEXT NOT NULL,
                        position INTEGER NOT NULL,
                        department TEXT NOT NULL,
                        course_code TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        label TEXT NOT NULL,
                        FOREIGN KEY(job_id) REFERENCES jobs(job_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_stats (
                        job_id TEXT PRIMARY KEY,
                        total_checks INTEGER NOT NULL DEFAULT 0,
                        openings_found INTEGER NOT NULL DEFAULT 0,
                        enrollment_attempts INTEGER NOT NULL DEFAULT 0,
                        successful_enrollments INTEGER NOT NULL DEFAULT 0,
                        errors INTEGER NOT NULL DEFAULT 0,
                        section_failures TEXT NOT NULL DEFAULT '{}',
                        start_time_ms INTEGER NOT NULL,
                        last_updated_ms INTEGER NOT NULL,
                        FOREIGN KEY(job_id) REFERENCES jobs(job_id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS notification_settings (
                        owner_id TEXT PRIMARY KEY,
                        sender_address TEXT,
                        mail_credential_ct TEXT,
                        mail_credential_nonce TEXT,
                        email_recipients TEXT NOT NULL DEFAULT '[]',
                        webhook_url TEXT,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_owner ON jobs(owner_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_active ON jobs(is_active)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_targets_job ON targets(job_id, position)");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to apply SQLite pragmas", e);
        }
    }

    private static void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException("PRAGMA " + pragma + " expected " + expected + " but was " + actual);
            }
        }
    }
}
