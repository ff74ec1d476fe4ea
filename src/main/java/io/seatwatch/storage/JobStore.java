package io.seatwatch.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.seatwatch.model.FailureRecord;
import io.seatwatch.model.JobRecord;
import io.seatwatch.model.JobStats;
import io.seatwatch.model.MonitoringMode;
import io.seatwatch.model.NotificationSettings;
import io.seatwatch.model.SectionKind;
import io.seatwatch.model.Target;
import io.seatwatch.security.SealedSecret;
import io.seatwatch.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JobStore {
    private static final TypeReference<Map<String, FailureRecord>> FAILURES_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> RECIPIENTS_TYPE = new TypeReference<>() {
    };
    private static final String JOB_COLUMNS = "job_id,owner_id,term,polling_interval_sec,seat_threshold,monitoring_mode,"
            + "credential_ct,credential_nonce,is_active,is_connected,last_check_at_ms,created_at_ms,updated_at_ms";

    private final Database database;

    public JobStore(Database database) {
        this.database = database;
    }

    public void createJob(JobRecord job, List<Target> targets, JobStats stats) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement j = c.prepareStatement(
                    "INSERT INTO jobs(" + JOB_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)");
                 PreparedStatement t = c.prepareStatement(
                         "INSERT INTO targets(job_id,position,department,course_code,kind,label) VALUES(?,?,?,?,?,?)");
                 PreparedStatement s = c.prepareStatement(
                         "INSERT INTO job_stats(job_id,total_checks,openings_found,enrollment_attempts,successful_enrollments,errors,section_failures,start_time_ms,last_updated_ms) VALUES(?,?,?,?,?,?,?,?,?)")) {
                j.setString(1, job.id());
                j.setString(2, job.ownerId());
                j.setString(3, job.term());
                j.setInt(4, job.pollingIntervalSec());
                j.setInt(5, job.seatThreshold());
                j.setString(6, job.monitoringMode().name());
                j.setString(7, job.credential().ciphertext());
                j.setString(8, job.credential().nonce());
                j.setInt(9, job.active() ? 1 : 0);
                j.setInt(10, job.connected() ? 1 : 0);
                setNullableInstant(j, 11, job.lastCheckTime());
                j.setLong(12, job.createdAt().toEpochMilli());
                j.setLong(13, job.updatedAt().toEpochMilli());
                j.executeUpdate();

                int position = 0;
                for (Target target : targets) {
                    t.setString(1, job.id());
                    t.setInt(2, position++);
                    t.setString(3, target.department());
                    t.setString(4, target.courseCode());
                    t.setString(5, target.kind().name());
                    t.setString(6, target.label());
                    t.addBatch();
                }
                t.executeBatch();

                s.setString(1, job.id());
                s.setLong(2, stats.getTotalChecks());
                s.setLong(3, stats.getOpeningsFound());
                s.setLong(4, stats.getEnrollmentAttempts());
                s.setLong(5, stats.getSuccessfulEnrollments());
                s.setLong(6, stats.getErrors());
                s.setString(7, Jsons.toCompactJson(stats.getSectionFailures()));
                s.setLong(8, stats.getStartTime().toEpochMilli());
                s.setLong(9, stats.getLastUpdated().toEpochMilli());
                s.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create job " + job.id(), e);
        }
    }

    public Optional<JobRecord> findJob(String jobId, String ownerId) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs WHERE job_id=? AND owner_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            ps.setString(2, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(mapJob(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read job " + jobId, e);
        }
    }

    public List<JobRecord> listJobs(String ownerId) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs WHERE owner_id=? ORDER BY created_at_ms DESC, job_id";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            return readJobs(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list jobs for owner " + ownerId, e);
        }
    }

    public List<JobRecord> findActiveJobs() {
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs WHERE is_active=1 ORDER BY created_at_ms, job_id";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            return readJobs(ps);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to list active jobs", e);
        }
    }

    public List<Target> loadTargets(String jobId) {
        String sql = "SELECT department,course_code,kind,label FROM targets WHERE job_id=? ORDER BY position";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            List<Target> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Target(
                            rs.getString("department"),
                            rs.getString("course_code"),
                            SectionKind.valueOf(rs.getString("kind")),
                            rs.getString("label")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read targets for job " + jobId, e);
        }
    }

    public Optional<JobStats> loadStats(String jobId) {
        String sql = "SELECT total_checks,openings_found,enrollment_attempts,successful_enrollments,errors,section_failures,start_time_ms,last_updated_ms FROM job_stats WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new JobStats(
                        rs.getLong("total_checks"),
                        rs.getLong("openings_found"),
                        rs.getLong("enrollment_attempts"),
                        rs.getLong("successful_enrollments"),
                        rs.getLong("errors"),
                        Instant.ofEpochMilli(rs.getLong("start_time_ms")),
                        Instant.ofEpochMilli(rs.getLong("last_updated_ms")),
                        parseFailures(rs.getString("section_failures"))
                ));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read stats for job " + jobId, e);
        }
    }

    public void saveStats(String jobId, JobStats stats, Instant lastCheckTime) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement s = c.prepareStatement(
                    "UPDATE job_stats SET total_checks=?,openings_found=?,enrollment_attempts=?,successful_enrollments=?,errors=?,section_failures=?,last_updated_ms=? WHERE job_id=?");
                 PreparedStatement j = c.prepareStatement(
                         "UPDATE jobs SET last_check_at_ms=?,updated_at_ms=? WHERE job_id=?")) {
                s.setLong(1, stats.getTotalChecks());
                s.setLong(2, stats.getOpeningsFound());
                s.setLong(3, stats.getEnrollmentAttempts());
                s.setLong(4, stats.getSuccessfulEnrollments());
                s.setLong(5, stats.getErrors());
                s.setString(6, Jsons.toCompactJson(stats.getSectionFailures()));
                s.setLong(7, stats.getLastUpdated().toEpochMilli());
                s.setString(8, jobId);
                s.executeUpdate();

                j.setLong(1, lastCheckTime.toEpochMilli());
                j.setLong(2, lastCheckTime.toEpochMilli());
                j.setString(3, jobId);
                j.executeUpdate();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save stats for job " + jobId, e);
        }
    }

    public void updateJobStatus(String jobId, boolean active, boolean connected) {
        String sql = "UPDATE jobs SET is_active=?,is_connected=?,updated_at_ms=? WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, active ? 1 : 0);
            ps.setInt(2, connected ? 1 : 0);
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.setString(4, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update status for job " + jobId, e);
        }
    }

    public void updateConnected(String jobId, boolean connected) {
        String sql = "UPDATE jobs SET is_connected=?,updated_at_ms=? WHERE job_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, connected ? 1 : 0);
            ps.setLong(2, Instant.now().toEpochMilli());
            ps.setString(3, jobId);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to update connectivity for job " + jobId, e);
        }
    }

    public boolean deleteJob(String jobId, String ownerId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement owned = c.prepareStatement("SELECT 1 FROM jobs WHERE job_id=? AND owner_id=?");
                 PreparedStatement s = c.prepareStatement("DELETE FROM job_stats WHERE job_id=?");
                 PreparedStatement t = c.prepareStatement("DELETE FROM targets WHERE job_id=?");
                 PreparedStatement j = c.prepareStatement("DELETE FROM jobs WHERE job_id=? AND owner_id=?")) {
                owned.setString(1, jobId);
                owned.setString(2, ownerId);
                try (ResultSet rs = owned.executeQuery()) {
                    if (!rs.next()) {
                        c.rollback();
                        return false;
                    }
                }
                s.setString(1, jobId);
                s.executeUpdate();
                t.setString(1, jobId);
                t.executeUpdate();
                j.setString(1, jobId);
                j.setString(2, ownerId);
                j.executeUpdate();
                c.commit();
                return true;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete job " + jobId, e);
        }
    }

    public int countTargets(String jobId) {
        return countRows("SELECT COUNT(*) FROM targets WHERE job_id=?", jobId);
    }

    public boolean hasStats(String jobId) {
        return countRows("SELECT COUNT(*) FROM job_stats WHERE job_id=?", jobId) > 0;
    }

    public NotificationSettings getNotificationSettings(String ownerId) {
        String sql = "SELECT sender_address,mail_credential_ct,mail_credential_nonce,email_recipients,webhook_url,updated_at_ms FROM notification_settings WHERE owner_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return NotificationSettings.empty(ownerId);
                String ct = rs.getString("mail_credential_ct");
                String nonce = rs.getString("mail_credential_nonce");
                SealedSecret mail = ct == null || nonce == null ? null : new SealedSecret(ct, nonce);
                return new NotificationSettings(
                        ownerId,
                        rs.getString("sender_address"),
                        mail,
                        parseRecipients(rs.getString("email_recipients")),
                        rs.getString("webhook_url"),
                        Instant.ofEpochMilli(rs.getLong("updated_at_ms"))
                );
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read notification settings for owner " + ownerId, e);
        }
    }

    public void saveNotificationSettings(NotificationSettings settings) {
        String sql = """
                INSERT INTO notification_settings(owner_id,sender_address,mail_credential_ct,mail_credential_nonce,email_recipients,webhook_url,updated_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(owner_id) DO UPDATE SET
                    sender_address=excluded.sender_address,
                    mail_credential_ct=excluded.mail_credential_ct,
                    mail_credential_nonce=excluded.mail_credential_nonce,
                    email_recipients=excluded.email_recipients,
                    webhook_url=excluded.webhook_url,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            SealedSecret mail = settings.mailCredential();
            ps.setString(1, settings.ownerId());
            ps.setString(2, settings.senderAddress());
            ps.setString(3, mail == null ? null : mail.ciphertext());
            ps.setString(4, mail == null ? null : mail.nonce());
            ps.setString(5, Jsons.toCompactJson(settings.emailRecipients()));
            ps.setString(6, settings.webhookUrl());
            ps.setLong(7, (settings.updatedAt() == null ? Instant.now() : settings.updatedAt()).toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to save notification settings for owner " + settings.ownerId(), e);
        }
    }

    private int countRows(String sql, String jobId) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to count rows for job " + jobId, e);
        }
    }

    private List<JobRecord> readJobs(PreparedStatement ps) throws SQLException {
        List<JobRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapJob(rs));
            }
        }
        return out;
    }

    private static JobRecord mapJob(ResultSet rs) throws SQLException {
        long lastCheck = rs.getLong("last_check_at_ms");
        Instant lastCheckTime = rs.wasNull() ? null : Instant.ofEpochMilli(lastCheck);
        return new JobRecord(
                rs.getString("job_id"),
                rs.getString("owner_id"),
                rs.getString("term"),
                rs.getInt("polling_interval_sec"),
                rs.getInt("seat_threshold"),
                MonitoringMode.fromString(rs.getString("monitoring_mode")),
                new SealedSecret(rs.getString("credential_ct"), rs.getString("credential_nonce")),
                rs.getInt("is_active") == 1,
                rs.getInt("is_connected") == 1,
                lastCheckTime,
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms"))
        );
    }

    private static void setNullableInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static Map<String, FailureRecord> parseFailures(String raw) {
        if (raw == null || raw.isBlank()) {
            return Map.of();
        }
        try {
            return Jsons.mapper().readValue(raw, FAILURES_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt section_failures column", e);
        }
    }

    private static List<String> parseRecipients(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.mapper().readValue(raw, RECIPIENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt email_recipients column", e);
        }
    }
}
