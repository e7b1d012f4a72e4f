package com.dds.app.database;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Owns the cache database: connection pool, migrations and the Jdbi handle factory.
 * One instance per database file; close it when the process is done with the file.
 */
public final class Database implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    // Row types shared by SweepDao and the components built on it
    public record CacheRow(String path, long lastSearched, boolean completed, String error,
                           boolean matchFound, String sessionId) {}
    public record QueueRow(String sessionId, String path, String state, long enqueuedAt, String error) {}
    public record SessionRow(String id, String root, boolean recursive, boolean force, boolean dryRun,
                             String status, long createdAt, long updatedAt, Long completedAt,
                             long dirsNew, long dirsResumed, long dirsSkipped, long dirsErrored,
                             long filesFound, long filesDeleted) {}
    public record FoundFileRow(String sessionId, String path, long foundAt, String outcome, String error) {}
    public record CacheStatsRow(long total, long completed, long withMatches, long errors) {}

    private final Path dbFile;
    private final HikariDataSource dataSource;
    private final Jdbi jdbi;

    private Database(Path dbFile, HikariDataSource dataSource) {
        this.dbFile = dbFile;
        this.dataSource = dataSource;
        this.jdbi = Jdbi.create(dataSource);
        this.jdbi.installPlugin(new SqlObjectPlugin());
    }

    /**
     * Opens the database configured in {@link Config}.
     */
    public static Database open() {
        return open(Config.getDbFilePath());
    }

    /**
     * Opens (creating if needed) the database file, runs migrations and the integrity check.
     *
     * @throws IllegalStateException when migrations fail or the file reports corruption
     */
    public static Database open(Path dbFile) {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create database directory for " + dbFile, e);
        }

        HikariDataSource ds = createDataSource(dbFile);
        Database db = new Database(dbFile, ds);
        try {
            db.migrate();
            db.checkIntegrity();
        } catch (RuntimeException e) {
            db.close();
            throw e;
        }
        return db;
    }

    private static HikariDataSource createDataSource(Path dbFile) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(Config.jdbcUrlFor(dbFile));
        config.setPoolName("dds-sqlite");
        config.setConnectionTestQuery("SELECT 1");
        config.setMaximumPoolSize(4);

        // sqlite-jdbc applies these as pragmas on every new connection
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("temp_store", "MEMORY");

        return new HikariDataSource(config);
    }

    private void migrate() {
        Flyway flyway = Flyway.configure()
                .dataSource(dataSource)
                .locations("classpath:db/migration")
                .baselineOnMigrate(true)
                .baselineVersion("0")
                .load();
        try {
            try {
                flyway.migrate();
            } catch (FlywayValidateException e) {
                logger.warn("Flyway validation failed; attempting repair.", e);
                flyway.repair();
                flyway.migrate();
            }
        } catch (RuntimeException e) {
            logger.error("Flyway migration failed", e);
            throw new IllegalStateException("Flyway migration failed", e);
        }
    }

    /**
     * Runs {@code PRAGMA integrity_check}. Corruption is reported, never repaired.
     */
    public void checkIntegrity() {
        List<String> problems = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("PRAGMA integrity_check");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String line = rs.getString(1);
                if (!"ok".equalsIgnoreCase(line)) problems.add(line);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Integrity check could not run on " + dbFile, e);
        }
        if (!problems.isEmpty()) {
            logger.error("Database integrity check failed for {}: {}", dbFile, problems);
            throw new IllegalStateException("Database integrity check failed: " + String.join("; ", problems));
        }
    }

    public Jdbi jdbi() {
        return jdbi;
    }

    public Path file() {
        return dbFile;
    }

    /**
     * Passive WAL checkpoint; never blocks readers or writers.
     */
    public void checkpoint() {
        walCheckpoint("PASSIVE");
    }

    private void walCheckpoint(String mode) {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("PRAGMA wal_checkpoint(" + mode + ")")) {
            ps.execute();
        } catch (SQLException e) {
            logger.debug("WAL checkpoint ({}) skipped: {}", mode, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (dataSource.isClosed()) return;
        walCheckpoint("TRUNCATE");
        dataSource.close();
    }
}
