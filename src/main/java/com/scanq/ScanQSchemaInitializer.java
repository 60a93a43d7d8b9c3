package com.scanq;

import com.scanq.config.ScanQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned {@code scanq/migration/V{version}__{description}.sql} scripts found on the
 * classpath. Applied versions are recorded with a SHA-256 checksum in
 * {@code scanq_schema_migrations}; editing an applied script fails startup. On PostgreSQL the run
 * is serialized across instances with an advisory lock.
 */
@Component
@ConditionalOnProperty(prefix = "scanq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class ScanQSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(ScanQSchemaInitializer.class);

    static final String MIGRATION_RESOURCE_PATTERN = "classpath*:scanq/migration/V*__*.sql";
    static final String MIGRATION_TABLE = "scanq_schema_migrations";
    static final String SCHEDULES_TABLE = "scanq_schedules";

    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern MIGRATION_FILE = Pattern.compile("^V(\\d+(?:_\\d+)*)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final long ADVISORY_LOCK_KEY = 5_312_907_114_660_237_019L;

    private final DataSource dataSource;
    private final String tablePrefix;
    private final boolean failOnMigrationError;
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();

    public ScanQSchemaInitializer(DataSource dataSource, ScanQProperties properties) {
        this.dataSource = dataSource;
        this.tablePrefix = normalizePrefix(properties.getDatabase().getTablePrefix());
        this.failOnMigrationError = properties.getDatabase().isFailOnMigrationError();
    }

    @Override
    public void afterPropertiesSet() {
        String migrationTable = identifier(MIGRATION_TABLE);
        log.info("Running ScanQ schema migrations, history kept in {}", migrationTable);

        try (Connection connection = dataSource.getConnection()) {
            boolean locked = lockIfPostgres(connection);
            try {
                createHistoryTable(connection, migrationTable);
                List<Migration> migrations = loadMigrations();
                if (migrations.isEmpty()) {
                    throw new IllegalStateException("No ScanQ migrations found on " + MIGRATION_RESOURCE_PATTERN);
                }
                Map<String, String> applied = loadAppliedChecksums(connection, migrationTable);
                verifyHistory(migrations, applied);

                int count = 0;
                for (Migration migration : migrations) {
                    if (!applied.containsKey(migration.version())) {
                        apply(connection, migrationTable, migration);
                        count++;
                    }
                }
                if (count == 0) {
                    log.info("ScanQ schema is up to date ({} migration(s) applied earlier)", applied.size());
                } else {
                    log.info("Applied {} ScanQ migration(s)", count);
                }
            } finally {
                unlockIfPostgres(connection, locked);
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("ScanQ schema migration failed", e);
            }
            log.error("ScanQ schema migration failed; continuing because "
                    + "scanq.database.fail-on-migration-error=false", e);
        }
    }

    private void createHistoryTable(Connection connection, String migrationTable) throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS %s (
                    version VARCHAR(64) PRIMARY KEY,
                    description VARCHAR(255) NOT NULL,
                    checksum VARCHAR(64) NOT NULL,
                    installed_on TIMESTAMP WITH TIME ZONE NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    execution_time_ms BIGINT NOT NULL
                )
                """.formatted(migrationTable);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        }
    }

    private List<Migration> loadMigrations() throws IOException {
        List<Migration> migrations = new ArrayList<>();
        for (Resource resource : resolver.getResources(MIGRATION_RESOURCE_PATTERN)) {
            String fileName = resource.getFilename();
            if (fileName == null) {
                continue;
            }
            Matcher matcher = MIGRATION_FILE.matcher(fileName);
            if (!matcher.matches()) {
                throw new IllegalStateException("Migration file '" + fileName
                        + "' does not match V{version}__{description}.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            migrations.add(new Migration(matcher.group(1), versionParts(matcher.group(1)),
                    matcher.group(2).replace('_', ' '), fileName, sql, sha256(sql)));
        }
        migrations.sort(Comparator.comparing(Migration::parts, ScanQSchemaInitializer::compareVersions));

        Map<String, String> seen = new LinkedHashMap<>();
        for (Migration migration : migrations) {
            String previous = seen.putIfAbsent(migration.version(), migration.fileName());
            if (previous != null) {
                throw new IllegalStateException("Migration version V" + migration.version()
                        + " is declared by both " + previous + " and " + migration.fileName());
            }
        }
        return migrations;
    }

    private Map<String, String> loadAppliedChecksums(Connection connection, String migrationTable)
            throws SQLException {
        Map<String, String> applied = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + migrationTable);
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                applied.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return applied;
    }

    private void verifyHistory(List<Migration> migrations, Map<String, String> applied) {
        Map<String, Migration> byVersion = new LinkedHashMap<>();
        migrations.forEach(m -> byVersion.put(m.version(), m));

        for (Map.Entry<String, String> entry : applied.entrySet()) {
            Migration migration = byVersion.get(entry.getKey());
            if (migration == null) {
                throw new IllegalStateException("Migration V" + entry.getKey()
                        + " is recorded as applied but missing from the classpath");
            }
            if (!migration.checksum().equals(entry.getValue())) {
                throw new IllegalStateException("Migration V" + entry.getKey()
                        + " was modified after it was applied (checksum mismatch)");
            }
        }
    }

    private void apply(Connection connection, String migrationTable, Migration migration) {
        long started = System.nanoTime();
        boolean autoCommit = true;
        try {
            autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);

            String sql = render(migration.sql());
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), migration.fileName()),
                    StandardCharsets.UTF_8));

            long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
            try (PreparedStatement statement = connection.prepareStatement("INSERT INTO " + migrationTable
                    + " (version, description, checksum, execution_time_ms) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, migration.version());
                statement.setString(2, migration.description());
                statement.setString(3, migration.checksum());
                statement.setLong(4, elapsedMs);
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied ScanQ migration V{} ({}) in {} ms", migration.version(), migration.description(),
                    elapsedMs);
        } catch (Exception e) {
            try {
                connection.rollback();
            } catch (SQLException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw new IllegalStateException("Failed to apply ScanQ migration V" + migration.version(), e);
        } finally {
            try {
                connection.setAutoCommit(autoCommit);
            } catch (SQLException e) {
                log.warn("Could not restore auto-commit after ScanQ migration", e);
            }
        }
    }

    private String render(String sql) {
        if (tablePrefix.isEmpty()) {
            return sql;
        }
        return sql.replace("idx_" + SCHEDULES_TABLE, tablePrefix + "idx_" + SCHEDULES_TABLE)
                .replace(" " + SCHEDULES_TABLE, " " + identifier(SCHEDULES_TABLE));
    }

    private boolean lockIfPostgres(Connection connection) throws SQLException {
        if (!isPostgres(connection)) {
            return false;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
        return true;
    }

    private void unlockIfPostgres(Connection connection, boolean locked) {
        if (!locked) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release ScanQ migration lock", e);
        }
    }

    private static boolean isPostgres(Connection connection) throws SQLException {
        String product = connection.getMetaData().getDatabaseProductName();
        return product != null && product.toLowerCase(Locale.ROOT).contains("postgresql");
    }

    private String identifier(String name) {
        String resolved = tablePrefix + name;
        if (!SAFE_IDENTIFIER.matcher(resolved).matches()) {
            throw new IllegalArgumentException("Unsupported SQL identifier: " + resolved);
        }
        return resolved;
    }

    private static String normalizePrefix(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            return "";
        }
        String trimmed = prefix.trim();
        if (!SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported scanq.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static List<Integer> versionParts(String version) {
        List<Integer> parts = new ArrayList<>();
        for (String part : version.split("_")) {
            parts.add(Integer.parseInt(part));
        }
        return parts;
    }

    private static int compareVersions(List<Integer> left, List<Integer> right) {
        for (int i = 0; i < Math.max(left.size(), right.size()); i++) {
            int l = i < left.size() ? left.get(i) : 0;
            int r = i < right.size() ? right.get(i) : 0;
            if (l != r) {
                return Integer.compare(l, r);
            }
        }
        return 0;
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute migration checksum", e);
        }
    }

    private record Migration(String version, List<Integer> parts, String description, String fileName, String sql,
            String checksum) {
    }
}
