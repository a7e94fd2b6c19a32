package spotlane.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spotlane.coordinator.config.CoordinatorConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;

/**
 * HikariCP pool over the deployment store. The schema in
 * {@code db/schema.sql} is applied on startup and is idempotent.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);
    static final String SCHEMA = "db/schema.sql";

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setPoolName("spotlane-store");
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        // a CLI run is short; fail fast when the store is locked by another process
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);
        log.debug("Deployment store pool open: {}", jdbcUrl);

        try {
            applySchema();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
    }

    /** Caller closes the connection. */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Deployment store health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void applySchema() {
        List<String> statements = statements(loadSchema());
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.addBatch(sql);
            }
            st.executeBatch();
            conn.commit();
            log.debug("Applied {} schema statement(s)", statements.size());
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize deployment store schema", e);
        }
    }

    static String loadSchema() {
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA)) {
            if (in == null) {
                throw new IllegalStateException(SCHEMA + " not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + SCHEMA, e);
        }
    }

    /** Splits on ';' after dropping {@code --} comment lines. */
    static List<String> statements(String script) {
        StringBuilder sql = new StringBuilder();
        for (String line : script.split("\n")) {
            if (!line.trim().startsWith("--")) {
                sql.append(line).append('\n');
            }
        }
        return Arrays.stream(sql.toString().split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Deployment store pool closed");
        }
    }
}
