package com.capturequeue.db;

import com.capturequeue.config.PipelineConfig;
import org.h2.jdbcx.JdbcConnectionPool;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.logging.Logger;

// Connection pool and schema bootstrap for the embedded H2 store
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());
    private static final String SCHEMA_RESOURCE = "schema.sql";

    private final String url;
    private final String user;
    private final String password;
    private final int poolSize;

    private JdbcConnectionPool pool;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(String url, String user, String password, int poolSize) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.poolSize = poolSize;
    }

    public static Database fromConfig(PipelineConfig config) {
        return new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword(), config.getDbPoolSize());
    }

    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.info("Database already initialized");
            return;
        }

        logger.info("Initializing database connection pool for " + url);
        pool = JdbcConnectionPool.create(url, user, password);
        pool.setMaxConnections(poolSize);

        initializeSchema();

        initialized = true;
        logger.info("Database initialization complete (pool size " + poolSize + ")");
    }

    public Connection getConnection() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
        return pool.getConnection();
    }

    // Run schema.sql from the classpath, one statement per ';'-terminated line group
    private void initializeSchema() throws SQLException {
        String schema;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new SQLException(SCHEMA_RESOURCE + " not found on classpath");
            }
            schema = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema file", e);
        }

        try (Connection conn = pool.getConnection();
             Statement stmt = conn.createStatement()) {

            StringBuilder currentStatement = new StringBuilder();
            int executedCount = 0;

            for (String line : schema.split("\n")) {
                line = line.trim();
                if (line.startsWith("--") || line.isEmpty()) {
                    continue;
                }

                currentStatement.append(line).append(" ");

                if (line.endsWith(";")) {
                    String sql = currentStatement.toString().trim();
                    sql = sql.substring(0, sql.length() - 1).trim();
                    if (!sql.isEmpty()) {
                        stmt.execute(sql);
                        executedCount++;
                    }
                    currentStatement = new StringBuilder();
                }
            }

            logger.info("Executed " + executedCount + " schema statements");
        }
    }

    public synchronized void close() {
        if (closed) {
            logger.info("Database already closed");
            return;
        }
        closed = true;
        if (pool != null) {
            logger.info("Closing database pool (" + pool.getActiveConnections() + " active connections)");
            pool.dispose();
        }
        logger.info("Database shutdown complete");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }
}
