package com.frontline.core.database;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * HikariCP pool for the territorial tables, plus the bootstrap that creates them
 * on a fresh database.
 */
public class DatabaseManager {

    public static final String SCHEMA_RESOURCE = "schema/frontline_schema.sql";

    private final HikariDataSource dataSource;

    public DatabaseManager(String jdbcUrl, String username, String password, int poolSize) {
        this(poolConfig(jdbcUrl, username, password, poolSize));
    }

    DatabaseManager(HikariConfig config) {
        this.dataSource = new HikariDataSource(config);
    }

    static HikariConfig poolConfig(String jdbcUrl, String username, String password, int poolSize) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setPoolName("frontline-pool");

        // saver, event writer and admin writes; the action path never touches the pool
        config.setMaximumPoolSize(Math.max(2, poolSize));
        config.setMinimumIdle(1);
        config.setIdleTimeout(30000);
        config.setConnectionTimeout(2000); // fail fast if the DB is down
        return config;
    }

    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Runs the bundled schema script. Every statement is CREATE ... IF NOT EXISTS,
     * so this is safe on a database that already holds the tables.
     *
     * @return number of statements executed
     */
    public int applySchema() throws SQLException {
        List<String> statements = splitStatements(readResource(SCHEMA_RESOURCE));
        try (Connection conn = getConnection(); Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        }
        System.out.println("[DB] Schema ready (" + statements.size() + " statements).");
        return statements.size();
    }

    /**
     * Splits a script on ';' after dropping "--" comment lines. The schema has no
     * string literals containing ';'.
     */
    static List<String> splitStatements(String script) {
        StringBuilder clean = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (line.trim().startsWith("--")) continue;
            clean.append(line).append('\n');
        }

        List<String> out = new ArrayList<>();
        for (String part : clean.toString().split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) out.add(sql);
        }
        return out;
    }

    private static String readResource(String name) throws SQLException {
        try (InputStream in = DatabaseManager.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) throw new SQLException("Schema resource not found: " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Cannot read schema resource " + name, e);
        }
    }

    public void close() {
        if (dataSource != null) {
            dataSource.close();
        }
    }
}
