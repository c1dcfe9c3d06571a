package io.txevents.demo;

import io.txevents.jdbc.StoreException;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the demo tables from {@code /schema/h2.sql}.
 */
public final class DemoSchema {
    private static final String RESOURCE = "/schema/h2.sql";

    public static void create(DataSource dataSource) {
        String ddl;
        try (InputStream is = DemoSchema.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                throw new IllegalStateException("Schema resource " + RESOURCE + " not found");
            }
            ddl = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : ddl.split(";")) {
                String trimmed = sql.trim();
                if (!trimmed.isEmpty()) {
                    stmt.execute(trimmed);
                }
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create demo schema", e);
        }
    }

    private DemoSchema() {
    }
}
