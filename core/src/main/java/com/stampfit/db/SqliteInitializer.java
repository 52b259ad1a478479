package com.stampfit.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // one row per patch; a NULL image_index marks a derived patch
                stmt.execute("CREATE TABLE IF NOT EXISTS patch (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "image_index INTEGER, " +
                        "x INTEGER NOT NULL, " +
                        "y INTEGER NOT NULL, " +
                        "side INTEGER NOT NULL, " +
                        "data BLOB NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_patch_key " +
                        "ON patch (image_index, x, y);");
            }
        }
    }
}
