package com.stampfit.db;

import com.stampfit.core.patch.PatchIdentifier;
import com.stampfit.util.DoubleArrayCodec;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores a whole patch collection in one SQLite file.
 */
public class PatchDao {

    private final String dbPath;

    public PatchDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * Replaces the stored collection with {@code patches} in a single
     * transaction, so readers see either the old or the new contents.
     */
    public void replaceAll(Map<PatchIdentifier, double[][]> patches) throws SQLException {
        long now = System.currentTimeMillis();
        String sql = "INSERT INTO patch (image_index, x, y, side, data, created_ts) VALUES (?, ?, ?, ?, ?, ?)";
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            try (Statement delete = conn.createStatement();
                    PreparedStatement ps = conn.prepareStatement(sql)) {
                delete.executeUpdate("DELETE FROM patch");
                for (Map.Entry<PatchIdentifier, double[][]> e : patches.entrySet()) {
                    PatchIdentifier id = e.getKey();
                    double[][] patch = e.getValue();
                    if (id.getImageIndex() == null) {
                        ps.setNull(1, Types.INTEGER);
                    } else {
                        ps.setInt(1, id.getImageIndex());
                    }
                    ps.setInt(2, id.getX());
                    ps.setInt(3, id.getY());
                    ps.setInt(4, patch.length);
                    ps.setBytes(5, DoubleArrayCodec.toBytes(patch));
                    ps.setLong(6, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    public Map<PatchIdentifier, double[][]> loadAll() throws SQLException {
        String sql = "SELECT image_index, x, y, side, data FROM patch ORDER BY id";
        Map<PatchIdentifier, double[][]> patches = new LinkedHashMap<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                int imageIndex = rs.getInt("image_index");
                Integer index = rs.wasNull() ? null : imageIndex;
                int side = rs.getInt("side");
                PatchIdentifier id = new PatchIdentifier(index, rs.getInt("x"), rs.getInt("y"));
                patches.put(id, DoubleArrayCodec.fromBytes(rs.getBytes("data"), side, side));
            }
        }
        return patches;
    }

    public int count() throws SQLException {
        try (Connection conn = connect();
                Statement stmt = conn.createStatement();
                ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM patch")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }
}
