package taskhub.coordinator;

import taskhub.coordinator.config.CoordinatorConfig;
import taskhub.coordinator.store.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Seeds the membership tables, which this service only reads.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static CoordinatorConfig inMemoryConfig(String name) {
        return CoordinatorConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:" + name + "-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
    }

    public static long insertCollaboration(Database db, String name) throws SQLException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO collaborations (name) VALUES (?)", new String[] { "id" })) {
            ps.setString(1, name);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                keys.next();
                long id = keys.getLong(1);
                conn.commit();
                return id;
            }
        }
    }

    public static long insertNode(Database db, long collaborationId, String name) throws SQLException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "INSERT INTO nodes (name, collaboration_id) VALUES (?, ?)", new String[] { "id" })) {
            ps.setString(1, name);
            ps.setLong(2, collaborationId);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                keys.next();
                long id = keys.getLong(1);
                conn.commit();
                return id;
            }
        }
    }

    /** Collaboration with the given member nodes; returns the node ids in insertion order. */
    public static List<Long> insertNodes(Database db, long collaborationId, String... names) throws SQLException {
        List<Long> ids = new ArrayList<>();
        for (String name : names) {
            ids.add(insertNode(db, collaborationId, name));
        }
        return ids;
    }

    public static void removeNode(Database db, long nodeId) throws SQLException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM nodes WHERE id = ?")) {
            ps.setLong(1, nodeId);
            ps.executeUpdate();
            conn.commit();
        }
    }

    public static int countRows(Database db, String table) throws SQLException {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    public static int countResultRows(Database db, long taskId) throws SQLException {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM task_results WHERE task_id = ?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    public static void clear(Database db) throws SQLException {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement()) {
            st.execute("DELETE FROM task_results");
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM nodes");
            st.execute("DELETE FROM collaborations");
            conn.commit();
        }
    }
}
