package taskhub.coordinator.store;

import taskhub.coordinator.model.Collaboration;
import taskhub.coordinator.model.Node;
import taskhub.coordinator.repository.CollaborationRepository;
import taskhub.coordinator.repository.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of CollaborationRepository.
 * The collaboration row and its node list are read on one connection so the
 * snapshot reflects a single point in time.
 */
public class JdbcCollaborationRepository implements CollaborationRepository {

    private final Database db;

    public JdbcCollaborationRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<Collaboration> findById(long collaborationId) {
        try (Connection conn = db.getConnection()) {
            try {
                String name;
                try (PreparedStatement ps = conn.prepareStatement("SELECT name FROM collaborations WHERE id = ?")) {
                    ps.setLong(1, collaborationId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.commit();
                            return Optional.empty();
                        }
                        name = rs.getString("name");
                    }
                }

                List<Node> nodes = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(
                        "SELECT id, name FROM nodes WHERE collaboration_id = ? ORDER BY id")) {
                    ps.setLong(1, collaborationId);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            nodes.add(new Node(rs.getLong("id"), rs.getString("name"), collaborationId));
                        }
                    }
                }

                conn.commit();
                return Optional.of(new Collaboration(collaborationId, name, nodes));
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find collaboration: " + collaborationId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM collaborations");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count collaborations", e);
        }
    }
}
