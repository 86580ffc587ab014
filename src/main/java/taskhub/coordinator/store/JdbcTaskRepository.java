package taskhub.coordinator.store;

import taskhub.coordinator.model.Task;
import taskhub.coordinator.model.TaskResult;
import taskhub.coordinator.repository.StoreException;
import taskhub.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * JDBC implementation of TaskRepository.
 * Task and result rows that belong together are always written or removed
 * inside one transaction on one pooled connection.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public Task createWithResults(Task task, List<Long> nodeIds) {
        String insertTask = """
                    INSERT INTO tasks (collaboration_id, name, description, image, input, status, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;
        String insertResult = """
                    INSERT INTO task_results (task_id, node_id, assigned_at)
                    VALUES (?, ?, ?)
                """;

        // millisecond precision survives the TIMESTAMP column unchanged
        Instant createdAt = (task.createdAt() != null ? task.createdAt() : Instant.now())
                .truncatedTo(ChronoUnit.MILLIS);

        try (Connection conn = db.getConnection()) {
            try {
                long taskId;
                try (PreparedStatement ps = conn.prepareStatement(insertTask, new String[] { "id" })) {
                    ps.setLong(1, task.collaborationId());
                    ps.setString(2, task.name());
                    ps.setString(3, task.description());
                    ps.setString(4, task.image());
                    ps.setString(5, task.input());
                    ps.setString(6, task.status());
                    ps.setTimestamp(7, Timestamp.from(createdAt));
                    ps.executeUpdate();

                    try (ResultSet keys = ps.getGeneratedKeys()) {
                        if (!keys.next()) {
                            throw new SQLException("No id generated for task");
                        }
                        taskId = keys.getLong(1);
                    }
                }

                if (!nodeIds.isEmpty()) {
                    try (PreparedStatement ps = conn.prepareStatement(insertResult)) {
                        Timestamp assignedAt = Timestamp.from(createdAt);
                        for (Long nodeId : nodeIds) {
                            ps.setLong(1, taskId);
                            ps.setLong(2, nodeId);
                            ps.setTimestamp(3, assignedAt);
                            ps.addBatch();
                        }
                        ps.executeBatch();
                    }
                }

                conn.commit();
                log.debug("Saved task {} with {} results", taskId, nodeIds.size());

                return task.toBuilder()
                        .id(taskId)
                        .createdAt(createdAt)
                        .build();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to save task for collaboration: " + task.collaborationId(), e);
        }
    }

    @Override
    public Optional<Task> findById(long taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapTask(rs));
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findAll() {
        String sql = "SELECT * FROM tasks ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<Task> tasks = new ArrayList<>();
            while (rs.next()) {
                tasks.add(mapTask(rs));
            }
            return tasks;
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks", e);
        }
    }

    @Override
    public Optional<List<TaskResult>> findResultsByTaskId(long taskId) {
        String sql = """
                SELECT t.id AS owner_id, r.id, r.task_id, r.node_id, r.result, r.log,
                       r.assigned_at, r.started_at, r.finished_at
                FROM tasks t
                LEFT JOIN task_results r ON r.task_id = t.id
                WHERE t.id = ?
                ORDER BY r.id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                List<TaskResult> results = new ArrayList<>();
                do {
                    // a task without results joins to a single all-null row
                    if (rs.getObject("id") != null) {
                        results.add(mapResult(rs));
                    }
                } while (rs.next());
                return Optional.of(results);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find results for task: " + taskId, e);
        }
    }

    @Override
    public Map<Long, List<TaskResult>> findResultsByTaskIds(Collection<Long> taskIds) {
        Map<Long, List<TaskResult>> grouped = new LinkedHashMap<>();
        if (taskIds.isEmpty()) {
            return grouped;
        }
        for (Long taskId : taskIds) {
            grouped.put(taskId, new ArrayList<>());
        }

        String placeholders = String.join(",", Collections.nCopies(taskIds.size(), "?"));
        String sql = "SELECT * FROM task_results WHERE task_id IN (" + placeholders + ") ORDER BY task_id, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int i = 1;
            for (Long taskId : taskIds) {
                ps.setLong(i++, taskId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    TaskResult result = mapResult(rs);
                    grouped.computeIfAbsent(result.taskId(), k -> new ArrayList<>()).add(result);
                }
            }
            return grouped;
        } catch (SQLException e) {
            throw new StoreException("Failed to find results for " + taskIds.size() + " tasks", e);
        }
    }

    @Override
    public boolean delete(long taskId) {
        // Results first, so nothing is left behind even without the FK cascade
        try (Connection conn = db.getConnection()) {
            try {
                int removedResults;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM task_results WHERE task_id = ?")) {
                    ps.setLong(1, taskId);
                    removedResults = ps.executeUpdate();
                }

                int deleted;
                try (PreparedStatement ps = conn.prepareStatement("DELETE FROM tasks WHERE id = ?")) {
                    ps.setLong(1, taskId);
                    deleted = ps.executeUpdate();
                }

                if (deleted == 0) {
                    conn.rollback();
                    return false;
                }

                conn.commit();
                log.debug("Deleted task {} and {} results", taskId, removedResults);
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to delete task: " + taskId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM tasks");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    // --- Helpers ---

    private Task mapTask(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getLong("id"))
                .collaborationId(rs.getLong("collaboration_id"))
                .name(rs.getString("name"))
                .description(rs.getString("description"))
                .image(rs.getString("image"))
                .input(rs.getString("input"))
                .status(rs.getString("status"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }

    private TaskResult mapResult(ResultSet rs) throws SQLException {
        return TaskResult.builder()
                .id(rs.getLong("id"))
                .taskId(rs.getLong("task_id"))
                .nodeId(rs.getLong("node_id"))
                .result(rs.getString("result"))
                .log(rs.getString("log"))
                .assignedAt(toInstant(rs.getTimestamp("assigned_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .finishedAt(toInstant(rs.getTimestamp("finished_at")))
                .build();
    }

    private Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
