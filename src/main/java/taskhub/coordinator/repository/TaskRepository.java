package taskhub.coordinator.repository;

import taskhub.coordinator.model.Task;
import taskhub.coordinator.model.TaskResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Task and TaskResult persistence.
 * Results are never attached to a task implicitly; callers fetch them with
 * {@link #findResultsByTaskId} or {@link #findResultsByTaskIds}.
 */
public interface TaskRepository {

    /**
     * Persist a new task together with one empty result per node, as a single
     * unit. Either every row becomes visible or none does.
     *
     * @param task    the task to save (its id is ignored and assigned here)
     * @param nodeIds nodes to create result slots for
     * @return the persisted task with its assigned id
     * @throws StoreException if the unit could not be committed
     */
    Task createWithResults(Task task, List<Long> nodeIds);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(long taskId);

    /**
     * Get all tasks, oldest first.
     *
     * @return list of all tasks
     */
    List<Task> findAll();

    /**
     * Get the results of one task, in creation order.
     * Existence and results are read in one statement, so a concurrent delete
     * never yields an empty list for a task that is gone.
     *
     * @param taskId the task ID
     * @return the results (possibly none), or empty if the task does not exist
     */
    Optional<List<TaskResult>> findResultsByTaskId(long taskId);

    /**
     * Get the results of several tasks with a single query.
     *
     * @param taskIds task IDs
     * @return results grouped by task ID; tasks without results map to an empty list
     */
    Map<Long, List<TaskResult>> findResultsByTaskIds(Collection<Long> taskIds);

    /**
     * Delete a task and all of its results in one transaction.
     *
     * @param taskId the task ID
     * @return true if a task was deleted
     */
    boolean delete(long taskId);

    /**
     * Count all tasks.
     */
    int count();
}
