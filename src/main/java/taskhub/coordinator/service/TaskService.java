package taskhub.coordinator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import taskhub.coordinator.model.Collaboration;
import taskhub.coordinator.model.Task;
import taskhub.coordinator.model.TaskResult;
import taskhub.coordinator.model.TaskView;
import taskhub.coordinator.notification.Notifier;
import taskhub.coordinator.repository.CollaborationRepository;
import taskhub.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Business logic for the task lifecycle: creation with per-node fan-out,
 * retrieval and deletion.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final CollaborationRepository collaborationRepository;
    private final Notifier notifier;
    private final ObjectMapper mapper;

    public TaskService(TaskRepository taskRepository, CollaborationRepository collaborationRepository,
            Notifier notifier, ObjectMapper mapper) {
        this.taskRepository = taskRepository;
        this.collaborationRepository = collaborationRepository;
        this.notifier = notifier;
        this.mapper = mapper;
    }

    /**
     * Create a task for a collaboration and one empty result per member node.
     * <p>
     * The task and its results are committed as one unit. Once committed, a
     * {@code new_task} event carrying the task id is emitted to the
     * collaboration's room; a failed emit is logged and does not undo the task.
     *
     * @param command the creation request
     * @param actor   acting principal, used for audit logging only (may be null)
     * @return the persisted task
     * @throws MissingFieldException           if no collaboration id was given
     * @throws CollaborationNotFoundException if the collaboration does not exist
     */
    public Task createTask(CreateTaskCommand command, String actor) {
        if (command.collaborationId() == null) {
            throw new MissingFieldException("collaboration_id");
        }

        Collaboration collaboration = collaborationRepository.findById(command.collaborationId())
                .orElseThrow(() -> new CollaborationNotFoundException(command.collaborationId()));

        Task draft = Task.builder()
                .collaborationId(collaboration.id())
                .name(command.name())
                .description(command.description())
                .image(command.image())
                .input(normalizeInput(command.input()))
                .status(Task.STATUS_OPEN)
                .build();

        List<Long> nodeIds = collaboration.nodeIds();
        Task task = taskRepository.createWithResults(draft, nodeIds);

        log.info("New task {} created for collaboration '{}'", task.id(), collaboration.name());
        log.debug(" created by: '{}'", actor);
        log.debug(" name: '{}'", task.name());
        log.debug(" image: '{}'", task.image());
        log.debug("Assigned task {} to {} nodes", task.id(), nodeIds.size());

        notifyNewTask(task, collaboration.room());
        return task;
    }

    /**
     * Get one task.
     *
     * @param includeResults embed the task's results in the view
     * @throws TaskNotFoundException if the task does not exist
     */
    public TaskView getTask(long taskId, boolean includeResults) {
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));

        if (!includeResults) {
            return TaskView.withoutResults(task);
        }
        List<TaskResult> results = taskRepository.findResultsByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
        return TaskView.withResults(task, results);
    }

    /**
     * Get every task; the include flag applies to each element alike.
     */
    public List<TaskView> listTasks(boolean includeResults) {
        List<Task> tasks = taskRepository.findAll();
        if (!includeResults) {
            return tasks.stream().map(TaskView::withoutResults).toList();
        }

        Map<Long, List<TaskResult>> results = taskRepository.findResultsByTaskIds(
                tasks.stream().map(Task::id).toList());
        return tasks.stream()
                .map(t -> TaskView.withResults(t, results.getOrDefault(t.id(), List.of())))
                .toList();
    }

    /**
     * Get the results of a task.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public List<TaskResult> getResults(long taskId) {
        return taskRepository.findResultsByTaskId(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Delete a task and its results.
     * Whether tasks with reported results may be deleted is decided by the
     * caller.
     *
     * @throws TaskNotFoundException if the task does not exist
     */
    public void deleteTask(long taskId) {
        if (!taskRepository.delete(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        log.info("Deleted task {}", taskId);
    }

    public int countTasks() {
        return taskRepository.count();
    }

    private void notifyNewTask(Task task, String room) {
        try {
            notifier.emit(Notifier.NEW_TASK, task.id(), room);
        } catch (RuntimeException e) {
            log.warn("Task {} created but notifying {} failed: {}", task.id(), room, e.getMessage(), e);
        }
    }

    String normalizeInput(JsonNode input) {
        if (input == null || input.isNull() || input.isMissingNode()) {
            return "";
        }
        if (input.isTextual()) {
            return input.asText();
        }
        try {
            return mapper.writeValueAsString(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("input could not be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
