package taskhub.coordinator.service;

public class TaskNotFoundException extends NotFoundException {

    private final long taskId;

    public TaskNotFoundException(long taskId) {
        super("task id=" + taskId + " not found");
        this.taskId = taskId;
    }

    public long taskId() {
        return taskId;
    }
}
