package taskhub.coordinator.model;

import java.util.List;

/**
 * A task together with its results when they were explicitly requested.
 * {@code results} is null when the caller did not ask for them.
 */
public record TaskView(Task task, List<TaskResult> results) {

    public static TaskView withoutResults(Task task) {
        return new TaskView(task, null);
    }

    public static TaskView withResults(Task task, List<TaskResult> results) {
        return new TaskView(task, List.copyOf(results));
    }

    public boolean includesResults() {
        return results != null;
    }
}
