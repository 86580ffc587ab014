package taskhub.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import taskhub.coordinator.api.Controller;
import taskhub.coordinator.api.v1.dto.CreateTaskRequest;
import taskhub.coordinator.api.v1.dto.MessageResponse;
import taskhub.coordinator.api.v1.dto.TaskResponse;
import taskhub.coordinator.api.v1.dto.TaskResultResponse;
import taskhub.coordinator.model.Task;
import taskhub.coordinator.repository.StoreException;
import taskhub.coordinator.server.RouterHandler;
import taskhub.coordinator.service.MissingFieldException;
import taskhub.coordinator.service.NotFoundException;
import taskhub.coordinator.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the task lifecycle (public API).
 *
 * GET /api/v1/task - List tasks
 * POST /api/v1/task - Create a task and fan it out to the collaboration's nodes
 * GET /api/v1/task/{id} - Get a task
 * DELETE /api/v1/task/{id} - Delete a task and its results
 * GET /api/v1/task/{id}/result - Get the task's per-node results
 *
 * Both GET task routes accept {@code ?include=results}.
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    /** Header naming the acting principal, for the audit log only */
    public static final String PRINCIPAL_HEADER = "X-Principal";

    private static final Pattern TASKS_PATTERN = Pattern.compile("^/api/v1/task$");
    private static final Pattern TASK_BY_ID_PATTERN = Pattern.compile("^/api/v1/task/(\\d+)$");
    private static final Pattern TASK_RESULTS_PATTERN = Pattern.compile("^/api/v1/task/(\\d+)/result$");

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TASKS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.POST);
        }
        if (TASK_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.DELETE);
        }
        return method.equals(HttpMethod.GET) && TASK_RESULTS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TASKS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST)
                        ? handleCreate(req)
                        : handleList(includeResults(req));
            }

            Matcher resultsMatcher = TASK_RESULTS_PATTERN.matcher(path);
            if (resultsMatcher.matches()) {
                OptionalLong taskId = parseTaskId(resultsMatcher.group(1));
                return taskId.isPresent()
                        ? handleGetResults(taskId.getAsLong())
                        : unknownTask(resultsMatcher.group(1));
            }

            Matcher taskMatcher = TASK_BY_ID_PATTERN.matcher(path);
            if (taskMatcher.matches()) {
                OptionalLong taskId = parseTaskId(taskMatcher.group(1));
                if (taskId.isEmpty()) {
                    return unknownTask(taskMatcher.group(1));
                }
                return req.method().equals(HttpMethod.DELETE)
                        ? handleDelete(taskId.getAsLong())
                        : handleGet(taskId.getAsLong(), includeResults(req));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (NotFoundException e) {
            return ControllerResponse.notFound(e.getMessage());
        } catch (MissingFieldException e) {
            log.warn("Rejected task creation: {} - body: {}", e.getMessage(),
                    req.content().toString(StandardCharsets.UTF_8));
            return ControllerResponse.badRequest(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("malformed JSON body: " + e.getOriginalMessage());
        } catch (StoreException e) {
            log.error("Task store failure on {} {}", req.method(), path, e);
            return ControllerResponse.error("internal error");
        } catch (Exception e) {
            log.error("Task controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/task - Create a task
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new MissingFieldException("collaboration_id");
        }
        CreateTaskRequest request = RouterHandler.mapper().readValue(body, CreateTaskRequest.class);
        if (request == null) {
            // literal JSON null
            throw new MissingFieldException("collaboration_id");
        }

        Task task = taskService.createTask(request.toCommand(), req.headers().get(PRINCIPAL_HEADER));

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    /**
     * GET /api/v1/task - List tasks
     */
    private ControllerResponse handleList(boolean includeResults) throws Exception {
        List<TaskResponse> response = taskService.listTasks(includeResults).stream()
                .map(TaskResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/task/{id} - Get a task
     */
    private ControllerResponse handleGet(long taskId, boolean includeResults) throws Exception {
        TaskResponse response = TaskResponse.from(taskService.getTask(taskId, includeResults));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * DELETE /api/v1/task/{id} - Delete a task
     */
    private ControllerResponse handleDelete(long taskId) throws Exception {
        taskService.deleteTask(taskId);
        MessageResponse response = new MessageResponse("task id=" + taskId + " successfully deleted");
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/task/{id}/result - Get task results
     */
    private ControllerResponse handleGetResults(long taskId) throws Exception {
        List<TaskResultResponse> response = taskService.getResults(taskId).stream()
                .map(TaskResultResponse::from)
                .toList();
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * Route ids are all digits; ids beyond the range of a long cannot name a task.
     */
    private static OptionalLong parseTaskId(String digits) {
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static ControllerResponse unknownTask(String id) {
        return ControllerResponse.notFound("task id=" + id + " not found");
    }

    private static boolean includeResults(FullHttpRequest req) {
        List<String> include = new QueryStringDecoder(req.uri()).parameters().get("include");
        return include != null && include.contains("results");
    }
}
