package taskhub.coordinator.config;

import taskhub.coordinator.api.v1.HealthController;
import taskhub.coordinator.api.v1.TaskController;
import taskhub.coordinator.notification.Notifier;
import taskhub.coordinator.notification.RoomRegistry;
import taskhub.coordinator.notification.WebSocketNotifier;
import taskhub.coordinator.repository.CollaborationRepository;
import taskhub.coordinator.repository.TaskRepository;
import taskhub.coordinator.server.RouterHandler;
import taskhub.coordinator.service.TaskService;
import taskhub.coordinator.store.Database;
import taskhub.coordinator.store.JdbcCollaborationRepository;
import taskhub.coordinator.store.JdbcTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(CoordinatorConfig.fromEnv());
 * CoordinatorNettyServer.start(deps);
 * // ... serve ...
 * CoordinatorNettyServer.stop();
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final CoordinatorConfig config;
    private final Database database;
    private final TaskRepository taskRepository;
    private final CollaborationRepository collaborationRepository;
    private final RoomRegistry roomRegistry;
    private final Notifier notifier;
    private final TaskService taskService;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(CoordinatorConfig config, Notifier notifierOverride) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.roomRegistry = new RoomRegistry();
        this.notifier = notifierOverride != null
                ? notifierOverride
                : new WebSocketNotifier(roomRegistry, RouterHandler.mapper());

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.collaborationRepository = new JdbcCollaborationRepository(database);

        // Services
        this.taskService = new TaskService(taskRepository, collaborationRepository, notifier, RouterHandler.mapper());

        // Controllers
        this.healthController = new HealthController(database, collaborationRepository, taskService);
        this.taskController = new TaskController(taskService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(CoordinatorConfig config) {
        return new Dependencies(config, null);
    }

    /**
     * Create dependencies that push notifications through the given notifier
     * instead of the WebSocket rooms.
     */
    public static Dependencies create(CoordinatorConfig config, Notifier notifier) {
        return new Dependencies(config, notifier);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(CoordinatorConfig.fromEnv());
    }

    // Getters
    public CoordinatorConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public CollaborationRepository collaborationRepository() {
        return collaborationRepository;
    }

    public RoomRegistry roomRegistry() {
        return roomRegistry;
    }

    public Notifier notifier() {
        return notifier;
    }

    public TaskService taskService() {
        return taskService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", 2);
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
