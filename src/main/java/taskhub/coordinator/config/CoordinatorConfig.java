package taskhub.coordinator.config;

/**
 * Configuration holder for Coordinator settings.
 * All settings have sensible defaults.
 */
public final class CoordinatorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/taskhub;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private int maxContentLength = 1024 * 1024;

    // Notification settings
    private String notificationPath = "/tasks";

    private CoordinatorConfig() {
    }

    public static CoordinatorConfig defaults() {
        return new CoordinatorConfig();
    }

    public static CoordinatorConfig fromEnv() {
        CoordinatorConfig config = new CoordinatorConfig();

        String dbUrl = System.getenv("TASKHUB_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String poolSize = System.getenv("TASKHUB_DB_POOL_SIZE");
        if (poolSize != null && !poolSize.isBlank()) {
            config.databasePoolSize = Integer.parseInt(poolSize);
        }

        String host = System.getenv("TASKHUB_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host;
        }

        String port = System.getenv("TASKHUB_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String notifyPath = System.getenv("TASKHUB_NOTIFY_PATH");
        if (notifyPath != null && !notifyPath.isBlank()) {
            config.notificationPath = notifyPath;
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public int maxContentLength() {
        return maxContentLength;
    }

    /** WebSocket path nodes connect to for room notifications. */
    public String notificationPath() {
        return notificationPath;
    }

    // Fluent setters for testing/customization
    public CoordinatorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public CoordinatorConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public CoordinatorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public CoordinatorConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public CoordinatorConfig withNotificationPath(String path) {
        this.notificationPath = path;
        return this;
    }

    @Override
    public String toString() {
        return "CoordinatorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", poolSize=" + databasePoolSize +
                ", serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", notificationPath='" + notificationPath + '\'' +
                '}';
    }
}
