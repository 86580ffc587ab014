package taskhub;

import taskhub.coordinator.config.CoordinatorConfig;
import taskhub.coordinator.config.Dependencies;
import taskhub.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Application entry point. Runs the coordinator until the JVM is asked to stop.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);

        if (!CoordinatorNettyServer.start(deps)) {
            log.error("Coordinator server did not start, exiting");
            deps.close();
            System.exit(1);
        }

        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            CoordinatorNettyServer.stop();
            deps.close();
            shutdown.countDown();
        }, "taskhub-shutdown"));

        shutdown.await();
    }
}
