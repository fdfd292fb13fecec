package waveflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.config.Dependencies;
import waveflow.worker.config.MissingConfigurationException;
import waveflow.worker.config.WorkerConfig;

/**
 * Worker process entry point.
 *
 * Reads configuration from the environment, starts the pollers and runs until
 * the JVM receives a termination signal. In-flight messages finish before exit.
 */
public class WorkerApp {

    private static final Logger log = LoggerFactory.getLogger(WorkerApp.class);

    static final int EXIT_CONFIG_ERROR = 2;

    public static void main(String[] args) {
        WorkerConfig config;
        try {
            config = WorkerConfig.fromEnv();
        } catch (MissingConfigurationException e) {
            log.error("{}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(EXIT_CONFIG_ERROR);
            return;
        }

        Dependencies deps = Dependencies.create(config);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, finishing in-flight work...");
            deps.close();
        }, "waveflow-shutdown"));

        try {
            deps.start();
        } catch (RuntimeException e) {
            log.error("Worker failed to start", e);
            System.exit(1);
        }
        log.info("Worker started: {} poller(s) on {}", config.pollers(), config.queueUrl());
    }
}
