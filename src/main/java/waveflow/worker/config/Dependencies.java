package waveflow.worker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waveflow.worker.api.v1.HealthController;
import waveflow.worker.api.v1.StatsController;
import waveflow.worker.audio.AudioFormatSniffer;
import waveflow.worker.audio.ContentHasher;
import waveflow.worker.audio.StemMixer;
import waveflow.worker.audio.WavEncoder;
import waveflow.worker.audio.WaveformEngine;
import waveflow.worker.cleanup.TempFileSweeper;
import waveflow.worker.consumer.ConsumerPool;
import waveflow.worker.consumer.ConsumerStats;
import waveflow.worker.consumer.QueueConsumer;
import waveflow.worker.dispatch.MessageDecoder;
import waveflow.worker.dispatch.TaskRouter;
import waveflow.worker.executor.RetryPolicy;
import waveflow.worker.executor.TaskExecutor;
import waveflow.worker.executor.WorkArea;
import waveflow.worker.health.HealthProbe;
import waveflow.worker.notify.HttpWebhookNotifier;
import waveflow.worker.notify.Notifier;
import waveflow.worker.queue.MessageQueue;
import waveflow.worker.queue.SqsMessageQueue;
import waveflow.worker.scheduler.Scheduler;
import waveflow.worker.server.HealthServer;
import waveflow.worker.server.RouterHandler;
import waveflow.worker.storage.ObjectStore;
import waveflow.worker.storage.S3ObjectStore;
import waveflow.worker.tasks.AnalyzeAudioHandler;
import waveflow.worker.tasks.CleanupTempHandler;
import waveflow.worker.tasks.DeleteDuplicateHandler;
import waveflow.worker.tasks.HashAndNotifyHandler;
import waveflow.worker.tasks.HealthCheckHandler;
import waveflow.worker.tasks.MixStemsHandler;

import java.time.Duration;

/**
 * Manual dependency injection container.
 * Creates and wires all worker components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(WorkerConfig.fromEnv());
 * deps.start(); // status server, scheduler, pollers
 * // ... runs until shutdown ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkerConfig config;

    // Gateways
    private final ObjectStore objectStore;
    private final MessageQueue messageQueue;
    private final Notifier notifier;

    // Pipeline
    private final WorkArea workArea;
    private final TempFileSweeper sweeper;
    private final HealthProbe healthProbe;
    private final TaskRouter taskRouter;
    private final TaskExecutor taskExecutor;
    private final MessageDecoder messageDecoder;
    private final ConsumerStats stats = new ConsumerStats();

    // Lazy-initialized
    private ConsumerPool consumerPool;
    private Scheduler scheduler;
    private HealthServer healthServer;

    private Dependencies(WorkerConfig config, ObjectStore objectStore, MessageQueue messageQueue, Notifier notifier) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        this.objectStore = objectStore;
        this.messageQueue = messageQueue;
        this.notifier = notifier;

        this.workArea = new WorkArea(config.tempDir());
        this.sweeper = new TempFileSweeper(config.tempDir(), config.cleanupMaxAge(), config.cleanupAggressiveAge());
        this.healthProbe = new HealthProbe(objectStore, messageQueue);

        WaveformEngine engine = WaveformEngine.standard();
        this.taskRouter = new TaskRouter(
                new HashAndNotifyHandler(objectStore, new ContentHasher(), notifier),
                new DeleteDuplicateHandler(objectStore, notifier),
                new AnalyzeAudioHandler(objectStore, engine, new AudioFormatSniffer(), notifier, config),
                new MixStemsHandler(objectStore, engine, new StemMixer(), new WavEncoder(), notifier,
                        config.maxPeaks()),
                new HealthCheckHandler(healthProbe),
                new CleanupTempHandler(sweeper));

        this.taskExecutor = new TaskExecutor(RetryPolicy.from(config), config.retryFatalErrors(), workArea, notifier);
        this.messageDecoder = new MessageDecoder(config.defaultTask());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies backed by S3, SQS and HTTP webhooks.
     */
    public static Dependencies create(WorkerConfig config) {
        return new Dependencies(config,
                S3ObjectStore.create(config),
                SqsMessageQueue.create(config),
                new HttpWebhookNotifier(config.webhookUrl(), config.webhookTimeout()));
    }

    /**
     * Create dependencies around the given gateways.
     */
    public static Dependencies create(WorkerConfig config, ObjectStore store, MessageQueue queue, Notifier notifier) {
        return new Dependencies(config, store, queue, notifier);
    }

    // Getters
    public WorkerConfig config() {
        return config;
    }

    public ObjectStore objectStore() {
        return objectStore;
    }

    public MessageQueue messageQueue() {
        return messageQueue;
    }

    public Notifier notifier() {
        return notifier;
    }

    public TaskRouter taskRouter() {
        return taskRouter;
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    public MessageDecoder messageDecoder() {
        return messageDecoder;
    }

    public ConsumerStats stats() {
        return stats;
    }

    public HealthProbe healthProbe() {
        return healthProbe;
    }

    /**
     * Build one poller. Pollers share the stats counters and nothing else mutable.
     */
    public QueueConsumer newConsumer(String name) {
        return new QueueConsumer(name, messageQueue, messageDecoder, taskRouter, taskExecutor, stats,
                config.pollWait(), config.visibilityTimeout(), config.pollErrorBackoff());
    }

    public synchronized ConsumerPool consumerPool() {
        if (consumerPool == null) {
            // a receive in flight may block for the full poll wait
            Duration grace = config.pollWait().plus(config.visibilityTimeout());
            consumerPool = new ConsumerPool(config.pollers(), i -> newConsumer("poller-" + (i + 1)), grace);
        }
        return consumerPool;
    }

    public synchronized Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(sweeper, stats, config);
        }
        return scheduler;
    }

    /**
     * Status server with the health and stats controllers registered.
     */
    public synchronized HealthServer healthServer() {
        if (healthServer == null) {
            RouterHandler router = new RouterHandler()
                    .registerController(new HealthController(healthProbe))
                    .registerController(new StatsController(stats, config.pollers()));
            healthServer = new HealthServer(router);
        }
        return healthServer;
    }

    /**
     * Start the status server (unless its port is 0), the scheduler and the pollers.
     */
    public void start() {
        if (config.healthPort() > 0) {
            healthServer().start(config.healthPort());
        }
        scheduler().start();
        consumerPool().start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop pollers first so in-flight messages finish against live clients
        if (consumerPool != null) {
            try {
                consumerPool.stop();
            } catch (Exception e) {
                log.warn("Error stopping pollers: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (healthServer != null) {
            try {
                healthServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping status server: {}", e.getMessage());
            }
        }

        closeQuietly(objectStore, "object store");
        closeQuietly(messageQueue, "message queue");

        log.info("Dependencies closed");
    }

    private static void closeQuietly(Object resource, String name) {
        if (resource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
