package com.capturequeue.app;

import com.capturequeue.config.PipelineConfig;
import com.capturequeue.db.Database;
import com.capturequeue.db.ItemRepository;
import com.capturequeue.db.JobRepository;
import com.capturequeue.engine.EventBroadcaster;
import com.capturequeue.engine.QueueOrchestrator;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Main application entry point for the capture queue.
 * Wires the store, the orchestrator and the status server, then runs a pass on a fixed delay.
 * URLs given on the command line are enqueued as one job at startup.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static Database database;
    private static EventBroadcaster broadcaster;
    private static QueueOrchestrator orchestrator;
    private static ScheduledExecutorService passScheduler;
    private static StatusServer statusServer;

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== Capture Queue Starting ===");

        try {
            PipelineConfig config = PipelineConfig.load();

            // 1. Initialize database
            database = Database.fromConfig(config);
            database.initialize();
            ItemRepository itemRepository = new ItemRepository(database);
            JobRepository jobRepository = new JobRepository(database);

            // 2. Build the orchestrator and recover items left in flight
            initializeOrchestrator(config, itemRepository, jobRepository);

            // 3. Schedule passes
            passScheduler = Executors.newSingleThreadScheduledExecutor();
            passScheduler.scheduleWithFixedDelay(Main::runPass, 0, config.getPollIntervalMs(), TimeUnit.MILLISECONDS);
            CaptureService captureService = new CaptureService(itemRepository, jobRepository, passScheduler, Main::runPass);

            if (args.length > 0) {
                List<String> urls = Arrays.asList(args);
                logger.info("Enqueued job " + captureService.enqueueUrls(urls).getId() + " from command line");
            }

            // 4. Status server
            statusServer = new StatusServer(new HealthStatusService(jobRepository), jobRepository,
                    orchestrator, config.getStatusPort());
            statusServer.start();

            // 5. Graceful shutdown
            Runtime.getRuntime().addShutdownHook(new Thread(Main::shutdown, "shutdown-hook"));

            logger.info("=== Capture Queue is running ===");
            logger.info("Status available at http://localhost:" + statusServer.getPort() + "/health");

        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            shutdown();
            System.exit(1);
        }
    }

    private static void initializeOrchestrator(PipelineConfig config, ItemRepository itemRepository,
                                               JobRepository jobRepository) {
        broadcaster = new EventBroadcaster();
        broadcaster.addListener(event -> logger.info("Event: " + event));

        orchestrator = QueueOrchestrator.builder()
                .config(config)
                .storage(itemRepository)
                .jobTracker(jobRepository)
                .fetcher(new HttpContentFetcher(config.getMaxContentBytes()))
                .markdownExtractor(new BasicMarkdownExtractor())
                // No Q&A or embedding service is bundled; items complete with markdown only.
                // Replace both together: pairs cannot be stored without embeddings.
                .qaGenerator(markdown -> List.of())
                .embeddingProvider(new UnconfiguredEmbeddingProvider())
                .eventSink(broadcaster)
                .syncTrigger(() -> logger.fine("Sync disabled"))
                .build();
        orchestrator.start();
    }

    // Scheduled tasks stop repeating after an uncaught exception
    private static void runPass() {
        try {
            orchestrator.run();
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Pass failed unexpectedly", e);
        }
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to load logging.properties, using JDK defaults", e);
        }
    }

    private static void shutdown() {
        logger.info("Shutting down...");
        if (statusServer != null) {
            statusServer.stop();
        }
        if (passScheduler != null) {
            passScheduler.shutdown();
        }
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
        if (passScheduler != null) {
            try {
                if (!passScheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                    passScheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                passScheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (broadcaster != null) {
            broadcaster.shutdown();
        }
        if (database != null) {
            database.close();
        }
        logger.info("=== Capture Queue stopped ===");
    }
}
