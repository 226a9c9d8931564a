package com.capturequeue.app;

import com.capturequeue.core.Job;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobMetadata;
import com.capturequeue.core.JobStats;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.db.JobRepository;
import com.capturequeue.engine.QueueOrchestrator;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

// HTTP server exposing queue health and job progress as JSON
public class StatusServer {
    private static final Logger logger = Logger.getLogger(StatusServer.class.getName());

    private final HealthStatusService healthService;
    private final JobRepository jobRepository;
    private final QueueOrchestrator orchestrator;
    private final int port;
    private final long startTime;
    private HttpServer server;
    private ExecutorService executor;

    public StatusServer(HealthStatusService healthService, JobRepository jobRepository,
                        QueueOrchestrator orchestrator, int port) {
        this.healthService = healthService;
        this.jobRepository = jobRepository;
        this.orchestrator = orchestrator;
        this.port = port;
        this.startTime = System.currentTimeMillis();
    }

    // Start HTTP server and register endpoints
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/health", new HealthHandler());
        server.createContext("/jobs/", new JobHandler());

        executor = Executors.newFixedThreadPool(4);
        server.setExecutor(executor);
        server.start();

        logger.info("Status server started on port " + getPort());
    }

    // Stop HTTP server gracefully
    public void stop() {
        if (server != null) {
            server.stop(2);
            executor.shutdown();
            logger.info("Status server stopped");
        }
    }

    /**
     * @return the bound port; differs from the configured one when started on port 0
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    // GET /health
    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            try {
                HealthStatus health = healthService.getHealthStatus();

                JSONObject json = new JSONObject();
                json.put("state", health.getState().name().toLowerCase());
                json.put("message", health.getMessage());
                if (health.hasDetails()) {
                    JSONObject details = new JSONObject();
                    details.put("pendingCount", health.getPendingCount());
                    details.put("inProgressCount", health.getInProgressCount());
                    details.put("failedCount", health.getFailedCount());
                    json.put("details", details);
                }
                json.put("queue", new JSONObject(orchestrator.getStatus()));
                json.put("uptime_seconds", (System.currentTimeMillis() - startTime) / 1000);

                sendJson(exchange, 200, json);
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error handling health request", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }
    }

    // GET /jobs/{id}
    private class JobHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }
            String jobId = exchange.getRequestURI().getPath().substring("/jobs/".length());
            if (jobId.isEmpty() || jobId.contains("/")) {
                sendError(exchange, 404, "Not Found");
                return;
            }
            try {
                Job job = jobRepository.getJob(jobId);
                if (job == null) {
                    sendError(exchange, 404, "Job not found: " + jobId);
                    return;
                }
                JobStats stats = jobRepository.getJobStats(jobId);
                List<JobItem> jobItems = jobRepository.getJobItems(jobId);
                sendJson(exchange, 200, toJson(job, stats, jobItems));
            } catch (StorageFailure e) {
                logger.log(Level.SEVERE, "Failed to load job " + jobId, e);
                sendError(exchange, 500, "Internal Server Error: " + e.getMessage());
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Unexpected error handling job request", e);
                sendError(exchange, 500, "Internal Server Error");
            }
        }

        private JSONObject toJson(Job job, JobStats stats, List<JobItem> jobItems) {
            JSONObject json = new JSONObject();
            json.put("id", job.getId());
            json.put("type", job.getType().name());
            json.put("status", job.getStatus().name());
            json.put("createdAt", job.getCreatedAt().toString());
            json.put("updatedAt", job.getUpdatedAt().toString());

            JobMetadata metadata = job.getMetadata();
            JSONObject meta = new JSONObject();
            meta.putOpt("fileName", metadata.getFileName());
            meta.putOpt("importedCount", metadata.getImportedCount());
            meta.putOpt("skippedCount", metadata.getSkippedCount());
            meta.putOpt("totalUrls", metadata.getTotalUrls());
            meta.putOpt("successCount", metadata.getSuccessCount());
            meta.putOpt("failureCount", metadata.getFailureCount());
            meta.putOpt("url", metadata.getUrl());
            meta.putOpt("itemId", metadata.getItemId());
            json.put("metadata", meta);

            JSONObject counts = new JSONObject();
            counts.put("total", stats.getTotal());
            counts.put("pending", stats.getPending());
            counts.put("inProgress", stats.getInProgress());
            counts.put("complete", stats.getComplete());
            counts.put("error", stats.getError());
            json.put("stats", counts);
            json.put("percentComplete", stats.percentComplete());

            JSONArray items = new JSONArray();
            for (JobItem jobItem : jobItems) {
                JSONObject item = new JSONObject();
                item.put("id", jobItem.getId());
                item.put("itemId", jobItem.getItemId());
                item.put("status", jobItem.getStatus().name());
                item.put("retryCount", jobItem.getRetryCount());
                item.putOpt("errorMessage", jobItem.getErrorMessage());
                items.put(item);
            }
            json.put("items", items);
            return json;
        }
    }

    private static void sendJson(HttpExchange exchange, int statusCode, JSONObject json) throws IOException {
        byte[] response = json.toString(2).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(statusCode, response.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(response);
        }
    }

    private static void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        JSONObject json = new JSONObject();
        json.put("error", message);
        sendJson(exchange, statusCode, json);
    }
}
