package com.capturequeue.app;

import com.capturequeue.core.JobStatus;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.db.JobRepository;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Summarises job counts into a single {@link HealthStatus}.
 *
 * <p>Rules, first match wins: any failed job is ERROR; any pending or
 * in-progress job is PROCESSING; no jobs at all is IDLE; otherwise HEALTHY.</p>
 */
public class HealthStatusService {
    private static final Logger logger = Logger.getLogger(HealthStatusService.class.getName());

    private final JobRepository jobRepository;

    public HealthStatusService(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    public HealthStatus getHealthStatus() {
        Map<JobStatus, Integer> counts;
        try {
            counts = jobRepository.countJobsByStatus();
        } catch (StorageFailure e) {
            logger.log(Level.SEVERE, "Error checking health status", e);
            return HealthStatus.unavailable("Error checking system health");
        }

        int pending = counts.getOrDefault(JobStatus.PENDING, 0);
        int inProgress = counts.getOrDefault(JobStatus.IN_PROGRESS, 0);
        int failed = counts.getOrDefault(JobStatus.FAILED, 0);
        int total = counts.values().stream().mapToInt(Integer::intValue).sum();

        if (failed > 0) {
            String message = failed == 1
                    ? "1 failed job needs attention"
                    : failed + " failed jobs need attention";
            return new HealthStatus(HealthStatus.State.ERROR, message, pending, inProgress, failed);
        }
        if (pending > 0 || inProgress > 0) {
            int active = pending + inProgress;
            return new HealthStatus(HealthStatus.State.PROCESSING,
                    "Processing " + active + (active == 1 ? " job" : " jobs"), pending, inProgress, failed);
        }
        if (total == 0) {
            return new HealthStatus(HealthStatus.State.IDLE, "No jobs in queue", pending, inProgress, failed);
        }
        return new HealthStatus(HealthStatus.State.HEALTHY, "All systems healthy", pending, inProgress, failed);
    }
}
