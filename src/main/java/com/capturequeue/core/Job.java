package com.capturequeue.core;

import java.time.LocalDateTime;

/**
 * Parent record for a batch of enqueued items.
 *
 * <p>Created when the host enqueues items; its status is recomputed from the
 * children every time a child reaches a terminal state. A job is never
 * deleted while any child is still pending or in progress.</p>
 */
public class Job {
    private String id;
    private JobType type;
    private JobStatus status;
    private String parentJobId;
    private JobMetadata metadata = new JobMetadata();
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public JobType getType() { return type; }
    public void setType(JobType type) { this.type = type; }

    public JobStatus getStatus() { return status; }
    public void setStatus(JobStatus status) { this.status = status; }

    public String getParentJobId() { return parentJobId; }
    public void setParentJobId(String parentJobId) { this.parentJobId = parentJobId; }

    public JobMetadata getMetadata() { return metadata; }
    public void setMetadata(JobMetadata metadata) { this.metadata = metadata; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public String toString() {
        return "Job{id='" + id + "', type=" + type + ", status=" + status + "}";
    }
}
