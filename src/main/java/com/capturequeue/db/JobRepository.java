package com.capturequeue.db;

import com.capturequeue.core.Job;
import com.capturequeue.core.JobItem;
import com.capturequeue.core.JobItemStatus;
import com.capturequeue.core.JobItemUpdate;
import com.capturequeue.core.JobMetadata;
import com.capturequeue.core.JobStats;
import com.capturequeue.core.JobStatus;
import com.capturequeue.core.JobType;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.JobTracker;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * JDBC implementation of {@link JobTracker} over the jobs and job_items tables,
 * plus the job management operations used by the host application.
 */
public class JobRepository implements JobTracker {
    private static final Logger logger = Logger.getLogger(JobRepository.class.getName());

    // Most recent job item of an item; an item re-enqueued later belongs to the newer job
    private static final String LATEST_JOB_ITEM =
            "SELECT id FROM job_items WHERE item_id = ? ORDER BY created_at DESC, id DESC LIMIT 1";

    private final Database database;

    public JobRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a new job.
     *
     * @throws StorageFailure if the insert fails
     */
    public void createJob(Job job) throws StorageFailure {
        String sql = "INSERT INTO jobs (id, type, status, parent_job_id, metadata, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            LocalDateTime now = LocalDateTime.now();
            LocalDateTime createdAt = job.getCreatedAt() != null ? job.getCreatedAt() : now;

            stmt.setString(1, job.getId());
            stmt.setString(2, job.getType().name());
            stmt.setString(3, job.getStatus() != null ? job.getStatus().name() : JobStatus.PENDING.name());
            stmt.setString(4, job.getParentJobId());
            stmt.setString(5, JsonColumns.metadata(job.getMetadata()));
            stmt.setTimestamp(6, Timestamp.valueOf(createdAt));
            stmt.setTimestamp(7, Timestamp.valueOf(job.getUpdatedAt() != null ? job.getUpdatedAt() : createdAt));

            stmt.executeUpdate();
            logger.info("Job created: " + job.getId() + " (type: " + job.getType() + ")");
        } catch (SQLException e) {
            throw new StorageFailure("insert", "jobs", e);
        }
    }

    /**
     * Insert job items in one transaction.
     */
    public void createJobItems(List<JobItem> jobItems) throws StorageFailure {
        if (jobItems.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO job_items (id, job_id, item_id, status, retry_count, error_message, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (JobItem jobItem : jobItems) {
                    LocalDateTime createdAt = jobItem.getCreatedAt() != null ? jobItem.getCreatedAt() : LocalDateTime.now();
                    stmt.setString(1, jobItem.getId());
                    stmt.setString(2, jobItem.getJobId());
                    stmt.setString(3, jobItem.getItemId());
                    stmt.setString(4, jobItem.getStatus().name());
                    stmt.setInt(5, jobItem.getRetryCount());
                    stmt.setString(6, jobItem.getErrorMessage());
                    stmt.setTimestamp(7, Timestamp.valueOf(createdAt));
                    stmt.setTimestamp(8, Timestamp.valueOf(createdAt));
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            conn.commit();
        } catch (SQLException e) {
            ItemRepository.rollbackQuietly(conn, e);
            throw new StorageFailure("insert", "job_items", e);
        } finally {
            ItemRepository.closeConnection(conn);
        }
    }

    /**
     * @return the job, or null if not found
     */
    public Job getJob(String jobId) throws StorageFailure {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapJob(rs);
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "jobs", e);
        }
        return null;
    }

    /**
     * @return most recently created jobs first
     */
    public List<Job> getRecentJobs(int limit) throws StorageFailure {
        String sql = "SELECT * FROM jobs ORDER BY created_at DESC, id LIMIT ?";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setInt(1, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapJob(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "jobs", e);
        }
        return jobs;
    }

    public List<JobItem> getJobItems(String jobId) throws StorageFailure {
        String sql = "SELECT * FROM job_items WHERE job_id = ? ORDER BY created_at, id";
        List<JobItem> jobItems = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobItems.add(mapJobItem(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "job_items", e);
        }
        return jobItems;
    }

    public JobStats getJobStats(String jobId) throws StorageFailure {
        String sql = "SELECT status, COUNT(*) AS n FROM job_items WHERE job_id = ? GROUP BY status";
        Map<JobItemStatus, Integer> counts = new EnumMap<>(JobItemStatus.class);

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    counts.put(JobItemStatus.valueOf(rs.getString("status")), rs.getInt("n"));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("count", "job_items", e);
        }
        return new JobStats(
                counts.getOrDefault(JobItemStatus.PENDING, 0),
                counts.getOrDefault(JobItemStatus.IN_PROGRESS, 0),
                counts.getOrDefault(JobItemStatus.COMPLETE, 0),
                counts.getOrDefault(JobItemStatus.ERROR, 0));
    }

    /**
     * Re-derive the job's status from its children. Cancelled jobs keep their status.
     * Bulk imports also record their success and failure counts in the metadata.
     */
    @Override
    public void recomputeJobStatus(String jobId) throws StorageFailure {
        Job job = getJob(jobId);
        if (job == null) {
            logger.warning("Cannot recompute status of unknown job " + jobId);
            return;
        }
        if (job.getStatus() == JobStatus.CANCELLED) {
            return;
        }

        JobStats stats = getJobStats(jobId);
        JobStatus status = JobStatus.fromStats(stats);
        JobMetadata metadata = job.getMetadata();
        if (job.getType() == JobType.BULK_URL_IMPORT) {
            metadata.setSuccessCount(stats.getComplete());
            metadata.setFailureCount(stats.getError());
        }

        String sql = "UPDATE jobs SET status = ?, metadata = ?, updated_at = ? WHERE id = ?";
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            stmt.setString(2, JsonColumns.metadata(metadata));
            stmt.setTimestamp(3, Timestamp.valueOf(LocalDateTime.now()));
            stmt.setString(4, jobId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageFailure("update", "jobs", e);
        }

        if (status != job.getStatus()) {
            logger.info("Job " + jobId + " status " + job.getStatus() + " -> " + status + " " + stats);
        }
    }

    @Override
    public void updateJobItemByItemId(String itemId, JobItemUpdate update) throws StorageFailure {
        try (Connection conn = database.getConnection()) {
            String jobItemId = findLatestJobItemId(conn, itemId);
            if (jobItemId == null) {
                logger.fine("Item " + itemId + " belongs to no job, skipping job item update");
                return;
            }
            executeUpdate(conn, jobItemId, update);
        } catch (SQLException e) {
            throw new StorageFailure("update", "job_items", e);
        }
    }

    @Override
    public JobItem getJobItemByItemId(String itemId) throws StorageFailure {
        String sql = "SELECT * FROM job_items WHERE item_id = ? ORDER BY created_at DESC, id DESC LIMIT 1";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapJobItem(rs);
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "job_items", e);
        }
        return null;
    }

    @Override
    public List<JobItem> getJobItemsByStatus(JobItemStatus status) throws StorageFailure {
        String sql = "SELECT * FROM job_items WHERE status = ? ORDER BY created_at, id";
        List<JobItem> jobItems = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobItems.add(mapJobItem(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "job_items", e);
        }
        return jobItems;
    }

    @Override
    public void updateJobItem(String jobItemId, JobItemUpdate update) throws StorageFailure {
        try (Connection conn = database.getConnection()) {
            if (executeUpdate(conn, jobItemId, update) == 0) {
                throw new StorageFailure("update", "job_items", "no job item with id " + jobItemId);
            }
        } catch (SQLException e) {
            throw new StorageFailure("update", "job_items", e);
        }
    }

    /**
     * Reset every failed child of a job, and its item, so the next pass fetches it again.
     *
     * @return number of job items reset
     * @throws StorageFailure if the reset failed; nothing is changed in that case
     */
    public int retryFailedJobItems(String jobId) throws StorageFailure {
        String selectSql = "SELECT id, item_id FROM job_items WHERE job_id = ? AND status = ?";
        String jobItemSql = "UPDATE job_items SET status = ?, retry_count = 0, error_message = NULL, updated_at = ? WHERE id = ?";

        int reset = 0;
        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            List<String[]> failed = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(selectSql)) {
                stmt.setString(1, jobId);
                stmt.setString(2, JobItemStatus.ERROR.name());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        failed.add(new String[] {rs.getString("id"), rs.getString("item_id")});
                    }
                }
            }

            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            try (PreparedStatement jobItemStmt = conn.prepareStatement(jobItemSql)) {
                for (String[] row : failed) {
                    jobItemStmt.setString(1, JobItemStatus.PENDING.name());
                    jobItemStmt.setTimestamp(2, now);
                    jobItemStmt.setString(3, row[0]);
                    jobItemStmt.addBatch();
                    resetItemForRetry(conn, row[1], now);
                }
                jobItemStmt.executeBatch();
            }

            conn.commit();
            reset = failed.size();
        } catch (SQLException e) {
            ItemRepository.rollbackQuietly(conn, e);
            throw new StorageFailure("retry", "job_items", e);
        } finally {
            ItemRepository.closeConnection(conn);
        }

        if (reset > 0) {
            recomputeJobStatus(jobId);
            logger.info("Reset " + reset + " failed items of job " + jobId + " for retry");
        }
        return reset;
    }

    /**
     * Reset one item and its latest job item for a fresh capture.
     *
     * @return false if the item does not exist
     */
    public boolean retryItem(String itemId) throws StorageFailure {
        String jobItemSql = "UPDATE job_items SET status = ?, retry_count = 0, error_message = NULL, updated_at = ? WHERE id = ?";

        String jobItemId;
        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            Timestamp now = Timestamp.valueOf(LocalDateTime.now());
            if (resetItemForRetry(conn, itemId, now) == 0) {
                conn.rollback();
                return false;
            }
            jobItemId = findLatestJobItemId(conn, itemId);
            if (jobItemId != null) {
                try (PreparedStatement stmt = conn.prepareStatement(jobItemSql)) {
                    stmt.setString(1, JobItemStatus.PENDING.name());
                    stmt.setTimestamp(2, now);
                    stmt.setString(3, jobItemId);
                    stmt.executeUpdate();
                }
            }

            conn.commit();
        } catch (SQLException e) {
            ItemRepository.rollbackQuietly(conn, e);
            throw new StorageFailure("retry", "items", e);
        } finally {
            ItemRepository.closeConnection(conn);
        }

        if (jobItemId != null) {
            JobItem jobItem = getJobItemByItemId(itemId);
            if (jobItem != null) {
                recomputeJobStatus(jobItem.getJobId());
            }
        }
        logger.info("Item " + itemId + " reset for retry");
        return true;
    }

    /**
     * @return count of jobs per status; statuses without jobs map to 0
     */
    public Map<JobStatus, Integer> countJobsByStatus() throws StorageFailure {
        String sql = "SELECT status, COUNT(*) AS n FROM jobs GROUP BY status";
        Map<JobStatus, Integer> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(JobStatus.valueOf(rs.getString("status")), rs.getInt("n"));
            }
        } catch (SQLException e) {
            throw new StorageFailure("count", "jobs", e);
        }
        return counts;
    }

    /**
     * Delete a job and its job items. Refused while any child is pending or in progress.
     *
     * @return true if the job was deleted
     */
    public boolean deleteJob(String jobId) throws StorageFailure {
        JobStats stats = getJobStats(jobId);
        if (stats.getPending() > 0 || stats.getInProgress() > 0) {
            logger.warning("Refusing to delete job " + jobId + " with active children " + stats);
            return false;
        }

        String sql = "DELETE FROM jobs WHERE id = ?";
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, jobId);
            boolean deleted = stmt.executeUpdate() > 0;
            if (deleted) {
                logger.info("Job deleted: " + jobId);
            }
            return deleted;
        } catch (SQLException e) {
            throw new StorageFailure("delete", "jobs", e);
        }
    }

    private int resetItemForRetry(Connection conn, String itemId, Timestamp now) throws SQLException {
        String sql = "UPDATE items SET status = ?, retry_count = 0, error_message = NULL, updated_at = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, ItemStatus.AWAITING_CAPTURE.name());
            stmt.setTimestamp(2, now);
            stmt.setString(3, itemId);
            return stmt.executeUpdate();
        }
    }

    private String findLatestJobItemId(Connection conn, String itemId) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(LATEST_JOB_ITEM)) {
            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString("id") : null;
            }
        }
    }

    private int executeUpdate(Connection conn, String jobItemId, JobItemUpdate update) throws SQLException {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (update.getStatus() != null) {
            assignments.add("status = ?");
            params.add(update.getStatus().name());
        }
        if (update.getRetryCount() != null) {
            assignments.add("retry_count = ?");
            params.add(update.getRetryCount());
        }
        if (update.getErrorMessage() != null || update.isClearErrorMessage()) {
            assignments.add("error_message = ?");
            params.add(update.getErrorMessage());
        }
        assignments.add("updated_at = ?");
        params.add(Timestamp.valueOf(update.getUpdatedAt()));

        String sql = "UPDATE job_items SET " + String.join(", ", assignments) + " WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            for (Object param : params) {
                if (param == null) {
                    stmt.setNull(index++, Types.VARCHAR);
                } else {
                    stmt.setObject(index++, param);
                }
            }
            stmt.setString(index, jobItemId);
            return stmt.executeUpdate();
        }
    }

    private Job mapJob(ResultSet rs) throws SQLException {
        Job job = new Job();
        job.setId(rs.getString("id"));
        job.setType(JobType.valueOf(rs.getString("type")));
        job.setStatus(JobStatus.valueOf(rs.getString("status")));
        job.setParentJobId(rs.getString("parent_job_id"));
        job.setMetadata(JsonColumns.metadata(rs.getString("metadata")));
        job.setCreatedAt(ItemRepository.toLocalDateTime(rs.getTimestamp("created_at")));
        job.setUpdatedAt(ItemRepository.toLocalDateTime(rs.getTimestamp("updated_at")));
        return job;
    }

    private JobItem mapJobItem(ResultSet rs) throws SQLException {
        JobItem jobItem = new JobItem();
        jobItem.setId(rs.getString("id"));
        jobItem.setJobId(rs.getString("job_id"));
        jobItem.setItemId(rs.getString("item_id"));
        jobItem.setStatus(JobItemStatus.valueOf(rs.getString("status")));
        jobItem.setRetryCount(rs.getInt("retry_count"));
        jobItem.setErrorMessage(rs.getString("error_message"));
        jobItem.setCreatedAt(ItemRepository.toLocalDateTime(rs.getTimestamp("created_at")));
        jobItem.setUpdatedAt(ItemRepository.toLocalDateTime(rs.getTimestamp("updated_at")));
        return jobItem;
    }
}
