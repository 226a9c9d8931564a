package com.capturequeue.db;

import com.capturequeue.core.Item;
import com.capturequeue.core.ItemStatus;
import com.capturequeue.core.ItemUpdate;
import com.capturequeue.core.MarkdownRecord;
import com.capturequeue.core.QaRecord;
import com.capturequeue.core.StorageFailure;
import com.capturequeue.spi.ItemStorage;

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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC implementation of {@link ItemStorage} over the items, markdown and
 * question_answers tables.
 *
 * <p>Every {@link SQLException} is wrapped in a {@link StorageFailure} naming
 * the operation and table.</p>
 */
public class ItemRepository implements ItemStorage {
    private static final Logger logger = Logger.getLogger(ItemRepository.class.getName());

    private final Database database;

    public ItemRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a new item.
     *
     * @param item the item; its id, url, status and createdAt must be set
     * @throws StorageFailure if the insert fails
     */
    public void createItem(Item item) throws StorageFailure {
        String sql = "INSERT INTO items (id, url, title, content, status, retry_count, error_message, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            LocalDateTime createdAt = item.getCreatedAt() != null ? item.getCreatedAt() : LocalDateTime.now();
            LocalDateTime updatedAt = item.getUpdatedAt() != null ? item.getUpdatedAt() : createdAt;

            stmt.setString(1, item.getId());
            stmt.setString(2, item.getUrl());
            stmt.setString(3, item.getTitle());
            stmt.setString(4, item.getContent());
            stmt.setString(5, item.getStatus().name());
            stmt.setInt(6, item.getRetryCount());
            stmt.setString(7, item.getErrorMessage());
            stmt.setTimestamp(8, Timestamp.valueOf(createdAt));
            stmt.setTimestamp(9, Timestamp.valueOf(updatedAt));

            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageFailure("insert", "items", e);
        }
    }

    /**
     * @return the item, or null if not found
     */
    public Item getItemById(String itemId) throws StorageFailure {
        String sql = "SELECT * FROM items WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapItem(rs);
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "items", e);
        }
        return null;
    }

    @Override
    public void updateItem(String itemId, ItemUpdate update) throws StorageFailure {
        try (Connection conn = database.getConnection()) {
            int rows = executeUpdate(conn, itemId, update);
            if (rows == 0) {
                throw new StorageFailure("update", "items", "no item with id " + itemId);
            }
        } catch (SQLException e) {
            throw new StorageFailure("update", "items", e);
        }
    }

    @Override
    public List<Item> getItemsByStatus(ItemStatus status, int limit) throws StorageFailure {
        String sql = "SELECT * FROM items WHERE status = ? ORDER BY created_at, id"
                + (limit > 0 ? " LIMIT ?" : "");
        List<Item> items = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, status.name());
            if (limit > 0) {
                stmt.setInt(2, limit);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    items.add(mapItem(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "items", e);
        }
        return items;
    }

    /**
     * Apply all updates in one transaction; either every item is updated or none.
     */
    @Override
    public void bulkUpdateItems(Map<String, ItemUpdate> updates) throws StorageFailure {
        if (updates.isEmpty()) {
            return;
        }
        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            for (Map.Entry<String, ItemUpdate> entry : updates.entrySet()) {
                executeUpdate(conn, entry.getKey(), entry.getValue());
            }

            conn.commit();
            logger.fine("Bulk updated " + updates.size() + " items");
        } catch (SQLException e) {
            rollbackQuietly(conn, e);
            throw new StorageFailure("bulk update", "items", e);
        } finally {
            closeConnection(conn);
        }
    }

    /**
     * @return count of items per status; statuses without items map to 0
     */
    public Map<ItemStatus, Integer> countByStatus() throws StorageFailure {
        String sql = "SELECT status, COUNT(*) AS n FROM items GROUP BY status";
        Map<ItemStatus, Integer> counts = new EnumMap<>(ItemStatus.class);
        for (ItemStatus status : ItemStatus.values()) {
            counts.put(status, 0);
        }

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(ItemStatus.valueOf(rs.getString("status")), rs.getInt("n"));
            }
        } catch (SQLException e) {
            throw new StorageFailure("count", "items", e);
        }
        return counts;
    }

    @Override
    public MarkdownRecord getMarkdown(String itemId) throws StorageFailure {
        String sql = "SELECT * FROM markdown WHERE item_id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return new MarkdownRecord(
                            rs.getString("id"),
                            rs.getString("item_id"),
                            rs.getString("content"),
                            toLocalDateTime(rs.getTimestamp("created_at")),
                            toLocalDateTime(rs.getTimestamp("updated_at")));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "markdown", e);
        }
        return null;
    }

    /**
     * Insert or replace the markdown of an item.
     */
    @Override
    public void saveMarkdown(MarkdownRecord record) throws StorageFailure {
        String sql = "MERGE INTO markdown (id, item_id, content, created_at, updated_at) KEY (item_id) "
                + "VALUES (?, ?, ?, ?, ?)";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, record.getId());
            stmt.setString(2, record.getItemId());
            stmt.setString(3, record.getContent());
            stmt.setTimestamp(4, Timestamp.valueOf(record.getCreatedAt()));
            stmt.setTimestamp(5, Timestamp.valueOf(record.getUpdatedAt()));

            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new StorageFailure("merge", "markdown", e);
        }
    }

    @Override
    public List<QaRecord> getQaPairs(String itemId) throws StorageFailure {
        String sql = "SELECT * FROM question_answers WHERE item_id = ? ORDER BY created_at, id";
        List<QaRecord> records = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, itemId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(mapQaRecord(rs));
                }
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "question_answers", e);
        }
        return records;
    }

    /**
     * Load every stored Q&amp;A pair with its embeddings, for similarity search.
     */
    public List<QaRecord> getAllQaPairs() throws StorageFailure {
        String sql = "SELECT * FROM question_answers ORDER BY created_at, id";
        List<QaRecord> records = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                records.add(mapQaRecord(rs));
            }
        } catch (SQLException e) {
            throw new StorageFailure("select", "question_answers", e);
        }
        return records;
    }

    /**
     * Insert all pairs in one transaction.
     */
    @Override
    public void saveQaPairs(List<QaRecord> records) throws StorageFailure {
        if (records.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO question_answers (id, item_id, question, answer, embedding_question, "
                + "embedding_answer, embedding_both, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Connection conn = null;
        try {
            conn = database.getConnection();
            conn.setAutoCommit(false);

            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (QaRecord record : records) {
                    stmt.setString(1, record.getId());
                    stmt.setString(2, record.getItemId());
                    stmt.setString(3, record.getQuestion());
                    stmt.setString(4, record.getAnswer());
                    stmt.setString(5, JsonColumns.vector(record.getEmbeddingQuestion()));
                    stmt.setString(6, JsonColumns.vector(record.getEmbeddingAnswer()));
                    stmt.setString(7, JsonColumns.vector(record.getEmbeddingBoth()));
                    stmt.setTimestamp(8, Timestamp.valueOf(record.getCreatedAt()));
                    stmt.setTimestamp(9, Timestamp.valueOf(record.getUpdatedAt()));
                    stmt.addBatch();
                }
                stmt.executeBatch();
            }

            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly(conn, e);
            throw new StorageFailure("insert", "question_answers", e);
        } finally {
            closeConnection(conn);
        }
    }

    // Build and run "UPDATE items SET ... WHERE id = ?" for the fields the update carries
    private int executeUpdate(Connection conn, String itemId, ItemUpdate update) throws SQLException {
        List<String> assignments = new ArrayList<>();
        List<Object> params = new ArrayList<>();

        if (update.getStatus() != null) {
            assignments.add("status = ?");
            params.add(update.getStatus().name());
        }
        if (update.getTitle() != null) {
            assignments.add("title = ?");
            params.add(update.getTitle());
        }
        if (update.getContent() != null) {
            assignments.add("content = ?");
            params.add(update.getContent());
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

        String sql = "UPDATE items SET " + String.join(", ", assignments) + " WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            for (Object param : params) {
                if (param == null) {
                    stmt.setNull(index++, Types.VARCHAR);
                } else {
                    stmt.setObject(index++, param);
                }
            }
            stmt.setString(index, itemId);
            return stmt.executeUpdate();
        }
    }

    private QaRecord mapQaRecord(ResultSet rs) throws SQLException {
        return new QaRecord(
                rs.getString("id"),
                rs.getString("item_id"),
                rs.getString("question"),
                rs.getString("answer"),
                JsonColumns.vector(rs.getString("embedding_question")),
                JsonColumns.vector(rs.getString("embedding_answer")),
                JsonColumns.vector(rs.getString("embedding_both")),
                toLocalDateTime(rs.getTimestamp("created_at")),
                toLocalDateTime(rs.getTimestamp("updated_at")));
    }

    private Item mapItem(ResultSet rs) throws SQLException {
        Item item = new Item();
        item.setId(rs.getString("id"));
        item.setUrl(rs.getString("url"));
        item.setTitle(rs.getString("title"));
        item.setContent(rs.getString("content"));
        item.setStatus(ItemStatus.valueOf(rs.getString("status")));
        item.setRetryCount(rs.getInt("retry_count"));
        item.setErrorMessage(rs.getString("error_message"));
        item.setCreatedAt(toLocalDateTime(rs.getTimestamp("created_at")));
        item.setUpdatedAt(toLocalDateTime(rs.getTimestamp("updated_at")));
        return item;
    }

    static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }

    static void rollbackQuietly(Connection conn, SQLException cause) {
        if (conn == null) {
            return;
        }
        try {
            conn.rollback();
            logger.warning("Transaction rolled back due to error: " + cause.getMessage());
        } catch (SQLException rollbackEx) {
            logger.log(Level.SEVERE, "Error during rollback", rollbackEx);
        }
    }

    static void closeConnection(Connection conn) {
        if (conn == null) {
            return;
        }
        try {
            conn.setAutoCommit(true);
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error closing connection", e);
        }
    }
}
