package com.capturequeue.core;

/**
 * Free-form job details, stored as a JSON column.
 *
 * <p>Which fields are set depends on the {@link JobType}: file imports carry
 * the file name and import counts, bulk imports the URL totals, single
 * fetches the URL and item id. Unset fields are omitted from the JSON.</p>
 */
public class JobMetadata {
    // FILE_IMPORT
    private String fileName;
    private Integer importedCount;
    private Integer skippedCount;

    // BULK_URL_IMPORT
    private Integer totalUrls;
    private Integer successCount;
    private Integer failureCount;

    // URL_FETCH
    private String url;
    private String itemId;

    private String errorMessage;

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public Integer getImportedCount() { return importedCount; }
    public void setImportedCount(Integer importedCount) { this.importedCount = importedCount; }

    public Integer getSkippedCount() { return skippedCount; }
    public void setSkippedCount(Integer skippedCount) { this.skippedCount = skippedCount; }

    public Integer getTotalUrls() { return totalUrls; }
    public void setTotalUrls(Integer totalUrls) { this.totalUrls = totalUrls; }

    public Integer getSuccessCount() { return successCount; }
    public void setSuccessCount(Integer successCount) { this.successCount = successCount; }

    public Integer getFailureCount() { return failureCount; }
    public void setFailureCount(Integer failureCount) { this.failureCount = failureCount; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public String getItemId() { return itemId; }
    public void setItemId(String itemId) { this.itemId = itemId; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
}
