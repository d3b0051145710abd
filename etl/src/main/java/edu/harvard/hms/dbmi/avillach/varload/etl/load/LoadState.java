package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import java.time.Instant;

/**
 * Row of the {@code load_state} table: how far a load into {@code targetTable} got.
 *
 * @param committedRows intermediate file data rows consumed by committed batches
 */
public record LoadState(
    String targetTable,
    String sourceFile,
    long sourceSize,
    long committedRows,
    LoadStatus status,
    Instant updatedAt
) {

    public boolean isResumableFor(String file, long size) {
        return status == LoadStatus.LOADING && sourceFile != null && sourceFile.equals(file) && sourceSize == size;
    }

    public LoadState withProgress(long rows, LoadStatus newStatus) {
        return new LoadState(targetTable, sourceFile, sourceSize, rows, newStatus, Instant.now());
    }
}
