package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import java.util.Map;

/**
 * Outcome of one {@link BulkLoader#load} call.
 *
 * @param committedRows intermediate rows covered by committed batches, including rows skipped on resume
 * @param cancelled     stopped between batches; indexes and derived tables were left as they were
 */
public record LoadResult(
    long recordsLoaded,
    long recordsRejected,
    long recordsSkipped,
    long recordsExcluded,
    long rowsDiscarded,
    long batchesCommitted,
    long committedRows,
    boolean indexesRebuilt,
    long geneRows,
    long summaryRows,
    Map<String, Long> sideInputRows,
    Map<String, Long> tableCounts,
    boolean cancelled
) {
}
