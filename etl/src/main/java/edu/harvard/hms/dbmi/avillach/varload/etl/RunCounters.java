package edu.harvard.hms.dbmi.avillach.varload.etl;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters of one pipeline invocation. Safe to read from a progress reporter on another thread.
 */
public class RunCounters {

    public final AtomicLong recordsRead = new AtomicLong();
    public final AtomicLong parseFailures = new AtomicLong();
    public final AtomicLong recordsAccepted = new AtomicLong();
    public final AtomicLong recordsDegraded = new AtomicLong();
    public final AtomicLong recordsTruncated = new AtomicLong();
    public final AtomicLong recordsWritten = new AtomicLong();
    public final AtomicLong chunksFlushed = new AtomicLong();
    public final AtomicLong recordsLoaded = new AtomicLong();
    public final AtomicLong recordsRejected = new AtomicLong();
    public final AtomicLong recordsSkippedOnResume = new AtomicLong();
    public final AtomicLong recordsExcluded = new AtomicLong();
    public final AtomicLong intermediateRowsDiscarded = new AtomicLong();
    public final AtomicLong batchesCommitted = new AtomicLong();
    public final AtomicLong summaryRows = new AtomicLong();
    public final AtomicBoolean indexesRebuilt = new AtomicBoolean();

    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("recordsRead", recordsRead.get());
        snapshot.put("parseFailures", parseFailures.get());
        snapshot.put("recordsAccepted", recordsAccepted.get());
        snapshot.put("recordsDegraded", recordsDegraded.get());
        snapshot.put("recordsTruncated", recordsTruncated.get());
        snapshot.put("recordsWritten", recordsWritten.get());
        snapshot.put("chunksFlushed", chunksFlushed.get());
        snapshot.put("recordsLoaded", recordsLoaded.get());
        snapshot.put("recordsRejected", recordsRejected.get());
        snapshot.put("recordsSkippedOnResume", recordsSkippedOnResume.get());
        snapshot.put("recordsExcluded", recordsExcluded.get());
        snapshot.put("intermediateRowsDiscarded", intermediateRowsDiscarded.get());
        snapshot.put("batchesCommitted", batchesCommitted.get());
        snapshot.put("summaryRows", summaryRows.get());
        snapshot.put("indexesRebuilt", indexesRebuilt.get());
        return snapshot;
    }
}
