package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.RunCounters;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureRecord;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateFileReader;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateManifest;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * Streams the intermediate file into a {@link VariantStore} in fixed-size batches.
 *
 * <p>Secondary indexes are dropped before the first batch and rebuilt once after the last. Each batch
 * commits together with the {@code load_state} watermark, so a later run without "start fresh" can
 * skip what an interrupted run already committed. A batch the store refuses is replayed one record at
 * a time and only the records that fail on their own are rejected.</p>
 *
 * <p>Not thread-safe; use one instance per run.</p>
 */
public class BulkLoader {

    private static final Logger log = LoggerFactory.getLogger(BulkLoader.class);

    private final VariantStore store;
    private final FailureSink failureSink;
    private final RunCounters counters;
    private final String runId;
    private final List<SideInputLoader> sideInputs;

    private long committedRows;
    private boolean storeTouched;

    public BulkLoader(VariantStore store, FailureSink failureSink, RunCounters counters, String runId,
                      List<SideInputLoader> sideInputs) {
        this.store = store;
        this.failureSink = failureSink;
        this.counters = counters;
        this.runId = runId;
        this.sideInputs = List.copyOf(sideInputs);
    }

    /**
     * @throws StoreConnectionException the store became unreachable
     * @throws edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateFileException the file is missing or
     *                                  not an intermediate file
     */
    public LoadResult load(Path intermediateFile, LoadOptions options, BooleanSupplier cancelled) throws IOException {
        log.info("=== LOADING {} ===", intermediateFile);
        if (IntermediateManifest.read(intermediateFile).isEmpty()) {
            log.warn("{} has no completion manifest, it is the leftover of an interrupted transform; loading its complete rows",
                intermediateFile);
        }
        committedRows = 0;
        storeTouched = false;
        String source = intermediateFile.toAbsolutePath().normalize().toString();
        long loadedBefore = counters.recordsLoaded.get();
        long rejectedBefore = counters.recordsRejected.get();
        long excludedBefore = counters.recordsExcluded.get();
        long batchesBefore = counters.batchesCommitted.get();

        try (IntermediateFileReader reader = new IntermediateFileReader(intermediateFile,
            row -> discarded(source, row))) {
            long sourceSize = Files.size(intermediateFile);
            try {
                LoadState state = prepare(source, sourceSize, options.startFresh());
                long skipped = reader.skip(state.committedRows());
                counters.recordsSkippedOnResume.addAndGet(skipped);
                committedRows = state.committedRows();
                if (skipped > 0) {
                    log.info("Resuming: skipped {} rows committed by an earlier run", skipped);
                }

                boolean wasCancelled = false;
                long batchNumber = 0;
                while (true) {
                    if (cancelled.getAsBoolean()) {
                        wasCancelled = true;
                        log.warn("Load cancelled after {} committed rows; indexes and derived tables not rebuilt", committedRows);
                        break;
                    }
                    List<CanonicalRecord> batch = reader.readBatch(options.batchSize());
                    if (batch.isEmpty()) {
                        break;
                    }
                    if (options.excludeDegraded()) {
                        int before = batch.size();
                        batch = batch.stream().filter(r -> !r.degraded()).toList();
                        counters.recordsExcluded.addAndGet(before - batch.size());
                    }
                    batchNumber++;
                    long watermark = reader.getRowsRead();
                    commit(batchNumber, batch, state.withProgress(watermark, LoadStatus.LOADING));
                    committedRows = watermark;
                }

                Map<String, Long> sideInputRows = new LinkedHashMap<>();
                long geneRows = 0;
                long summaryRows = 0;
                Map<String, Long> tableCounts = Map.of();
                if (!wasCancelled) {
                    store.createSecondaryIndexes();
                    counters.indexesRebuilt.set(true);
                    store.saveLoadState(state.withProgress(committedRows, LoadStatus.LOADED));

                    geneRows = store.rebuildGenes();
                    log.info("Rebuilt genes: {} rows", geneRows);
                    for (SideInputLoader sideInput : sideInputs) {
                        sideInputRows.put(sideInput.name(), sideInput.load(store));
                    }
                    summaryRows = store.rebuildMutationSummary();
                    counters.summaryRows.set(summaryRows);
                    log.info("Rebuilt mutation summary: {} rows", summaryRows);
                    store.saveLoadState(state.withProgress(committedRows, LoadStatus.COMPLETE));

                    tableCounts = store.tableCounts();
                    tableCounts.forEach((table, count) -> log.info("  {}: {} rows", table, count));
                }

                log.info("=== LOAD {} === loaded={}, rejected={}, skipped={}, discarded={}",
                    wasCancelled ? "CANCELLED" : "COMPLETE",
                    counters.recordsLoaded.get() - loadedBefore, counters.recordsRejected.get() - rejectedBefore,
                    skipped, reader.getRowsDiscarded());
                return new LoadResult(
                    counters.recordsLoaded.get() - loadedBefore,
                    counters.recordsRejected.get() - rejectedBefore,
                    skipped,
                    counters.recordsExcluded.get() - excludedBefore,
                    reader.getRowsDiscarded(),
                    counters.batchesCommitted.get() - batchesBefore,
                    committedRows,
                    counters.indexesRebuilt.get(),
                    geneRows,
                    summaryRows,
                    sideInputRows,
                    tableCounts,
                    wasCancelled
                );
            } catch (DataAccessException e) {
                if (StoreFailures.isConnectionFailure(e)) {
                    throw new StoreConnectionException("Lost connection to the variant store after " + committedRows
                        + " committed rows: " + StoreFailures.rootMessage(e), e, storeTouched, committedRows);
                }
                throw e;
            }
        }
    }

    private LoadState prepare(String source, long sourceSize, boolean startFresh) {
        store.verifyConnection();
        store.ensureSchema();
        Optional<LoadState> prior = store.readLoadState();
        long resumeFrom = 0;
        if (startFresh) {
            long existing = store.countVariants();
            log.info("Start fresh: clearing {} existing variants and derived tables", existing);
            store.recreateSchema();
        } else if (prior.isPresent() && prior.get().isResumableFor(source, sourceSize)) {
            resumeFrom = prior.get().committedRows();
            storeTouched = resumeFrom > 0;
        } else if (prior.isPresent()) {
            log.info("Previous load state ({}, {} rows of {}) does not apply; upserting from the first row",
                prior.get().status(), prior.get().committedRows(), prior.get().sourceFile());
        }
        store.dropSecondaryIndexes();
        LoadState state = new LoadState(VariantSchema.VARIANTS, source, sourceSize, resumeFrom, LoadStatus.LOADING,
            Instant.now());
        store.saveLoadState(state);
        return state;
    }

    private void commit(long batchNumber, List<CanonicalRecord> batch, LoadState state) {
        try {
            store.upsertBatch(batch, state);
            storeTouched = true;
            counters.recordsLoaded.addAndGet(batch.size());
            counters.batchesCommitted.incrementAndGet();
            log.info("Committed batch {} ({} records, watermark {})", batchNumber, batch.size(), state.committedRows());
        } catch (DataAccessException e) {
            if (StoreFailures.isConnectionFailure(e)) {
                throw e;
            }
            log.warn("Batch {} refused by the store ({}); retrying its {} records one at a time",
                batchNumber, StoreFailures.rootMessage(e), batch.size());
            replay(batch, state);
            storeTouched = true;
            store.saveLoadState(state);
            counters.batchesCommitted.incrementAndGet();
        }
    }

    private void replay(List<CanonicalRecord> batch, LoadState state) {
        for (CanonicalRecord record : batch) {
            try {
                store.upsert(record);
                storeTouched = true;
                counters.recordsLoaded.incrementAndGet();
            } catch (DataAccessException e) {
                if (StoreFailures.isConnectionFailure(e)) {
                    throw e;
                }
                RejectedRow rejected = RejectedRow.of(record, StoreFailures.rootMessage(e));
                counters.recordsRejected.incrementAndGet();
                log.warn("Rejected variant {} ({}): {}", rejected.variantKey(), rejected.locus(), rejected.reason());
                failureSink.recordFailure(FailureRecord.rejectedRow(runId, state.sourceFile(), rejected.variantKey(),
                    rejected.locus(), rejected.reason()));
            }
        }
    }

    private void discarded(String source, IntermediateFileReader.DiscardedRow row) {
        counters.intermediateRowsDiscarded.incrementAndGet();
        failureSink.recordFailure(FailureRecord.discardedIntermediateRow(runId, source, row.rowNumber(), row.detail()));
    }
}
