package edu.harvard.hms.dbmi.avillach.varload.etl.pipeline;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.varload.etl.RunCounters;
import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.ChunkAccumulator;
import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.ChunkSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.QueuedChunkSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureRecord;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.BulkLoader;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.DrugAnnotationLoader;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.LoadResult;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.SideInputLoader;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.StoreConnectionException;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.VariantStore;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.ParseFailure;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.ParsedLine;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.RawRecord;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.RecordParser;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.VcfInputOpener;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateFileWriter;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateManifest;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.SourceFingerprint;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.ClinicalSignificanceMapper;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.Normalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one pipeline invocation: transform the source into the intermediate file, load that file into
 * the store, or both, and reports how it ended.
 *
 * <p>Transform and load are connected only through the intermediate file, so either can be rerun on its
 * own. {@link #cancel()} may be called from another thread; it is observed at chunk and batch
 * boundaries.</p>
 */
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final PipelineSettings settings;
    private final VariantStore store;
    private final RunCounters counters = new RunCounters();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    /**
     * @param store target store; may be null when the mode does not load
     */
    public PipelineOrchestrator(PipelineSettings settings, VariantStore store) {
        Preconditions.checkArgument(store != null || !settings.getMode().loads(),
            "mode %s needs a variant store", settings.getMode());
        this.settings = settings;
        this.store = store;
    }

    private record TransformOutcome(boolean maxRowsReached, boolean cancelled) {
    }

    public RunReport run() {
        Instant start = Instant.now();
        log.info("=== VARIANT PIPELINE {} ({}) ===", settings.getRunId(), settings.getMode());
        log.info("{}", settings);

        RunStatus status = RunStatus.COMPLETED;
        String error = null;
        boolean transformSkipped = false;
        boolean maxRowsReached = false;
        long failuresLogged = 0;
        Map<String, Long> tableCounts = Map.of();

        try (FailureSink failureSink = new FailureSink(settings.getFailureLog())) {
            try {
                if (settings.getMode().transforms()) {
                    Optional<IntermediateManifest> reusable = settings.getMode() == RunMode.FULL
                        ? reusableIntermediate() : Optional.empty();
                    if (reusable.isPresent()) {
                        transformSkipped = true;
                        maxRowsReached = reusable.get().maxRowsReached();
                        log.info("Reusing completed intermediate file {} ({} records); skipping transform",
                            settings.getIntermediateFile(), reusable.get().recordCount());
                    } else {
                        TransformOutcome outcome = transform(failureSink);
                        maxRowsReached = outcome.maxRowsReached();
                        if (outcome.cancelled()) {
                            status = RunStatus.CANCELLED;
                        }
                    }
                }
                if (status == RunStatus.COMPLETED && settings.getMode().loads()) {
                    BulkLoader loader = new BulkLoader(store, failureSink, counters, settings.getRunId(),
                        sideInputs(failureSink));
                    LoadResult result = loader.load(settings.getIntermediateFile(), settings.loadOptions(),
                        cancelRequested::get);
                    tableCounts = result.tableCounts();
                    if (result.cancelled()) {
                        status = RunStatus.CANCELLED;
                    }
                }
            } catch (StoreConnectionException e) {
                status = e.isPartiallyLoaded() ? RunStatus.PARTIAL : RunStatus.FAILED;
                error = e.getMessage();
                log.error("Variant store unreachable ({} rows committed, partially loaded: {})",
                    e.getCommittedRows(), e.isPartiallyLoaded(), e);
            } catch (IOException | RuntimeException e) {
                status = RunStatus.FAILED;
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.error("Pipeline run {} failed", settings.getRunId(), e);
            }
            failuresLogged = failureSink.getTotalFailures();
        } catch (IOException e) {
            status = RunStatus.FAILED;
            error = "Failure log " + settings.getFailureLog() + " unusable: " + e.getMessage();
            log.error(error, e);
        }

        RunReport report = new RunReport(settings.getRunId(), settings.getMode(), status, transformSkipped, maxRowsReached,
            counters.snapshot(), failuresLogged, tableCounts, Duration.between(start, Instant.now()), error);
        log.info("=== PIPELINE {} === {} in {} ms", status, report.counters(), report.elapsed().toMillis());
        if (failuresLogged > 0) {
            log.warn("{} failures written to {}", failuresLogged, settings.getFailureLog());
        }
        return report;
    }

    /**
     * A completed intermediate file of the unchanged source, normalized with the current settings and
     * not cut short by a different row limit.
     */
    private Optional<IntermediateManifest> reusableIntermediate() throws IOException {
        if (!settings.isReuseIntermediate()) {
            return Optional.empty();
        }
        Optional<IntermediateManifest> manifest = IntermediateManifest.read(settings.getIntermediateFile());
        if (manifest.isEmpty()) {
            return Optional.empty();
        }
        IntermediateManifest m = manifest.get();
        if (m.source() == null) {
            log.info("Intermediate file manifest does not describe its source; transforming again");
            return Optional.empty();
        }
        List<String> differences = m.source().differencesFrom(fingerprint());
        if (!differences.isEmpty()) {
            log.info("Intermediate file is out of date ({}); transforming again", String.join(", ", differences));
            return Optional.empty();
        }
        Long maxRows = settings.getMaxRows();
        boolean sameLimit = m.maxRowsReached() ? maxRows != null && maxRows == m.recordCount()
            : maxRows == null || maxRows >= m.recordCount();
        if (!sameLimit) {
            log.info("Intermediate file was produced under a different row limit; transforming again");
            return Optional.empty();
        }
        return manifest;
    }

    private SourceFingerprint fingerprint() throws IOException {
        return SourceFingerprint.of(settings.getInputFile(), settings.getMaxAlleleLength(),
            settings.getClinicalSignificanceCodes());
    }

    private TransformOutcome transform(FailureSink failureSink) throws IOException {
        Path input = settings.getInputFile();
        log.info("=== TRANSFORMING {} -> {} ===", input, settings.getIntermediateFile());
        Normalizer normalizer = new Normalizer(settings.getMaxAlleleLength(),
            new ClinicalSignificanceMapper(settings.getClinicalSignificanceCodes()));
        Long maxRows = settings.getMaxRows();
        boolean maxRowsReached = false;
        boolean cancelled = false;

        try (RecordParser parser = VcfInputOpener.parser(input);
             IntermediateFileWriter writer = new IntermediateFileWriter(settings.getIntermediateFile())) {
            // taken before the first line is read
            SourceFingerprint fingerprint = fingerprint();
            String source = fingerprint.sourceFile();
            ChunkSink counted = chunk -> {
                writer.accept(chunk);
                counters.recordsWritten.addAndGet(chunk.size());
                counters.chunksFlushed.incrementAndGet();
            };
            try (QueuedChunkSink queued = settings.isPipelined() ? new QueuedChunkSink(counted) : null) {
                ChunkAccumulator accumulator = new ChunkAccumulator(settings.getChunkSize(), queued != null ? queued : counted);
                while (parser.hasNext()) {
                    ParsedLine line = parser.next();
                    counters.recordsRead.incrementAndGet();
                    if (line instanceof ParseFailure failure) {
                        counters.parseFailures.incrementAndGet();
                        log.warn("Skipping malformed line {} of {}: {}", failure.lineNumber(), input.getFileName(),
                            failure.describe());
                        failureSink.recordFailure(FailureRecord.malformedLine(settings.getRunId(), source,
                            failure.lineNumber(), failure.rawText(), failure.describe()));
                        continue;
                    }
                    CanonicalRecord record = normalizer.normalize((RawRecord) line);
                    long accepted = counters.recordsAccepted.incrementAndGet();
                    if (record.degraded()) {
                        counters.recordsDegraded.incrementAndGet();
                    }
                    if (record.truncated()) {
                        counters.recordsTruncated.incrementAndGet();
                    }
                    boolean flushed = accumulator.add(record);
                    if (maxRows != null && accepted >= maxRows) {
                        maxRowsReached = true;
                        log.info("Reached row limit of {}; no further records accepted", maxRows);
                        break;
                    }
                    if (flushed && cancelRequested.get()) {
                        cancelled = true;
                        log.warn("Transform cancelled after {} chunks", accumulator.getChunksFlushed());
                        break;
                    }
                }
                if (!cancelled) {
                    accumulator.finish();
                }
            }
            if (cancelled) {
                // no manifest: the file stays marked as an interrupted transform
                return new TransformOutcome(false, true);
            }
            writer.complete(fingerprint, counters.parseFailures.get(), counters.recordsDegraded.get(),
                counters.recordsTruncated.get(), maxRowsReached);
        }
        failureSink.flush();
        log.info("=== TRANSFORM COMPLETE === read={}, accepted={}, malformed={}, degraded={}, truncated={}, chunks={}",
            counters.recordsRead.get(), counters.recordsAccepted.get(), counters.parseFailures.get(),
            counters.recordsDegraded.get(), counters.recordsTruncated.get(), counters.chunksFlushed.get());
        return new TransformOutcome(maxRowsReached, false);
    }

    private List<SideInputLoader> sideInputs(FailureSink failureSink) {
        Path drugAnnotations = settings.getDrugAnnotationsFile();
        if (drugAnnotations == null) {
            return List.of();
        }
        return List.of(new DrugAnnotationLoader(drugAnnotations, failureSink, settings.getRunId()));
    }

    /**
     * Requests a stop at the next chunk or batch boundary.
     */
    public void cancel() {
        log.warn("Cancellation requested for run {}", settings.getRunId());
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Live counters, for progress reporting while {@link #run()} is in progress.
     */
    public RunCounters getCounters() {
        return counters;
    }
}
