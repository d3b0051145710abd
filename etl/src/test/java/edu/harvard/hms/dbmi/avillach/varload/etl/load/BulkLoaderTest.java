package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.RunCounters;
import edu.harvard.hms.dbmi.avillach.varload.etl.VcfFixtures;
import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.Chunk;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureReason;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.IntermediateFileWriter;
import edu.harvard.hms.dbmi.avillach.varload.etl.sink.SourceFingerprint;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class BulkLoaderTest {

    @TempDir
    Path tempDir;

    private DataSource dataSource;
    private JdbcVariantStore store;
    private FailureSink failureSink;
    private RunCounters counters;

    @BeforeEach
    public void setup() throws IOException {
        dataSource = VcfFixtures.h2();
        store = new JdbcVariantStore(dataSource, StoreDialect.H2, 100);
        failureSink = new FailureSink(tempDir.resolve("failures.jsonl"));
        counters = new RunCounters();
    }

    @AfterEach
    public void tearDown() throws IOException {
        failureSink.close();
    }

    private BulkLoader loader(VariantStore target) {
        return new BulkLoader(target, failureSink, counters, "run-1", List.of());
    }

    private static List<CanonicalRecord> records(int count) {
        List<CanonicalRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(VcfFixtures.record("chr" + (i % 3 + 1), i, "A", "G", "G" + (i % 4), i % 2 == 0 ? "Pathogenic" : "Benign", 0.5));
        }
        return records;
    }

    private Path intermediate(List<CanonicalRecord> records) {
        Path file = tempDir.resolve("variants.csv");
        try (IntermediateFileWriter writer = new IntermediateFileWriter(file)) {
            writer.accept(new Chunk(0, records));
            writer.complete(new SourceFingerprint("in.vcf", 0, 0, 2000, Map.of()), 0, 0, 0, false);
        }
        return file;
    }

    private long count(String table) {
        return new JdbcTemplate(dataSource).queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
    }

    @Test
    public void load_freshStoresEveryRecordAndRebuildsDerivedTables() throws IOException {
        Path file = intermediate(records(10));

        LoadResult result = loader(store).load(file, new LoadOptions(3, true, false), () -> false);

        assertEquals(10, result.recordsLoaded());
        assertEquals(4, result.batchesCommitted());
        assertEquals(10, result.committedRows());
        assertTrue(result.indexesRebuilt());
        assertFalse(result.cancelled());
        assertEquals(4, result.geneRows());
        assertEquals(10L, result.tableCounts().get("variants"));
        assertEquals(10, count("variants"));
        assertEquals(result.summaryRows(), count("mutation_summary"));
        assertEquals(LoadStatus.COMPLETE, store.readLoadState().orElseThrow().status());
        assertEquals(0, failureSink.getTotalFailures());
    }

    @Test
    public void load_resumeSkipsCommittedPrefix() throws IOException {
        List<CanonicalRecord> records = records(10);
        Path file = intermediate(records);
        // an earlier run committed the first four rows and then lost its connection
        store.ensureSchema();
        store.upsertBatch(records.subList(0, 4), new LoadState(VariantSchema.VARIANTS,
            file.toAbsolutePath().normalize().toString(), Files.size(file), 4, LoadStatus.LOADING, Instant.now()));

        LoadResult result = loader(store).load(file, new LoadOptions(4, false, false), () -> false);

        assertEquals(4, result.recordsSkipped());
        assertEquals(6, result.recordsLoaded());
        assertEquals(10, result.committedRows());
        assertEquals(10, count("variants"));
        assertEquals(4, counters.recordsSkippedOnResume.get());
    }

    @Test
    public void load_rerunIsIdempotent() throws IOException {
        Path file = intermediate(records(7));

        loader(store).load(file, new LoadOptions(5, false, false), () -> false);
        long summaryRows = count("mutation_summary");
        LoadResult second = loader(store).load(file, new LoadOptions(5, false, false), () -> false);

        // a completed load is not resumed, every row is upserted again
        assertEquals(0, second.recordsSkipped());
        assertEquals(7, second.recordsLoaded());
        assertEquals(7, count("variants"));
        assertEquals(summaryRows, count("mutation_summary"));
    }

    @Test
    public void load_stateForOtherFileIsNotResumed() throws IOException {
        Path file = intermediate(records(5));
        store.ensureSchema();
        store.saveLoadState(new LoadState(VariantSchema.VARIANTS, "/elsewhere/variants.csv", 1, 3, LoadStatus.LOADING,
            Instant.now()));

        LoadResult result = loader(store).load(file, new LoadOptions(10, false, false), () -> false);

        assertEquals(0, result.recordsSkipped());
        assertEquals(5, result.recordsLoaded());
    }

    @Test
    public void load_refusedRowsAreRejectedIndividually() throws IOException {
        List<CanonicalRecord> records = new ArrayList<>(records(5));
        records.add(2, VcfFixtures.record("1", 99, "A", "T".repeat(150), null, "Unknown", null));
        Path file = intermediate(records);

        LoadResult result = loader(store).load(file, new LoadOptions(4, true, false), () -> false);

        assertEquals(5, result.recordsLoaded());
        assertEquals(1, result.recordsRejected());
        assertEquals(5, count("variants"));
        assertEquals(1, failureSink.getCount(FailureReason.ROW_REJECTED));
        assertEquals(6, store.readLoadState().orElseThrow().committedRows());
    }

    @Test
    public void load_excludeDegradedSkipsFlaggedRecords() throws IOException {
        List<CanonicalRecord> records = new ArrayList<>(records(4));
        CanonicalRecord base = VcfFixtures.record("1", 50, "A", "C", null, "Unknown", null);
        records.add(new CanonicalRecord(base.variantKey(), "1", 50, null, "A", "C", null, null, null, null, null,
            "Unknown", null, null, null, false, false, true, "AF=bad"));
        Path file = intermediate(records);

        LoadResult result = loader(store).load(file, new LoadOptions(2, true, true), () -> false);

        assertEquals(4, result.recordsLoaded());
        assertEquals(1, result.recordsExcluded());
        assertEquals(4, count("variants"));
    }

    @Test
    public void load_cancelStopsBetweenBatches() throws IOException {
        Path file = intermediate(records(10));
        AtomicInteger checks = new AtomicInteger();

        LoadResult result = loader(store).load(file, new LoadOptions(3, true, false), () -> checks.incrementAndGet() > 1);

        assertTrue(result.cancelled());
        assertEquals(3, result.recordsLoaded());
        assertFalse(result.indexesRebuilt());
        LoadState state = store.readLoadState().orElseThrow();
        assertEquals(LoadStatus.LOADING, state.status());
        assertEquals(3, state.committedRows());
    }

    @Test
    public void load_discardsTornTailAndLogsIt() throws IOException {
        Path file = intermediate(records(3));
        Files.writeString(file, "torn,row", java.nio.file.StandardOpenOption.APPEND);

        LoadResult result = loader(store).load(file, new LoadOptions(10, true, false), () -> false);

        assertEquals(3, result.recordsLoaded());
        assertEquals(1, result.rowsDiscarded());
        assertEquals(1, failureSink.getCount(FailureReason.TRUNCATED_INTERMEDIATE_ROW));
    }

    @Test
    public void load_unreachableStoreBeforeAnyCommitIsNotPartial() throws IOException {
        Path file = intermediate(records(3));
        VariantStore down = mock(VariantStore.class);
        doThrow(new DataAccessResourceFailureException("connection refused")).when(down).verifyConnection();

        StoreConnectionException e = assertThrows(StoreConnectionException.class,
            () -> loader(down).load(file, new LoadOptions(2, false, false), () -> false));

        assertFalse(e.isPartiallyLoaded());
        assertEquals(0, e.getCommittedRows());
        verify(down, never()).upsertBatch(anyList(), any());
    }

    @Test
    public void load_connectionLostAfterCommitIsPartial() throws IOException {
        Path file = intermediate(records(6));
        VariantStore flaky = mock(VariantStore.class);
        doNothing()
            .doThrow(new DataAccessResourceFailureException("connection reset"))
            .when(flaky).upsertBatch(anyList(), any());

        StoreConnectionException e = assertThrows(StoreConnectionException.class,
            () -> loader(flaky).load(file, new LoadOptions(2, false, false), () -> false));

        assertTrue(e.isPartiallyLoaded());
        assertEquals(2, e.getCommittedRows());
        verify(flaky, never()).upsert(any());
        verify(flaky, never()).createSecondaryIndexes();
    }

    @Test
    public void load_sideInputsRunAfterGenes() throws IOException {
        Path file = intermediate(records(4));
        SideInputLoader sideInput = mock(SideInputLoader.class);
        when(sideInput.name()).thenReturn("extra");
        when(sideInput.load(store)).thenReturn(7L);

        LoadResult result = new BulkLoader(store, failureSink, counters, "run-1", List.of(sideInput))
            .load(file, new LoadOptions(10, true, false), () -> false);

        assertEquals(7L, result.sideInputRows().get("extra"));
        verify(sideInput).load(store);
    }
}
