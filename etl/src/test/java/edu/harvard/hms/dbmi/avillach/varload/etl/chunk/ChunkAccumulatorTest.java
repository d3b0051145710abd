package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import edu.harvard.hms.dbmi.avillach.varload.etl.VcfFixtures;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChunkAccumulatorTest {

    private static List<CanonicalRecord> records(int count) {
        List<CanonicalRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(VcfFixtures.record("1", i + 1, "A", "G", null, "Unknown", null));
        }
        return records;
    }

    private static List<Chunk> accumulate(int chunkSize, List<CanonicalRecord> records) throws IOException {
        List<Chunk> chunks = new ArrayList<>();
        ChunkAccumulator accumulator = new ChunkAccumulator(chunkSize, chunks::add);
        for (CanonicalRecord record : records) {
            accumulator.add(record);
        }
        accumulator.finish();
        return chunks;
    }

    @Test
    public void add_flushesAtChunkSizeAndFinishFlushesRemainder() throws IOException {
        List<Chunk> chunks = accumulate(4, records(10));

        assertEquals(3, chunks.size());
        assertEquals(List.of(4, 4, 2), chunks.stream().map(Chunk::size).toList());
        assertEquals(List.of(0L, 1L, 2L), chunks.stream().map(Chunk::index).toList());
    }

    @Test
    public void add_bufferNeverExceedsChunkSize() throws IOException {
        int chunkSize = 100;
        List<Chunk> small = new ArrayList<>();
        ChunkAccumulator smallRun = new ChunkAccumulator(chunkSize, small::add);
        for (CanonicalRecord r : records(1_000)) {
            smallRun.add(r);
        }
        smallRun.finish();

        List<Chunk> large = new ArrayList<>();
        ChunkAccumulator largeRun = new ChunkAccumulator(chunkSize, chunk -> {
            // the sink releases each chunk, as the file writer does
        });
        for (CanonicalRecord r : records(10_000)) {
            largeRun.add(r);
            assertTrue(largeRun.getBuffered() < chunkSize);
        }
        largeRun.finish();

        assertEquals(chunkSize, smallRun.getPeakBuffered());
        assertEquals(smallRun.getPeakBuffered(), largeRun.getPeakBuffered());
        assertEquals(10_000, largeRun.getRecordsFlushed());
        assertEquals(100, largeRun.getChunksFlushed());
        assertEquals(0, largeRun.getBuffered());
    }

    @Test
    public void chunkSizeDoesNotChangeOutput() throws IOException {
        List<CanonicalRecord> input = records(57);

        for (int chunkSize : new int[]{1, 7, 10_000}) {
            List<CanonicalRecord> output = new ArrayList<>();
            for (Chunk chunk : accumulate(chunkSize, input)) {
                output.addAll(chunk.records());
            }
            assertEquals(input, output, "chunk size " + chunkSize);
        }
    }

    @Test
    public void finish_emptyInputFlushesNothing() throws IOException {
        assertTrue(accumulate(5, List.of()).isEmpty());
    }

    @Test
    public void add_afterFinishIsRejected() throws IOException {
        ChunkAccumulator accumulator = new ChunkAccumulator(2, chunk -> { });
        accumulator.finish();

        assertThrows(IllegalStateException.class, () -> accumulator.add(records(1).get(0)));
    }

    @Test
    public void constructor_rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkAccumulator(0, chunk -> { }));
    }
}
