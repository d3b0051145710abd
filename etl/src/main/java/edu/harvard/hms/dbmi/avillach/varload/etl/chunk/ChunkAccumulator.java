package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Buffers canonical records and hands them downstream in chunks of at most {@code chunkSize}.
 *
 * The flush is synchronous: {@link #add} does not return until the sink has taken the full chunk,
 * so the accumulator can never run ahead of the writer and never holds more than one chunk.
 */
public class ChunkAccumulator {

    private static final Logger log = LoggerFactory.getLogger(ChunkAccumulator.class);

    private final int chunkSize;
    private final ChunkSink sink;

    private List<CanonicalRecord> buffer;
    private long chunksFlushed = 0;
    private long recordsFlushed = 0;
    private int peakBuffered = 0;
    private boolean finished = false;

    public ChunkAccumulator(int chunkSize, ChunkSink sink) {
        Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive, was %s", chunkSize);
        this.chunkSize = chunkSize;
        this.sink = sink;
        this.buffer = new ArrayList<>(initialCapacity());
    }

    /**
     * @return true if this record completed a chunk and the chunk was flushed
     */
    public boolean add(CanonicalRecord record) throws IOException {
        Preconditions.checkState(!finished, "accumulator already finished");
        buffer.add(record);
        peakBuffered = Math.max(peakBuffered, buffer.size());
        if (buffer.size() >= chunkSize) {
            flush();
            return true;
        }
        return false;
    }

    /**
     * Flushes the trailing partial chunk, if any. No records may be added afterwards.
     */
    public void finish() throws IOException {
        if (finished) {
            return;
        }
        if (!buffer.isEmpty()) {
            flush();
        }
        finished = true;
    }

    private void flush() throws IOException {
        Chunk chunk = new Chunk(chunksFlushed, buffer);
        // release before handing off so only the chunk's own copy stays reachable
        buffer = new ArrayList<>(initialCapacity());
        sink.accept(chunk);
        chunksFlushed++;
        recordsFlushed += chunk.size();
        log.debug("Flushed chunk {} ({} records, {} total)", chunk.index(), chunk.size(), recordsFlushed);
    }

    private int initialCapacity() {
        return Math.min(chunkSize, 1024);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getBuffered() {
        return buffer.size();
    }

    public int getPeakBuffered() {
        return peakBuffered;
    }

    public long getChunksFlushed() {
        return chunksFlushed;
    }

    public long getRecordsFlushed() {
        return recordsFlushed;
    }
}
