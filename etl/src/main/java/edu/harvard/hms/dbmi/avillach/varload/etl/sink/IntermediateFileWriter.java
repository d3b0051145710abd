package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.Chunk;
import edu.harvard.hms.dbmi.avillach.varload.etl.chunk.ChunkSink;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends chunks to the intermediate CSV file: opened once, appended once per chunk, closed once.
 *
 * Every chunk is flushed before {@link #accept} returns, so after a crash the file holds whole
 * chunks plus at most one torn row at the end, which the reader discards. The manifest that marks
 * the file as complete is only written by {@link #complete}.
 */
public class IntermediateFileWriter implements ChunkSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IntermediateFileWriter.class);

    private final Path file;
    private final CSVPrinter printer;
    private long recordsWritten = 0;
    private boolean closed = false;

    public IntermediateFileWriter(Path file) {
        this.file = file;
        try {
            IntermediateManifest.delete(file);
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE);
            this.printer = new CSVPrinter(writer, IntermediateFormat.WRITE_FORMAT);
            this.printer.flush();
        } catch (IOException e) {
            throw new SinkWriteException("Cannot open intermediate file " + file, e);
        }
        log.info("Writing intermediate file {}", file);
    }

    @Override
    public void accept(Chunk chunk) {
        if (closed) {
            throw new IllegalStateException("Intermediate file writer is closed");
        }
        try {
            for (CanonicalRecord record : chunk.records()) {
                printer.printRecord(IntermediateFormat.toRow(record));
            }
            printer.flush();
        } catch (IOException e) {
            throw new SinkWriteException("Failed writing chunk " + chunk.index() + " to " + file, e);
        }
        recordsWritten += chunk.size();
        log.info("Wrote chunk {} ({} records, {} total) to {}", chunk.index(), chunk.size(), recordsWritten, file.getFileName());
    }

    /**
     * Closes the file and writes the manifest marking it as a complete transform output.
     */
    public void complete(SourceFingerprint source, long parseFailures, long degraded, long truncated, boolean maxRowsReached) {
        close();
        IntermediateManifest manifest = new IntermediateManifest(source, recordsWritten, parseFailures, degraded, truncated,
            maxRowsReached, Instant.now().toString());
        try {
            manifest.write(file);
        } catch (IOException e) {
            throw new SinkWriteException("Failed writing manifest for " + file, e);
        }
        log.info("Completed intermediate file {} with {} records", file, recordsWritten);
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }

    public Path getFile() {
        return file;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            printer.close(true);
        } catch (IOException e) {
            throw new SinkWriteException("Failed closing intermediate file " + file, e);
        }
    }
}
