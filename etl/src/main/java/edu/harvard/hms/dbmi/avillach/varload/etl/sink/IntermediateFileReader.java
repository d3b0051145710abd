package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * Streams the intermediate file back in batches. Holds at most one batch in memory.
 *
 * The writer ends every row with a line break, so a file whose last byte is not one ends in the torn
 * row of an interrupted write, even when that row happens to split into the right number of columns.
 * Such a final row, a row with the wrong number of columns, and an unterminated quoted field at the
 * end of the file are skipped and reported to the discard callback.
 */
public class IntermediateFileReader implements AutoCloseable {

    private final Logger log;
    private final Path file;
    private final CSVParser parser;
    private final Iterator<CSVRecord> rows;
    private final Consumer<DiscardedRow> discardHandler;

    private long rowsRead = 0;
    private long rowsDiscarded = 0;
    private boolean exhausted = false;
    private final boolean unterminatedTail;
    private RuntimeException pendingFailure;

    /**
     * A row that could not be turned back into a record.
     *
     * @param rowNumber 1-based data row number
     */
    public record DiscardedRow(long rowNumber, String detail) {
    }

    public IntermediateFileReader(Path file, Consumer<DiscardedRow> discardHandler) {
        this(file, discardHandler, LoggerFactory.getLogger(IntermediateFileReader.class));
    }

    // For testing only
    IntermediateFileReader(Path file, Consumer<DiscardedRow> discardHandler, Logger log) {
        this.log = log;
        this.file = file;
        this.discardHandler = discardHandler;
        if (!Files.isRegularFile(file)) {
            throw new IntermediateFileException("Intermediate file not found: " + file.toAbsolutePath(),
                new FileNotFoundException(file.toString()));
        }
        try {
            this.unterminatedTail = endsWithoutLineBreak(file);
            this.parser = CSVParser.parse(file, StandardCharsets.UTF_8, IntermediateFormat.READ_FORMAT);
        } catch (IOException e) {
            throw new IntermediateFileException("Cannot open intermediate file " + file, e);
        }
        List<String> header = parser.getHeaderNames();
        if (!header.equals(Arrays.asList(IntermediateFormat.COLUMNS))) {
            closeQuietly();
            throw new IntermediateFileException("Unexpected intermediate file header in " + file + ": " + header);
        }
        this.rows = parser.iterator();
    }

    /**
     * Skips the first {@code count} data rows, e.g. rows already committed by an earlier run.
     *
     * @return number of rows actually skipped
     */
    public long skip(long count) {
        long skipped = 0;
        while (skipped < count && nextRow() != null) {
            skipped++;
        }
        return skipped;
    }

    /**
     * @return up to {@code size} records; an empty list once the file is exhausted
     */
    public List<CanonicalRecord> readBatch(int size) {
        List<CanonicalRecord> batch = new ArrayList<>(Math.min(size, 4096));
        while (batch.size() < size) {
            CSVRecord row = nextRow();
            if (row == null) {
                break;
            }
            CanonicalRecord record = convert(row);
            if (record != null) {
                batch.add(record);
            }
        }
        return batch;
    }

    private CSVRecord nextRow() {
        if (exhausted) {
            return null;
        }
        RuntimeException failure = pendingFailure;
        try {
            if (failure == null) {
                if (!rows.hasNext()) {
                    exhausted = true;
                    return null;
                }
                CSVRecord row = rows.next();
                rowsRead++;
                if (unterminatedTail && isLastRow()) {
                    exhausted = true;
                    discard(rowsRead, "Final row is not terminated by a line break");
                    return null;
                }
                return row;
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            failure = e;
        }
        // commons-csv reports an unterminated quoted field at EOF this way
        exhausted = true;
        rowsRead++;
        discard(rowsRead, "Incomplete final row: " + failure.getMessage());
        return null;
    }

    /**
     * Looks one row ahead. A failure while doing so belongs to the next row and is kept for it.
     */
    private boolean isLastRow() {
        try {
            return !rows.hasNext();
        } catch (UncheckedIOException | IllegalStateException e) {
            pendingFailure = e;
            return false;
        }
    }

    private static boolean endsWithoutLineBreak(Path file) throws IOException {
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }

    private CanonicalRecord convert(CSVRecord row) {
        if (row.size() != IntermediateFormat.COLUMNS.length) {
            discard(rowsRead, "Row has " + row.size() + " columns, expected " + IntermediateFormat.COLUMNS.length);
            return null;
        }
        try {
            return IntermediateFormat.fromRow(row);
        } catch (NumberFormatException e) {
            discard(rowsRead, "Unreadable value: " + e.getMessage());
            return null;
        }
    }

    private void discard(long rowNumber, String detail) {
        rowsDiscarded++;
        log.warn("Discarding intermediate row {} of {}: {}", rowNumber, file.getFileName(), detail);
        discardHandler.accept(new DiscardedRow(rowNumber, detail));
    }

    /**
     * Data rows consumed so far, including discarded ones. This is the load watermark unit.
     */
    public long getRowsRead() {
        return rowsRead;
    }

    public long getRowsDiscarded() {
        return rowsDiscarded;
    }

    public Path getFile() {
        return file;
    }

    private void closeQuietly() {
        try {
            parser.close();
        } catch (IOException e) {
            log.warn("Failed closing {}", file, e);
        }
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
