package edu.harvard.hms.dbmi.avillach.varload.etl.parse;

import com.google.common.base.Splitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Splits a VCF character stream into {@link ParsedLine}s, one per data line.
 *
 * Lines starting with {@code #} are metadata/header lines and are skipped. Blank lines are skipped.
 * Every other line yields a {@link RawRecord} if it has at least {@link RawRecord#REQUIRED_FIELDS}
 * tab-separated fields, otherwise a {@link ParseFailure}; parsing always continues with the next line.
 *
 * The sequence is lazy and single-pass. To parse again, open a new parser on a new stream.
 */
public class RecordParser implements Iterator<ParsedLine>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

    private static final Splitter FIELD_SPLITTER = Splitter.on('\t');

    private final BufferedReader reader;
    private final String sourceName;

    private long lineNumber = 0;
    private long headerLines = 0;
    private ParsedLine next;
    private boolean exhausted = false;

    public RecordParser(Reader reader, String sourceName) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.sourceName = sourceName;
    }

    @Override
    public boolean hasNext() {
        if (next == null && !exhausted) {
            next = advance();
            if (next == null) {
                exhausted = true;
                log.debug("Reached end of {} after {} lines ({} header lines)", sourceName, lineNumber, headerLines);
            }
        }
        return next != null;
    }

    @Override
    public ParsedLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ParsedLine current = next;
        next = null;
        return current;
    }

    private ParsedLine advance() {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("#")) {
                    headerLines++;
                    continue;
                }
                if (line.endsWith("\r")) {
                    line = line.substring(0, line.length() - 1);
                }
                if (line.isBlank()) {
                    continue;
                }
                return split(line, lineNumber);
            }
            return null;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed reading " + sourceName + " after line " + lineNumber, e);
        }
    }

    static ParsedLine split(String line, long lineNumber) {
        List<String> fields = FIELD_SPLITTER.splitToList(line);
        if (fields.size() < RawRecord.REQUIRED_FIELDS) {
            return new ParseFailure(lineNumber, line, fields.size());
        }
        return new RawRecord(
            lineNumber,
            fields.get(RawRecord.CHROM),
            fields.get(RawRecord.POS),
            fields.get(RawRecord.ID),
            fields.get(RawRecord.REF),
            fields.get(RawRecord.ALT),
            fields.get(RawRecord.QUAL),
            fields.get(RawRecord.FILTER),
            fields.get(RawRecord.INFO)
        );
    }

    public long getLineNumber() {
        return lineNumber;
    }

    public long getHeaderLines() {
        return headerLines;
    }

    public String getSourceName() {
        return sourceName;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
