package edu.harvard.hms.dbmi.avillach.varload.etl.failure;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.EnumMap;
import java.util.Map;

/**
 * JSONL failure log. Writes one JSON object per line and nothing else, so the file stays line-parseable
 * when several runs append to it. The per-reason rollup of a run goes to the application log on close.
 *
 * Thread-safe: the pipelined transform and the loader may report from different threads.
 */
public class FailureSink implements AutoCloseable {
    private final Logger log;

    private final Path outputFile;
    private final BufferedWriter writer;
    private final ObjectMapper mapper = new ObjectMapper();

    private final Map<FailureReason, Long> rollup = new EnumMap<>(FailureReason.class);
    private long totalFailures = 0;

    public FailureSink(Path outputFile) throws IOException {
        this(outputFile, LoggerFactory.getLogger(FailureSink.class));
    }

    // For testing only
    FailureSink(Path outputFile, Logger log) throws IOException {
        this.log = log;
        this.outputFile = outputFile;
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(outputFile,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND,
            StandardOpenOption.WRITE);
        log.info("Initialized failure sink: {}", outputFile);
    }

    /**
     * Records a failure. An unwritable failure log is not a reason to lose the run, so write
     * errors are logged and the failure is still counted.
     */
    public synchronized void recordFailure(FailureRecord record) {
        rollup.merge(record.reasonCode(), 1L, Long::sum);
        totalFailures++;
        try {
            writer.write(mapper.writeValueAsString(record));
            writer.newLine();
        } catch (IOException e) {
            log.error("Failed to write failure record {}", record, e);
        }
    }

    public synchronized long getTotalFailures() {
        return totalFailures;
    }

    public synchronized long getCount(FailureReason reason) {
        return rollup.getOrDefault(reason, 0L);
    }

    public synchronized void flush() {
        try {
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void logRollup() {
        if (totalFailures == 0) {
            return;
        }
        log.info("--- FAILURE ROLLUP ({}) ---", outputFile.getFileName());
        for (Map.Entry<FailureReason, Long> entry : rollup.entrySet()) {
            log.info("  {}: {}", entry.getKey(), entry.getValue());
        }
        log.info("Total failures: {}", totalFailures);
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        logRollup();
        log.info("Closed failure sink: {}", outputFile);
    }
}
