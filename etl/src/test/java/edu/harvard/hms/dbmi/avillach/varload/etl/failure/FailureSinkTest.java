package edu.harvard.hms.dbmi.avillach.varload.etl.failure;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FailureSinkTest {

    @TempDir
    Path tempDir;

    @Test
    public void recordFailure_writesJsonLinesAndLogsRollup() throws IOException {
        Path log = tempDir.resolve("out").resolve("failures.jsonl");
        Logger mockLogger = mock(Logger.class);
        try (FailureSink sink = new FailureSink(log, mockLogger)) {
            sink.recordFailure(FailureRecord.malformedLine("run-1", "in.vcf", 7, "1\t2", "Line 7 has 2 fields"));
            sink.recordFailure(FailureRecord.malformedLine("run-1", "in.vcf", 9, "x", "Line 9 has 1 fields"));
            sink.recordFailure(FailureRecord.rejectedRow("run-1", "variants.csv", "abc", "1:5 A>G", "value too long"));

            assertEquals(3, sink.getTotalFailures());
            assertEquals(2, sink.getCount(FailureReason.MALFORMED_LINE));
            assertEquals(1, sink.getCount(FailureReason.ROW_REJECTED));
            assertEquals(0, sink.getCount(FailureReason.SIDE_INPUT_ROW_INVALID));
        }

        List<String> lines = Files.readAllLines(log);
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("PARSE", first.get("stage").asText());
        assertEquals(7, first.get("lineNumber").asLong());
        assertEquals("MALFORMED_LINE", first.get("reasonCode").asText());
        assertFalse(first.has("variantKey"));

        JsonNode rejected = new ObjectMapper().readTree(lines.get(2));
        assertEquals("abc", rejected.get("variantKey").asText());
        assertFalse(rejected.has("lineNumber"));

        assertEquals(3, lines.size());
        verify(mockLogger).info("  {}: {}", FailureReason.MALFORMED_LINE, 2L);
        verify(mockLogger).info("Total failures: {}", 3L);
    }

    @Test
    public void recordFailure_appendedRunsStayLineParseable() throws IOException {
        Path log = tempDir.resolve("failures.jsonl");
        try (FailureSink first = new FailureSink(log)) {
            first.recordFailure(FailureRecord.malformedLine("run-1", "in.vcf", 3, "x", "Line 3 has 1 fields"));
        }
        try (FailureSink second = new FailureSink(log)) {
            second.recordFailure(FailureRecord.rejectedRow("run-2", "variants.csv", "def", "1:9 C>T", "value too long"));
            second.recordFailure(FailureRecord.discardedIntermediateRow("run-2", "variants.csv", 4, "Row has 2 columns"));
        }

        List<String> lines = Files.readAllLines(log);
        assertEquals(3, lines.size());
        ObjectMapper mapper = new ObjectMapper();
        for (String line : lines) {
            assertTrue(mapper.readTree(line).has("reasonCode"), line);
        }
        assertEquals("run-2", mapper.readTree(lines.get(2)).get("runId").asText());
    }

    @Test
    public void close_withoutFailuresLogsNoRollup() throws IOException {
        Logger mockLogger = mock(Logger.class);
        new FailureSink(tempDir.resolve("quiet.jsonl"), mockLogger).close();

        verify(mockLogger, never()).info(eq("Total failures: {}"), any(Object.class));
    }

    @Test
    public void close_withoutFailuresLeavesEmptyLog() throws IOException {
        Path log = tempDir.resolve("failures.jsonl");
        new FailureSink(log).close();

        assertEquals(0, Files.size(log));
    }
}
