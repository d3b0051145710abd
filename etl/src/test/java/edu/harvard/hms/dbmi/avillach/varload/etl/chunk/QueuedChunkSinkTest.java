package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import edu.harvard.hms.dbmi.avillach.varload.etl.VcfFixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Collections;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueuedChunkSinkTest {

    private static Chunk chunk(long index) {
        return new Chunk(index, List.of(VcfFixtures.record("1", index + 1, "A", "T", null, "Unknown", null)));
    }

    @Test
    public void accept_deliversChunksInArrivalOrder() throws IOException {
        List<Long> written = Collections.synchronizedList(new ArrayList<>());
        try (QueuedChunkSink sink = new QueuedChunkSink(c -> {
            written.add(c.index());
        })) {
            for (long i = 0; i < 50; i++) {
                sink.accept(chunk(i));
            }
        }

        List<Long> expected = new ArrayList<>();
        for (long i = 0; i < 50; i++) {
            expected.add(i);
        }
        assertEquals(expected, written);
    }

    @Test
    public void writerFailureReachesProducer() {
        QueuedChunkSink sink = new QueuedChunkSink(c -> {
            throw new IOException("disk full");
        });

        IOException failure = assertThrows(IOException.class, () -> {
            for (long i = 0; i < 10; i++) {
                sink.accept(chunk(i));
            }
            sink.close();
        });
        assertEquals("disk full", failure.getMessage());
    }

    @Test
    public void writerErrorReachesProducer() {
        List<Long> written = Collections.synchronizedList(new ArrayList<>());
        QueuedChunkSink sink = new QueuedChunkSink(c -> {
            if (c.index() == 1) {
                throw new StackOverflowError("writer blew its stack");
            }
            written.add(c.index());
        });

        StackOverflowError failure = assertThrows(StackOverflowError.class, () -> {
            for (long i = 0; i < 10; i++) {
                sink.accept(chunk(i));
            }
            sink.close();
        });
        assertEquals("writer blew its stack", failure.getMessage());
        assertEquals(List.of(0L), written);
    }

    @Test
    public void close_isIdempotent() throws IOException {
        QueuedChunkSink sink = new QueuedChunkSink(c -> { });
        sink.accept(chunk(0));
        sink.close();
        sink.close();
    }
}
