package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import java.io.IOException;

/**
 * Downstream of the {@link ChunkAccumulator}. Must be done with the chunk when {@code accept} returns.
 */
@FunctionalInterface
public interface ChunkSink {

    void accept(Chunk chunk) throws IOException;
}
