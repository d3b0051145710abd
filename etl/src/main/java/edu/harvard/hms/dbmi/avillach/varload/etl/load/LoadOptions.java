package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import com.google.common.base.Preconditions;

/**
 * @param batchSize       records submitted to the store per transaction
 * @param startFresh      drop and recreate the destination before loading
 * @param excludeDegraded skip records flagged degraded instead of storing them with the flag
 */
public record LoadOptions(int batchSize, boolean startFresh, boolean excludeDegraded) {

    public static final int DEFAULT_BATCH_SIZE = 100_000;

    public LoadOptions {
        Preconditions.checkArgument(batchSize > 0, "batch size must be positive: %s", batchSize);
    }
}
