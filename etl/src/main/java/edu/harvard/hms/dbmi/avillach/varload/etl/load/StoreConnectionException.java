package edu.harvard.hms.dbmi.avillach.varload.etl.load;

/**
 * The target store became unreachable.
 *
 * Before any batch committed this is a plain retryable failure. Afterwards the store is partially
 * loaded with indexes not rebuilt; a rerun without "start fresh" picks up from the committed watermark.
 */
public class StoreConnectionException extends RuntimeException {

    private static final long serialVersionUID = 7373316093489209436L;

    private final boolean partiallyLoaded;
    private final long committedRows;

    public StoreConnectionException(String message, Throwable cause, boolean partiallyLoaded, long committedRows) {
        super(message, cause);
        this.partiallyLoaded = partiallyLoaded;
        this.committedRows = committedRows;
    }

    public boolean isPartiallyLoaded() {
        return partiallyLoaded;
    }

    public long getCommittedRows() {
        return committedRows;
    }
}
