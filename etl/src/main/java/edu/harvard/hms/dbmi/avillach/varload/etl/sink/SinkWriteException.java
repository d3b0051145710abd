package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

/**
 * The intermediate file could not be written. Fatal to the run: once the checkpoint between
 * transform and load is unreliable there is no safe way to continue.
 */
public class SinkWriteException extends RuntimeException {

    private static final long serialVersionUID = 4081137605216283011L;

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
