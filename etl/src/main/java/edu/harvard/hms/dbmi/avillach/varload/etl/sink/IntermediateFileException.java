package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

/**
 * The intermediate file is missing or does not have the expected column layout.
 */
public class IntermediateFileException extends RuntimeException {

    private static final long serialVersionUID = -6219484340316127436L;

    public IntermediateFileException(String message) {
        super(message);
    }

    public IntermediateFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
