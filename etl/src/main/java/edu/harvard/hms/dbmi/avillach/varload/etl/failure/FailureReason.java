package edu.harvard.hms.dbmi.avillach.varload.etl.failure;

/**
 * Stable enumeration of failure reasons written to the failure log.
 */
public enum FailureReason {
    MALFORMED_LINE("Source line has fewer than the required fields"),
    ROW_REJECTED("Target store rejected the row"),
    TRUNCATED_INTERMEDIATE_ROW("Intermediate file ends with an incomplete row"),
    SIDE_INPUT_ROW_INVALID("Side input row is missing required values");

    private final String description;

    FailureReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
