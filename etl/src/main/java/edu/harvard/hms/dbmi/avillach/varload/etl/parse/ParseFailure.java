package edu.harvard.hms.dbmi.avillach.varload.etl.parse;

/**
 * A data line that could not be split into the required fields. Carries the raw text so it can
 * be logged and reprocessed.
 */
public record ParseFailure(long lineNumber, String rawText, int fieldCount) implements ParsedLine {

    public String describe() {
        return "Line " + lineNumber + " has " + fieldCount + " fields, expected at least " + RawRecord.REQUIRED_FIELDS;
    }
}
