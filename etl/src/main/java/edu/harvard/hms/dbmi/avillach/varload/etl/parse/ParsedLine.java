package edu.harvard.hms.dbmi.avillach.varload.etl.parse;

/**
 * One data line as seen by {@link RecordParser}: either a structurally complete record or a failure.
 */
public sealed interface ParsedLine permits RawRecord, ParseFailure {

    long lineNumber();
}
