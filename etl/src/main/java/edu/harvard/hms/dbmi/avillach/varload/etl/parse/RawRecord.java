package edu.harvard.hms.dbmi.avillach.varload.etl.parse;

/**
 * The structural fields of one data line, exactly as they appear in the source. No value has been
 * interpreted yet: position and quality are still text, the INFO column is still an opaque blob.
 */
public record RawRecord(
    long lineNumber,
    String chromosome,
    String position,
    String id,
    String reference,
    String alternate,
    String quality,
    String filter,
    String info
) implements ParsedLine {

    public static final int CHROM = 0, POS = 1, ID = 2, REF = 3, ALT = 4, QUAL = 5, FILTER = 6, INFO = 7;

    public static final int REQUIRED_FIELDS = 8;
}
