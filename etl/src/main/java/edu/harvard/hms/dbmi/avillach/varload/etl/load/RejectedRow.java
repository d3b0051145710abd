package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;

/**
 * A record the store refused when its batch was replayed row by row.
 */
public record RejectedRow(String variantKey, String locus, String reason) {

    public static RejectedRow of(CanonicalRecord record, String reason) {
        return new RejectedRow(record.variantKey(),
            record.chromosome() + ":" + record.position() + " " + record.reference() + ">" + record.alternate(), reason);
    }
}
