package edu.harvard.hms.dbmi.avillach.varload.etl.chunk;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;

import java.util.List;

/**
 * An ordered, bounded run of canonical records in input order.
 *
 * @param index zero-based position of this chunk in the run
 */
public record Chunk(long index, List<CanonicalRecord> records) {

    public Chunk {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
