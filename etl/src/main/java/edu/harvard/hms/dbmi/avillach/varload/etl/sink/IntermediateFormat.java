package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Column layout and CSV dialect of the intermediate file. The column order is the field order of
 * {@link CanonicalRecord}; a null value is written as {@code \N} so it stays distinct from an
 * empty string.
 */
public final class IntermediateFormat {

    public static final String NULL_MARKER = "\\N";

    public static final String[] COLUMNS = {
        "variant_key", "chromosome", "position", "variant_name", "reference_allele", "alternate_allele", "quality",
        "filter_status", "allele_frequency", "allele_count", "total_alleles", "clinical_significance", "disease_name",
        "gene_symbol", "gene_id", "ref_truncated", "alt_truncated", "degraded", "info_raw"
    };

    static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader(COLUMNS)
        .setNullString(NULL_MARKER)
        .setRecordSeparator('\n')
        .build();

    static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setNullString(NULL_MARKER)
        .build();

    private IntermediateFormat() {
    }

    public static Path manifestPath(Path intermediateFile) {
        return intermediateFile.resolveSibling(intermediateFile.getFileName() + ".manifest.json");
    }

    static List<Object> toRow(CanonicalRecord r) {
        List<Object> row = new ArrayList<>(COLUMNS.length);
        row.add(r.variantKey());
        row.add(r.chromosome());
        row.add(r.position());
        row.add(r.variantName());
        row.add(r.reference());
        row.add(r.alternate());
        row.add(r.quality());
        row.add(r.filter());
        row.add(r.alleleFrequency());
        row.add(r.alleleCount());
        row.add(r.totalAlleles());
        row.add(r.clinicalSignificance());
        row.add(r.diseaseName());
        row.add(r.geneSymbol());
        row.add(r.geneId());
        row.add(r.referenceTruncated());
        row.add(r.alternateTruncated());
        row.add(r.degraded());
        row.add(r.infoRaw());
        return row;
    }

    static CanonicalRecord fromRow(CSVRecord row) {
        return new CanonicalRecord(
            row.get(0),
            row.get(1),
            Long.parseLong(row.get(2)),
            row.get(3),
            row.get(4),
            row.get(5),
            parseDouble(row.get(6)),
            row.get(7),
            parseDouble(row.get(8)),
            parseInteger(row.get(9)),
            parseInteger(row.get(10)),
            row.get(11),
            row.get(12),
            row.get(13),
            row.get(14),
            Boolean.parseBoolean(row.get(15)),
            Boolean.parseBoolean(row.get(16)),
            Boolean.parseBoolean(row.get(17)),
            row.get(18)
        );
    }

    private static Double parseDouble(String value) {
        return value == null ? null : Double.valueOf(value);
    }

    private static Integer parseInteger(String value) {
        return value == null ? null : Integer.valueOf(value);
    }
}
