package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import com.google.common.base.Splitter;

import java.util.List;

/**
 * Storage-ready form of one variant line. Self-contained: it can be validated and inserted
 * without looking at any other record.
 *
 * String widths are the column widths of the target store; alleles are bounded by the configured
 * maximum allele length instead.
 */
public record CanonicalRecord(
    String variantKey,
    String chromosome,
    long position,
    String variantName,
    String reference,
    String alternate,
    Double quality,
    String filter,
    Double alleleFrequency,
    Integer alleleCount,
    Integer totalAlleles,
    String clinicalSignificance,
    String diseaseName,
    String geneSymbol,
    String geneId,
    boolean referenceTruncated,
    boolean alternateTruncated,
    boolean degraded,
    String infoRaw
) {

    public static final long UNKNOWN_POSITION = 0L;

    public static final int CHROMOSOME_WIDTH = 32;
    public static final int VARIANT_NAME_WIDTH = 255;
    public static final int FILTER_WIDTH = 128;
    public static final int CLINICAL_SIGNIFICANCE_WIDTH = 255;
    public static final int DISEASE_NAME_WIDTH = 1000;
    public static final int GENE_SYMBOL_WIDTH = 64;
    public static final int GENE_ID_WIDTH = 32;
    public static final int VARIANT_KEY_WIDTH = 64;

    private static final Splitter ALT_SPLITTER = Splitter.on(',');

    public boolean truncated() {
        return referenceTruncated || alternateTruncated;
    }

    public List<String> alternates() {
        return alternate == null ? List.of() : ALT_SPLITTER.splitToList(alternate);
    }
}
