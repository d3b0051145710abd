package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.varload.etl.parse.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link RawRecord} into a {@link CanonicalRecord}.
 *
 * This is a total function: bad values degrade the record (flag + sentinel/null) instead of
 * rejecting it, and over-long alleles are truncated with an explicit flag. Normalization never
 * looks at any other record, so chunks can be normalized independently.
 */
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    public static final int DEFAULT_MAX_ALLELE_LENGTH = 2000;

    private final int maxAlleleLength;
    private final AnnotationDecoder annotationDecoder;

    public Normalizer() {
        this(DEFAULT_MAX_ALLELE_LENGTH, new ClinicalSignificanceMapper());
    }

    public Normalizer(int maxAlleleLength, ClinicalSignificanceMapper clinicalSignificanceMapper) {
        Preconditions.checkArgument(maxAlleleLength > 0, "maxAlleleLength must be positive, was %s", maxAlleleLength);
        this.maxAlleleLength = maxAlleleLength;
        this.annotationDecoder = new AnnotationDecoder(clinicalSignificanceMapper);
    }

    public CanonicalRecord normalize(RawRecord raw) {
        boolean degraded = false;

        String rawChromosome = trimToNull(raw.chromosome());
        if (rawChromosome == null) {
            log.debug("Line {}: empty chromosome", raw.lineNumber());
            rawChromosome = "";
            degraded = true;
        }
        String chromosome = bounded(rawChromosome, CanonicalRecord.CHROMOSOME_WIDTH);
        String rawPosition = raw.position() == null ? "" : raw.position().trim();
        long position = parsePosition(rawPosition);
        if (position == CanonicalRecord.UNKNOWN_POSITION) {
            log.debug("Line {}: position '{}' is not a positive integer", raw.lineNumber(), rawPosition);
            degraded = true;
        }

        String quality = missingToNull(raw.quality());
        Double qual = null;
        if (quality != null) {
            try {
                qual = Double.parseDouble(quality);
            } catch (NumberFormatException e) {
                log.debug("Line {}: quality '{}' is not numeric", raw.lineNumber(), quality);
                degraded = true;
            }
        }

        String info = raw.info() == null ? "" : raw.info();
        AnnotationFields annotations = annotationDecoder.decode(info);
        if (annotations.coercionFailed()) {
            log.debug("Line {}: unparseable numeric annotation in '{}'", raw.lineNumber(), info);
            degraded = true;
        }

        String reference = raw.reference() == null ? "" : raw.reference().trim();
        String alternate = raw.alternate() == null ? "" : raw.alternate().trim();
        String variantKey = VariantKeys.derive(rawChromosome, rawPosition, reference, alternate);
        boolean referenceTruncated = reference.length() > maxAlleleLength;
        boolean alternateTruncated = alternate.length() > maxAlleleLength;

        return new CanonicalRecord(
            variantKey,
            chromosome,
            position,
            bounded(missingToNull(raw.id()), CanonicalRecord.VARIANT_NAME_WIDTH),
            referenceTruncated ? reference.substring(0, maxAlleleLength) : reference,
            alternateTruncated ? alternate.substring(0, maxAlleleLength) : alternate,
            qual,
            bounded(missingToNull(raw.filter()), CanonicalRecord.FILTER_WIDTH),
            annotations.alleleFrequency(),
            annotations.alleleCount(),
            annotations.totalAlleles(),
            bounded(annotations.clinicalSignificance(), CanonicalRecord.CLINICAL_SIGNIFICANCE_WIDTH),
            bounded(annotations.diseaseName(), CanonicalRecord.DISEASE_NAME_WIDTH),
            bounded(annotations.geneSymbol(), CanonicalRecord.GENE_SYMBOL_WIDTH),
            bounded(annotations.geneId(), CanonicalRecord.GENE_ID_WIDTH),
            referenceTruncated,
            alternateTruncated,
            degraded,
            info
        );
    }

    public int getMaxAlleleLength() {
        return maxAlleleLength;
    }

    static long parsePosition(String rawPosition) {
        try {
            long position = Long.parseLong(rawPosition);
            return position > 0 ? position : CanonicalRecord.UNKNOWN_POSITION;
        } catch (NumberFormatException e) {
            return CanonicalRecord.UNKNOWN_POSITION;
        }
    }

    private static String missingToNull(String value) {
        String trimmed = trimToNull(value);
        return trimmed == null || trimmed.equals(".") ? null : trimmed;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String bounded(String value, int width) {
        return value == null || value.length() <= width ? value : value.substring(0, width);
    }
}
