package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import java.util.Map;

/**
 * Typed view of an INFO blob: the scalar annotations that are queried downstream, plus every
 * other token kept as an opaque residual map. Bare flags map to an empty string.
 *
 * @param coercionFailed a known numeric key was present but could not be parsed
 */
public record AnnotationFields(
    Double alleleFrequency,
    Integer alleleCount,
    Integer totalAlleles,
    String clinicalSignificance,
    String diseaseName,
    String geneSymbol,
    String geneId,
    Map<String, String> residual,
    boolean coercionFailed
) {
}
