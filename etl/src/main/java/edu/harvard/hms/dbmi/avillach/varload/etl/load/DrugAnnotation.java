package edu.harvard.hms.dbmi.avillach.varload.etl.load;

/**
 * One gene-drug association of the drug annotation side input.
 */
public record DrugAnnotation(
    String geneSymbol,
    String drugName,
    String drugBankId,
    String mechanism,
    String indication,
    String drugResponse,
    String adverseEffects,
    String clinicalTrials,
    String source
) {
}
