package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import com.google.common.base.Splitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decodes the semicolon-delimited INFO column ({@code KEY=VALUE} or bare {@code FLAG} tokens).
 */
public class AnnotationDecoder {

    static final String ALLELE_FREQUENCY = "AF";
    static final String ALLELE_COUNT = "AC";
    static final String TOTAL_ALLELES = "AN";
    static final String CLINICAL_SIGNIFICANCE = "CLNSIG";
    static final String DISEASE_NAME = "CLNDN";
    static final String GENE_INFO = "GENEINFO";

    private static final Splitter TOKEN_SPLITTER = Splitter.on(';').omitEmptyStrings().trimResults();
    private static final Splitter VALUE_SPLITTER = Splitter.on(',');
    private static final Splitter GENE_SPLITTER = Splitter.on('|');

    private final ClinicalSignificanceMapper clinicalSignificanceMapper;

    public AnnotationDecoder(ClinicalSignificanceMapper clinicalSignificanceMapper) {
        this.clinicalSignificanceMapper = clinicalSignificanceMapper;
    }

    public AnnotationFields decode(String info) {
        Map<String, String> tokens = tokenize(info);
        boolean[] failed = {false};

        Double af = parseDouble(tokens.remove(ALLELE_FREQUENCY), failed);
        Integer ac = parseInteger(tokens.remove(ALLELE_COUNT), failed);
        Integer an = parseInteger(tokens.remove(TOTAL_ALLELES), failed);
        String clnsig = clinicalSignificanceMapper.map(emptyToNull(tokens.remove(CLINICAL_SIGNIFICANCE)));
        String disease = emptyToNull(tokens.remove(DISEASE_NAME));

        String geneSymbol = null;
        String geneId = null;
        String geneInfo = emptyToNull(tokens.remove(GENE_INFO));
        if (geneInfo != null) {
            // SYMBOL:ID|SYMBOL:ID, first gene wins
            String first = GENE_SPLITTER.splitToList(geneInfo).get(0);
            int colon = first.indexOf(':');
            geneSymbol = emptyToNull(colon >= 0 ? first.substring(0, colon) : first);
            geneId = colon >= 0 ? emptyToNull(first.substring(colon + 1)) : null;
        }

        return new AnnotationFields(af, ac, an, clnsig, disease, geneSymbol, geneId, Collections.unmodifiableMap(tokens), failed[0]);
    }

    static Map<String, String> tokenize(String info) {
        Map<String, String> tokens = new LinkedHashMap<>();
        if (info == null || info.isEmpty() || info.equals(".")) {
            return tokens;
        }
        for (String token : TOKEN_SPLITTER.split(info)) {
            int eq = token.indexOf('=');
            if (eq < 0) {
                tokens.put(token, "");
            } else {
                tokens.put(token.substring(0, eq), token.substring(eq + 1));
            }
        }
        return tokens;
    }

    private static Double parseDouble(String raw, boolean[] failed) {
        String first = firstValue(raw);
        if (first == null) {
            return null;
        }
        try {
            return Double.parseDouble(first);
        } catch (NumberFormatException e) {
            failed[0] = true;
            return null;
        }
    }

    private static Integer parseInteger(String raw, boolean[] failed) {
        String first = firstValue(raw);
        if (first == null) {
            return null;
        }
        try {
            return Integer.parseInt(first);
        } catch (NumberFormatException e) {
            failed[0] = true;
            return null;
        }
    }

    private static String firstValue(String raw) {
        if (raw == null || raw.isEmpty() || raw.equals(".")) {
            return null;
        }
        List<String> values = VALUE_SPLITTER.splitToList(raw);
        String first = values.get(0).trim();
        return first.isEmpty() || first.equals(".") ? null : first;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() || s.equals(".") ? null : s;
    }
}
