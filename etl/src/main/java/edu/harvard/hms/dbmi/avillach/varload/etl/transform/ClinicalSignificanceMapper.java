package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import java.util.Map;
import java.util.TreeMap;

/**
 * Maps CLNSIG values to labels. ClinVar emits either numeric review codes or textual labels;
 * numeric codes are translated through a code table, text is kept as-is.
 */
public class ClinicalSignificanceMapper {

    public static final String UNKNOWN = "Unknown";

    private static final Map<Integer, String> CLINVAR_CODES = Map.of(
        0, "Uncertain significance",
        1, "not provided",
        2, "Benign",
        3, "Likely benign",
        4, "Likely pathogenic",
        5, "Pathogenic",
        6, "Drug response",
        7, "Histocompatibility",
        255, "Other"
    );

    private final Map<Integer, String> codes;

    public ClinicalSignificanceMapper() {
        this(CLINVAR_CODES);
    }

    public ClinicalSignificanceMapper(Map<Integer, String> codes) {
        this.codes = new TreeMap<>(codes);
    }

    public static Map<Integer, String> defaultCodes() {
        return new TreeMap<>(CLINVAR_CODES);
    }

    /**
     * @param raw the CLNSIG value, possibly multi-valued ({@code 5|4} or {@code 5,4}); may be null
     * @return the label of the first value, {@link #UNKNOWN} when absent or an unmapped code
     */
    public String map(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String first = raw;
        int cut = indexOfAny(raw, '|', ',');
        if (cut >= 0) {
            first = raw.substring(0, cut);
        }
        first = first.trim();
        if (first.isEmpty()) {
            return UNKNOWN;
        }
        try {
            return codes.getOrDefault(Integer.parseInt(first), UNKNOWN);
        } catch (NumberFormatException e) {
            return first;
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == a || c == b) {
                return i;
            }
        }
        return -1;
    }
}
