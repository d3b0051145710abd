package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnnotationDecoderTest {

    private final AnnotationDecoder decoder = new AnnotationDecoder(new ClinicalSignificanceMapper());

    @Test
    public void tokenize_keyValuesAndFlags() {
        Map<String, String> tokens = AnnotationDecoder.tokenize("AF=0.5;DB;;H2;CLNDN=a=b");

        assertEquals("0.5", tokens.get("AF"));
        assertEquals("", tokens.get("DB"));
        assertEquals("", tokens.get("H2"));
        assertEquals("a=b", tokens.get("CLNDN"));
        assertEquals(4, tokens.size());
    }

    @Test
    public void tokenize_absentInfo() {
        assertTrue(AnnotationDecoder.tokenize(".").isEmpty());
        assertTrue(AnnotationDecoder.tokenize("").isEmpty());
        assertTrue(AnnotationDecoder.tokenize(null).isEmpty());
    }

    @Test
    public void decode_keepsUnknownKeysAsResidual() {
        AnnotationFields fields = decoder.decode("AF=0.5;RS=12345;DB");

        assertEquals(0.5, fields.alleleFrequency());
        assertEquals(Map.of("RS", "12345", "DB", ""), fields.residual());
        assertFalse(fields.coercionFailed());
    }

    @Test
    public void decode_geneWithoutId() {
        AnnotationFields fields = decoder.decode("GENEINFO=TP53");

        assertEquals("TP53", fields.geneSymbol());
        assertNull(fields.geneId());
    }

    @Test
    public void decode_dotValuesAreAbsent() {
        AnnotationFields fields = decoder.decode("AF=.;AC=.;CLNSIG=.");

        assertNull(fields.alleleFrequency());
        assertNull(fields.alleleCount());
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, fields.clinicalSignificance());
        assertFalse(fields.coercionFailed());
    }

    @Test
    public void decode_badIntegerFlagsCoercion() {
        AnnotationFields fields = decoder.decode("AN=1.5");

        assertNull(fields.totalAlleles());
        assertTrue(fields.coercionFailed());
    }
}
