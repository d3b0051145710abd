package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClinicalSignificanceMapperTest {

    private final ClinicalSignificanceMapper mapper = new ClinicalSignificanceMapper();

    @Test
    public void map_numericCodes() {
        assertEquals("Pathogenic", mapper.map("5"));
        assertEquals("Benign", mapper.map("2"));
        assertEquals("Other", mapper.map("255"));
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, mapper.map("42"));
    }

    @Test
    public void map_firstOfMultipleValues() {
        assertEquals("Likely pathogenic", mapper.map("4|5"));
        assertEquals("Benign", mapper.map("Benign,Likely_benign"));
    }

    @Test
    public void map_textIsKept() {
        assertEquals("Conflicting_interpretations_of_pathogenicity", mapper.map("Conflicting_interpretations_of_pathogenicity"));
    }

    @Test
    public void map_absent() {
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, mapper.map(null));
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, mapper.map(" "));
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, mapper.map("|5"));
    }

    @Test
    public void map_customTable() {
        ClinicalSignificanceMapper custom = new ClinicalSignificanceMapper(Map.of(1, "Risk factor"));

        assertEquals("Risk factor", custom.map("1"));
        assertEquals(ClinicalSignificanceMapper.UNKNOWN, custom.map("5"));
    }
}
