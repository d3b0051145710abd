package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.VcfFixtures;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcVariantStoreTest {

    private JdbcVariantStore store;
    private JdbcTemplate jdbc;

    @BeforeEach
    public void setup() {
        DataSource dataSource = VcfFixtures.h2();
        store = new JdbcVariantStore(dataSource, StoreDialect.H2, 20);
        jdbc = new JdbcTemplate(dataSource);
        store.ensureSchema();
    }

    private static LoadState loading(long rows) {
        return new LoadState(VariantSchema.VARIANTS, "/work/variants.csv", 1234, rows, LoadStatus.LOADING, Instant.now());
    }

    @Test
    public void upsert_sameKeyReplacesRow() {
        CanonicalRecord first = VcfFixtures.record("1", 100, "A", "G", "TP53", "Benign", 0.1);
        CanonicalRecord updated = VcfFixtures.record("1", 100, "A", "G", "TP53", "Pathogenic", 0.1);

        store.upsert(first);
        store.upsertBatch(List.of(updated), loading(1));

        assertEquals(1, store.countVariants());
        assertEquals("Pathogenic", jdbc.queryForObject(
            "SELECT clinical_significance FROM variants WHERE variant_key = ?", String.class, first.variantKey()));
    }

    @Test
    public void upsertBatch_storesNullsAndFlags() {
        CanonicalRecord record = new CanonicalRecord("k1", "2", 0, null, "A", "T", null, null, null, null, null,
            "Unknown", null, null, null, true, false, true, "AF=x");

        store.upsertBatch(List.of(record), loading(1));

        Map<String, Object> row = jdbc.queryForMap("SELECT * FROM variants WHERE variant_key = 'k1'");
        assertNull(row.get("QUALITY"));
        assertNull(row.get("ALLELE_COUNT"));
        assertEquals(Boolean.TRUE, row.get("REF_TRUNCATED"));
        assertEquals(Boolean.TRUE, row.get("DEGRADED"));
        assertEquals(0L, ((Number) row.get("POSITION")).longValue());
    }

    @Test
    public void upsertBatch_isAtomicWithLoadState() {
        CanonicalRecord ok = VcfFixtures.record("1", 1, "A", "G", null, "Unknown", null);
        CanonicalRecord tooLong = VcfFixtures.record("1", 2, "A", "G".repeat(25), null, "Unknown", null);

        assertThrows(DataAccessException.class, () -> store.upsertBatch(List.of(ok, tooLong), loading(2)));

        assertEquals(0, store.countVariants());
        assertTrue(store.readLoadState().isEmpty());
    }

    @Test
    public void loadState_roundTrips() {
        store.saveLoadState(loading(40));
        store.saveLoadState(loading(80).withProgress(80, LoadStatus.LOADED));

        LoadState state = store.readLoadState().orElseThrow();
        assertEquals(80, state.committedRows());
        assertEquals(LoadStatus.LOADED, state.status());
        assertEquals(1234, state.sourceSize());
        assertFalse(state.isResumableFor("/work/variants.csv", 1234));
        assertTrue(loading(5).isResumableFor("/work/variants.csv", 1234));
        assertFalse(loading(5).isResumableFor("/work/variants.csv", 999));
    }

    @Test
    public void rebuildMutationSummary_groupsVariantsWithGenes() {
        store.upsertBatch(List.of(
            VcfFixtures.record("X", 1, "A", "G", "BRCA1", "Pathogenic", 0.2),
            VcfFixtures.record("X", 2, "A", "G", "BRCA1", "Pathogenic", 0.4),
            VcfFixtures.record("X", 3, "A", "G", "BRCA1", "Benign", null),
            VcfFixtures.record("1", 4, "A", "G", null, "Pathogenic", 0.9)
        ), loading(4));
        store.replaceDrugAnnotations(List.of(new DrugAnnotation("BRCA1", "Olaparib", "DB09074", null, null, null, null,
            null, "DrugBank")));

        assertEquals(2, store.rebuildMutationSummary());
        // rebuilding replaces instead of accumulating
        assertEquals(2, store.rebuildMutationSummary());

        Map<String, Object> pathogenic = jdbc.queryForMap(
            "SELECT * FROM mutation_summary WHERE gene_symbol = 'BRCA1' AND clinical_significance = 'Pathogenic'");
        assertEquals(2L, ((Number) pathogenic.get("VARIANT_COUNT")).longValue());
        assertEquals(0.3, ((Number) pathogenic.get("AVG_ALLELE_FREQUENCY")).doubleValue(), 1e-9);
        assertEquals(2L, ((Number) pathogenic.get("PATHOGENIC_COUNT")).longValue());
        assertEquals(0L, ((Number) pathogenic.get("BENIGN_COUNT")).longValue());
        assertEquals(2L, ((Number) pathogenic.get("DRUG_ASSOCIATED_COUNT")).longValue());

        Map<String, Object> benign = jdbc.queryForMap(
            "SELECT * FROM mutation_summary WHERE gene_symbol = 'BRCA1' AND clinical_significance = 'Benign'");
        assertEquals(1L, ((Number) benign.get("BENIGN_COUNT")).longValue());
        assertNull(benign.get("AVG_ALLELE_FREQUENCY"));
    }

    @Test
    public void rebuildGenes_oneRowPerSymbol() {
        store.upsertBatch(List.of(
            VcfFixtures.record("17", 1, "A", "G", "TP53", "Unknown", null),
            VcfFixtures.record("17", 2, "A", "G", "TP53", "Unknown", null),
            VcfFixtures.record("13", 3, "A", "G", "BRCA2", "Unknown", null),
            VcfFixtures.record("1", 4, "A", "G", null, "Unknown", null)
        ), loading(4));

        assertEquals(2, store.rebuildGenes());
        assertEquals(Set.of("TP53", "BRCA2"), store.geneSymbols());
        assertEquals(2L, jdbc.queryForObject("SELECT variant_count FROM genes WHERE gene_symbol = 'TP53'", Long.class));
    }

    @Test
    public void secondaryIndexes_dropAndCreateAreRepeatable() {
        store.createSecondaryIndexes();
        store.createSecondaryIndexes();
        assertEquals(VariantSchema.SECONDARY_INDEXES.size(), indexCount());

        store.dropSecondaryIndexes();
        store.dropSecondaryIndexes();
        assertEquals(0, indexCount());
    }

    private long indexCount() {
        return jdbc.queryForObject("SELECT COUNT(DISTINCT INDEX_NAME) FROM INFORMATION_SCHEMA.INDEXES WHERE INDEX_NAME LIKE 'IDX_VARIANTS_%'",
            Long.class);
    }

    @Test
    public void recreateSchema_clearsDataAndState() {
        store.upsertBatch(List.of(VcfFixtures.record("1", 1, "A", "G", "TP53", "Unknown", null)), loading(1));
        store.rebuildGenes();

        store.recreateSchema();

        assertEquals(Map.of("variants", 0L, "mutation_summary", 0L, "genes", 0L, "drug_annotations", 0L), store.tableCounts());
        assertTrue(store.readLoadState().isEmpty());
        assertEquals(List.of("variants", "mutation_summary", "genes", "drug_annotations"),
            List.copyOf(store.tableCounts().keySet()));
    }

    @Test
    public void postgresUpsertUsesOnConflict() {
        String sql = StoreDialect.POSTGRES.upsertSql("t", new String[]{"k", "a", "b"}, "k");

        assertEquals("INSERT INTO t (k, a, b) VALUES (?, ?, ?) ON CONFLICT (k) DO UPDATE SET a = EXCLUDED.a, b = EXCLUDED.b", sql);
        assertEquals("MERGE INTO t (k, a, b) KEY (k) VALUES (?, ?, ?)", StoreDialect.H2.upsertSql("t", new String[]{"k", "a", "b"}, "k"));
    }
}
