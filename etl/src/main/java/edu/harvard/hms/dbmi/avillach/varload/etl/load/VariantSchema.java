package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;

import java.util.List;

/**
 * DDL and derived-table SQL of the variant store.
 *
 * Secondary indexes are kept apart from the table definitions so a bulk load can drop them before its
 * first batch and rebuild them after its last.
 */
public final class VariantSchema {

    public static final String VARIANTS = "variants";
    public static final String MUTATION_SUMMARY = "mutation_summary";
    public static final String GENES = "genes";
    public static final String DRUG_ANNOTATIONS = "drug_annotations";

    public static final String[] VARIANT_COLUMNS = {
        "variant_key", "chromosome", "position", "variant_name", "reference_allele", "alternate_allele",
        "quality", "filter_status", "allele_frequency", "allele_count", "total_alleles",
        "clinical_significance", "disease_name", "gene_symbol", "gene_id",
        "ref_truncated", "alt_truncated", "degraded", "info_raw"
    };

    public static final String[] DRUG_ANNOTATION_COLUMNS = {
        "gene_symbol", "drug_name", "drug_bank_id", "mechanism", "indication", "drug_response",
        "adverse_effects", "clinical_trials", "source"
    };

    /** Derived and side-input tables, in drop order. */
    public static final List<String> DERIVED_TABLES = List.of(MUTATION_SUMMARY, GENES, DRUG_ANNOTATIONS);

    public record SecondaryIndex(String name, String columns) {
    }

    public static final List<SecondaryIndex> SECONDARY_INDEXES = List.of(
        new SecondaryIndex("idx_variants_region", "chromosome, position"),
        new SecondaryIndex("idx_variants_gene", "gene_symbol"),
        new SecondaryIndex("idx_variants_clnsig", "clinical_significance"),
        new SecondaryIndex("idx_variants_gene_clnsig", "gene_symbol, clinical_significance")
    );

    static final List<String> PATHOGENIC = List.of("Pathogenic", "Likely pathogenic", "Pathogenic/Likely pathogenic");
    static final List<String> BENIGN = List.of("Benign", "Likely benign", "Benign/Likely benign");

    private VariantSchema() {
    }

    static String createVariants(StoreDialect dialect, int maxAlleleLength) {
        return "CREATE TABLE IF NOT EXISTS " + VARIANTS + " ("
            + "variant_key VARCHAR(" + CanonicalRecord.VARIANT_KEY_WIDTH + ") NOT NULL PRIMARY KEY, "
            + "chromosome VARCHAR(" + CanonicalRecord.CHROMOSOME_WIDTH + ") NOT NULL, "
            + "position BIGINT NOT NULL, "
            + "variant_name VARCHAR(" + CanonicalRecord.VARIANT_NAME_WIDTH + "), "
            + "reference_allele VARCHAR(" + maxAlleleLength + ") NOT NULL, "
            + "alternate_allele VARCHAR(" + maxAlleleLength + ") NOT NULL, "
            + "quality DOUBLE PRECISION, "
            + "filter_status VARCHAR(" + CanonicalRecord.FILTER_WIDTH + "), "
            + "allele_frequency DOUBLE PRECISION, "
            + "allele_count INTEGER, "
            + "total_alleles INTEGER, "
            + "clinical_significance VARCHAR(" + CanonicalRecord.CLINICAL_SIGNIFICANCE_WIDTH + "), "
            + "disease_name VARCHAR(" + CanonicalRecord.DISEASE_NAME_WIDTH + "), "
            + "gene_symbol VARCHAR(" + CanonicalRecord.GENE_SYMBOL_WIDTH + "), "
            + "gene_id VARCHAR(" + CanonicalRecord.GENE_ID_WIDTH + "), "
            + "ref_truncated BOOLEAN NOT NULL, "
            + "alt_truncated BOOLEAN NOT NULL, "
            + "degraded BOOLEAN NOT NULL, "
            + "info_raw " + dialect.textType() + ")";
    }

    static String createMutationSummary() {
        return "CREATE TABLE IF NOT EXISTS " + MUTATION_SUMMARY + " ("
            + "chromosome VARCHAR(" + CanonicalRecord.CHROMOSOME_WIDTH + ") NOT NULL, "
            + "gene_symbol VARCHAR(" + CanonicalRecord.GENE_SYMBOL_WIDTH + ") NOT NULL, "
            + "clinical_significance VARCHAR(" + CanonicalRecord.CLINICAL_SIGNIFICANCE_WIDTH + ") NOT NULL, "
            + "variant_count BIGINT NOT NULL, "
            + "avg_allele_frequency DOUBLE PRECISION, "
            + "pathogenic_count BIGINT NOT NULL, "
            + "benign_count BIGINT NOT NULL, "
            + "drug_associated_count BIGINT NOT NULL, "
            + "PRIMARY KEY (chromosome, gene_symbol, clinical_significance))";
    }

    static String createGenes() {
        return "CREATE TABLE IF NOT EXISTS " + GENES + " ("
            + "gene_symbol VARCHAR(" + CanonicalRecord.GENE_SYMBOL_WIDTH + ") NOT NULL PRIMARY KEY, "
            + "gene_id VARCHAR(" + CanonicalRecord.GENE_ID_WIDTH + "), "
            + "chromosome VARCHAR(" + CanonicalRecord.CHROMOSOME_WIDTH + "), "
            + "variant_count BIGINT NOT NULL)";
    }

    static String createDrugAnnotations(StoreDialect dialect) {
        return "CREATE TABLE IF NOT EXISTS " + DRUG_ANNOTATIONS + " ("
            + "gene_symbol VARCHAR(" + CanonicalRecord.GENE_SYMBOL_WIDTH + ") NOT NULL, "
            + "drug_name VARCHAR(255) NOT NULL, "
            + "drug_bank_id VARCHAR(32), "
            + "mechanism " + dialect.textType() + ", "
            + "indication " + dialect.textType() + ", "
            + "drug_response VARCHAR(255), "
            + "adverse_effects " + dialect.textType() + ", "
            + "clinical_trials VARCHAR(255), "
            + "source VARCHAR(128), "
            + "PRIMARY KEY (gene_symbol, drug_name))";
    }

    static String createIndex(SecondaryIndex index) {
        return "CREATE INDEX IF NOT EXISTS " + index.name() + " ON " + VARIANTS + " (" + index.columns() + ")";
    }

    static String dropIndex(SecondaryIndex index) {
        return "DROP INDEX IF EXISTS " + index.name();
    }

    static String dropTable(String table) {
        return "DROP TABLE IF EXISTS " + table;
    }

    /**
     * One row per (chromosome, gene, clinical significance) over variants that carry a gene symbol.
     */
    static String populateMutationSummary() {
        return "INSERT INTO " + MUTATION_SUMMARY + " (chromosome, gene_symbol, clinical_significance, variant_count, "
            + "avg_allele_frequency, pathogenic_count, benign_count, drug_associated_count) "
            + "SELECT v.chromosome, v.gene_symbol, v.clinical_significance, COUNT(*), AVG(v.allele_frequency), "
            + "SUM(CASE WHEN v.clinical_significance IN (" + quoted(PATHOGENIC) + ") THEN 1 ELSE 0 END), "
            + "SUM(CASE WHEN v.clinical_significance IN (" + quoted(BENIGN) + ") THEN 1 ELSE 0 END), "
            + "SUM(CASE WHEN d.gene_symbol IS NOT NULL THEN 1 ELSE 0 END) "
            + "FROM " + VARIANTS + " v "
            + "LEFT JOIN (SELECT DISTINCT gene_symbol FROM " + DRUG_ANNOTATIONS + ") d ON d.gene_symbol = v.gene_symbol "
            + "WHERE v.gene_symbol IS NOT NULL "
            + "GROUP BY v.chromosome, v.gene_symbol, v.clinical_significance";
    }

    static String populateGenes() {
        return "INSERT INTO " + GENES + " (gene_symbol, gene_id, chromosome, variant_count) "
            + "SELECT gene_symbol, MIN(gene_id), MIN(chromosome), COUNT(*) FROM " + VARIANTS
            + " WHERE gene_symbol IS NOT NULL GROUP BY gene_symbol";
    }

    private static String quoted(List<String> values) {
        StringBuilder sql = new StringBuilder();
        for (String value : values) {
            if (sql.length() > 0) {
                sql.append(", ");
            }
            sql.append('\'').append(value.replace("'", "''")).append('\'');
        }
        return sql.toString();
    }
}
