package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link VariantStore} over a JDBC {@link DataSource}, using Spring's {@link JdbcTemplate} for
 * statements and a {@link TransactionTemplate} for batch atomicity.
 */
public class JdbcVariantStore implements VariantStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcVariantStore.class);

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final StoreDialect dialect;
    private final int maxAlleleLength;
    private final LoadStateRepository loadStates;
    private final String upsertVariantSql;
    private final String insertDrugAnnotationSql;

    public JdbcVariantStore(DataSource dataSource, StoreDialect dialect, int maxAlleleLength) {
        this.jdbc = new JdbcTemplate(dataSource);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.dialect = dialect;
        this.maxAlleleLength = maxAlleleLength;
        this.loadStates = new LoadStateRepository(jdbc, dialect);
        this.upsertVariantSql = dialect.upsertSql(VariantSchema.VARIANTS, VariantSchema.VARIANT_COLUMNS, "variant_key");
        this.insertDrugAnnotationSql = "INSERT INTO " + VariantSchema.DRUG_ANNOTATIONS + " ("
            + String.join(", ", VariantSchema.DRUG_ANNOTATION_COLUMNS) + ") VALUES ("
            + StoreDialect.placeholders(VariantSchema.DRUG_ANNOTATION_COLUMNS.length) + ")";
    }

    @Override
    public void verifyConnection() {
        jdbc.queryForObject("SELECT 1", Integer.class);
    }

    @Override
    public void ensureSchema() {
        jdbc.execute(VariantSchema.createVariants(dialect, maxAlleleLength));
        jdbc.execute(VariantSchema.createMutationSummary());
        jdbc.execute(VariantSchema.createGenes());
        jdbc.execute(VariantSchema.createDrugAnnotations(dialect));
        loadStates.createTable();
    }

    @Override
    public void recreateSchema() {
        for (String table : VariantSchema.DERIVED_TABLES) {
            jdbc.execute(VariantSchema.dropTable(table));
        }
        jdbc.execute(VariantSchema.dropTable(VariantSchema.VARIANTS));
        ensureSchema();
        loadStates.delete(VariantSchema.VARIANTS);
        log.info("Recreated variant store schema ({})", dialect);
    }

    @Override
    public long countVariants() {
        return count(VariantSchema.VARIANTS);
    }

    @Override
    public void dropSecondaryIndexes() {
        for (VariantSchema.SecondaryIndex index : VariantSchema.SECONDARY_INDEXES) {
            jdbc.execute(VariantSchema.dropIndex(index));
        }
    }

    @Override
    public void createSecondaryIndexes() {
        for (VariantSchema.SecondaryIndex index : VariantSchema.SECONDARY_INDEXES) {
            long start = System.currentTimeMillis();
            jdbc.execute(VariantSchema.createIndex(index));
            log.info("Built index {} in {} ms", index.name(), System.currentTimeMillis() - start);
        }
    }

    @Override
    public void upsertBatch(List<CanonicalRecord> records, LoadState state) {
        transactions.executeWithoutResult(status -> {
            if (!records.isEmpty()) {
                jdbc.batchUpdate(upsertVariantSql, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        bind(ps, records.get(i));
                    }

                    @Override
                    public int getBatchSize() {
                        return records.size();
                    }
                });
            }
            loadStates.save(state);
        });
    }

    @Override
    public void upsert(CanonicalRecord record) {
        jdbc.update(upsertVariantSql, ps -> bind(ps, record));
    }

    static void bind(PreparedStatement ps, CanonicalRecord r) throws SQLException {
        ps.setString(1, r.variantKey());
        ps.setString(2, r.chromosome());
        ps.setLong(3, r.position());
        ps.setString(4, r.variantName());
        ps.setString(5, r.reference());
        ps.setString(6, r.alternate());
        setDouble(ps, 7, r.quality());
        ps.setString(8, r.filter());
        setDouble(ps, 9, r.alleleFrequency());
        setInteger(ps, 10, r.alleleCount());
        setInteger(ps, 11, r.totalAlleles());
        ps.setString(12, r.clinicalSignificance());
        ps.setString(13, r.diseaseName());
        ps.setString(14, r.geneSymbol());
        ps.setString(15, r.geneId());
        ps.setBoolean(16, r.referenceTruncated());
        ps.setBoolean(17, r.alternateTruncated());
        ps.setBoolean(18, r.degraded());
        ps.setString(19, r.infoRaw());
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.DOUBLE);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    @Override
    public Optional<LoadState> readLoadState() {
        return loadStates.find(VariantSchema.VARIANTS);
    }

    @Override
    public void saveLoadState(LoadState state) {
        loadStates.save(state);
    }

    @Override
    public long rebuildMutationSummary() {
        Integer written = transactions.execute(status -> {
            jdbc.update("DELETE FROM " + VariantSchema.MUTATION_SUMMARY);
            return jdbc.update(VariantSchema.populateMutationSummary());
        });
        return written == null ? 0 : written;
    }

    @Override
    public long rebuildGenes() {
        Integer written = transactions.execute(status -> {
            jdbc.update("DELETE FROM " + VariantSchema.GENES);
            return jdbc.update(VariantSchema.populateGenes());
        });
        return written == null ? 0 : written;
    }

    @Override
    public Set<String> geneSymbols() {
        return new HashSet<>(jdbc.queryForList(
            "SELECT DISTINCT gene_symbol FROM " + VariantSchema.VARIANTS + " WHERE gene_symbol IS NOT NULL", String.class));
    }

    @Override
    public long replaceDrugAnnotations(Collection<DrugAnnotation> annotations) {
        List<DrugAnnotation> rows = new ArrayList<>(annotations);
        transactions.executeWithoutResult(status -> {
            jdbc.update("DELETE FROM " + VariantSchema.DRUG_ANNOTATIONS);
            if (!rows.isEmpty()) {
                jdbc.batchUpdate(insertDrugAnnotationSql, new BatchPreparedStatementSetter() {
                    @Override
                    public void setValues(PreparedStatement ps, int i) throws SQLException {
                        DrugAnnotation a = rows.get(i);
                        ps.setString(1, a.geneSymbol());
                        ps.setString(2, a.drugName());
                        ps.setString(3, a.drugBankId());
                        ps.setString(4, a.mechanism());
                        ps.setString(5, a.indication());
                        ps.setString(6, a.drugResponse());
                        ps.setString(7, a.adverseEffects());
                        ps.setString(8, a.clinicalTrials());
                        ps.setString(9, a.source());
                    }

                    @Override
                    public int getBatchSize() {
                        return rows.size();
                    }
                });
            }
        });
        return rows.size();
    }

    @Override
    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put(VariantSchema.VARIANTS, countVariants());
        for (String table : VariantSchema.DERIVED_TABLES) {
            counts.put(table, count(table));
        }
        return counts;
    }

    private long count(String table) {
        Long count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
        return count == null ? 0 : count;
    }

    public StoreDialect getDialect() {
        return dialect;
    }
}
