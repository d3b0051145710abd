package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import edu.harvard.hms.dbmi.avillach.varload.etl.transform.CanonicalRecord;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Target store of canonical variant records and the tables derived from them.
 *
 * Failures surface as Spring {@link org.springframework.dao.DataAccessException}s.
 */
public interface VariantStore {

    /**
     * Round-trips a trivial query; fails when the store is unreachable.
     */
    void verifyConnection();

    /**
     * Creates missing tables. Existing data is kept.
     */
    void ensureSchema();

    /**
     * Drops every variant, derived and side-input table and forgets the load state, then recreates the
     * tables empty and without secondary indexes.
     */
    void recreateSchema();

    long countVariants();

    void dropSecondaryIndexes();

    void createSecondaryIndexes();

    /**
     * Upserts {@code records} and records {@code state} as one transaction: either both are committed or
     * neither is.
     */
    void upsertBatch(List<CanonicalRecord> records, LoadState state);

    /**
     * Upserts a single record in its own transaction.
     */
    void upsert(CanonicalRecord record);

    Optional<LoadState> readLoadState();

    void saveLoadState(LoadState state);

    /**
     * Recomputes the mutation summary from the variants currently stored.
     *
     * @return summary rows written
     */
    long rebuildMutationSummary();

    /**
     * @return gene rows written
     */
    long rebuildGenes();

    Set<String> geneSymbols();

    /**
     * Replaces the drug annotations with {@code annotations}.
     *
     * @return rows written
     */
    long replaceDrugAnnotations(Collection<DrugAnnotation> annotations);

    /**
     * Row count of every table the store manages, in a stable order.
     */
    Map<String, Long> tableCounts();
}
