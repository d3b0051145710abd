package edu.harvard.hms.dbmi.avillach.varload.etl.load;

/**
 * <pre>
 *   LOADING  batches are being committed, secondary indexes are not built
 *   LOADED   every batch committed and indexes rebuilt, derived tables pending
 *   COMPLETE summary, genes and side inputs materialized
 * </pre>
 */
public enum LoadStatus {
    LOADING,
    LOADED,
    COMPLETE
}
