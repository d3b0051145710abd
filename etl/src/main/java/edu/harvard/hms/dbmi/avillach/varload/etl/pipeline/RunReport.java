package edu.harvard.hms.dbmi.avillach.varload.etl.pipeline;

import java.time.Duration;
import java.util.Map;

/**
 * Frozen outcome of one {@link PipelineOrchestrator#run()}.
 *
 * @param transformSkipped a completed intermediate file from an earlier run was reused
 * @param maxRowsReached   the transform stopped at the configured row limit
 * @param counters         snapshot of the run counters when the run ended
 * @param tableCounts      final per-table row counts; empty when nothing was loaded
 * @param error            failure message for FAILED and PARTIAL runs, otherwise null
 */
public record RunReport(
    String runId,
    RunMode mode,
    RunStatus status,
    boolean transformSkipped,
    boolean maxRowsReached,
    Map<String, Object> counters,
    long failuresLogged,
    Map<String, Long> tableCounts,
    Duration elapsed,
    String error
) {

    public int exitCode() {
        return status.getExitCode();
    }

    public long counter(String name) {
        Object value = counters.get(name);
        return value instanceof Number n ? n.longValue() : 0L;
    }
}
