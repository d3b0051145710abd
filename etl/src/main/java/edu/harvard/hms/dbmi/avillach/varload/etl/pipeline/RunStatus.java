package edu.harvard.hms.dbmi.avillach.varload.etl.pipeline;

/**
 * Terminal state of a run, with the process exit code it maps to.
 */
public enum RunStatus {
    /** Finished, including a stop at the configured row limit. */
    COMPLETED(0),
    FAILED(1),
    /** Store connection lost after some batches committed; rerun without start-fresh to resume. */
    PARTIAL(2),
    CANCELLED(3);

    private final int exitCode;

    RunStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
