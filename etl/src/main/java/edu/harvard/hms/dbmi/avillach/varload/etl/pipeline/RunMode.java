package edu.harvard.hms.dbmi.avillach.varload.etl.pipeline;

public enum RunMode {
    /** Parse and normalize the source into the intermediate file only. */
    TRANSFORM,
    /** Load an existing intermediate file into the store only. */
    LOAD,
    /** Transform, then load. */
    FULL;

    public boolean transforms() {
        return this != LOAD;
    }

    public boolean loads() {
        return this != TRANSFORM;
    }
}
