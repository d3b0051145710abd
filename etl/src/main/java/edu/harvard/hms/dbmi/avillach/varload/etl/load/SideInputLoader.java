package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import java.io.IOException;

/**
 * A static reference table merged into the store after the variants are loaded and the gene table
 * is built.
 */
public interface SideInputLoader {

    String name();

    /**
     * @return rows stored; zero when the input has no rows, which is not an error
     */
    long load(VariantStore store) throws IOException;
}
