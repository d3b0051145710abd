package edu.harvard.hms.dbmi.avillach.varload.etl.transform;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Derives the stable identifier of a variant from its content. Identical input always yields the
 * identical key, which is what makes re-loading an upsert rather than a duplicate insert.
 */
public final class VariantKeys {

    private static final HashFunction SHA_256 = Hashing.sha256();

    private VariantKeys() {
    }

    /**
     * @return 64 lowercase hex characters, computed on the untruncated alleles
     */
    public static String derive(String chromosome, String position, String reference, String alternate) {
        String identity = nullToEmpty(chromosome) + "|" + nullToEmpty(position) + "|" + nullToEmpty(reference) + "|" + nullToEmpty(alternate);
        return SHA_256.hashString(identity, StandardCharsets.UTF_8).toString();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
