package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * What an intermediate file was derived from: the source file as it was when the transform started,
 * and the settings that shape each canonical record. A completed intermediate file is only reusable
 * while all of it still matches.
 *
 * @param sourceFile         absolute, normalized path of the source VCF
 * @param sourceLastModified modification time of the source in epoch milliseconds
 */
public record SourceFingerprint(
    String sourceFile,
    long sourceSize,
    long sourceLastModified,
    int maxAlleleLength,
    Map<Integer, String> clinicalSignificanceCodes
) {

    public SourceFingerprint {
        clinicalSignificanceCodes = clinicalSignificanceCodes == null
            ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(clinicalSignificanceCodes));
    }

    public static SourceFingerprint of(Path source, int maxAlleleLength, Map<Integer, String> clinicalSignificanceCodes)
        throws IOException {
        return new SourceFingerprint(
            source.toAbsolutePath().normalize().toString(),
            Files.size(source),
            Files.getLastModifiedTime(source).toMillis(),
            maxAlleleLength,
            clinicalSignificanceCodes);
    }

    /**
     * @return one line per property that differs from {@code other}; empty when they match
     */
    public List<String> differencesFrom(SourceFingerprint other) {
        List<String> differences = new ArrayList<>();
        if (!sourceFile.equals(other.sourceFile)) {
            differences.add("source " + sourceFile + " vs " + other.sourceFile);
        }
        if (sourceSize != other.sourceSize) {
            differences.add("source size " + sourceSize + " vs " + other.sourceSize);
        }
        if (sourceLastModified != other.sourceLastModified) {
            differences.add("source modified " + sourceLastModified + " vs " + other.sourceLastModified);
        }
        if (maxAlleleLength != other.maxAlleleLength) {
            differences.add("max allele length " + maxAlleleLength + " vs " + other.maxAlleleLength);
        }
        if (!clinicalSignificanceCodes.equals(other.clinicalSignificanceCodes)) {
            differences.add("clinical significance codes");
        }
        return differences;
    }
}
