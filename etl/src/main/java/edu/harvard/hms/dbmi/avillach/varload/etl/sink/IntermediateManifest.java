package edu.harvard.hms.dbmi.avillach.varload.etl.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Written next to the intermediate file once a transform completes. Its absence marks the file as
 * the leftover of an interrupted run.
 */
public record IntermediateManifest(
    SourceFingerprint source,
    long recordCount,
    long parseFailures,
    long degradedRecords,
    long truncatedRecords,
    boolean maxRowsReached,
    String completedAt
) {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static Optional<IntermediateManifest> read(Path intermediateFile) throws IOException {
        Path manifest = IntermediateFormat.manifestPath(intermediateFile);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        return Optional.of(MAPPER.readValue(manifest.toFile(), IntermediateManifest.class));
    }

    public void write(Path intermediateFile) throws IOException {
        Path manifest = IntermediateFormat.manifestPath(intermediateFile);
        Path tmp = manifest.resolveSibling(manifest.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), this);
        Files.move(tmp, manifest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    public static void delete(Path intermediateFile) throws IOException {
        Files.deleteIfExists(IntermediateFormat.manifestPath(intermediateFile));
    }
}
