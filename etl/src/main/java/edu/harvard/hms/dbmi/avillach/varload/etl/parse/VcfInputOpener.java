package edu.harvard.hms.dbmi.avillach.varload.etl.parse;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Opens a source VCF as a character stream, decompressing gzip / bgzip input on the fly.
 */
public final class VcfInputOpener {

    private static final int BUFFER_SIZE = 1 << 16;

    private VcfInputOpener() {
    }

    public static boolean isGzipped(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".gz") || name.endsWith(".bgz");
    }

    public static BufferedReader open(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("VCF file not found: " + file.toAbsolutePath());
        }
        InputStream in = Files.newInputStream(file);
        if (isGzipped(file)) {
            try {
                // GZIPInputStream reads concatenated members, which covers bgzip blocks
                in = new GZIPInputStream(in, BUFFER_SIZE);
            } catch (IOException e) {
                in.close();
                throw e;
            }
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8), BUFFER_SIZE);
    }

    public static RecordParser parser(Path file) throws IOException {
        return new RecordParser(open(file), file.toString());
    }
}
