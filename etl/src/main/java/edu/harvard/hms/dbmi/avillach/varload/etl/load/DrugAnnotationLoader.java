package edu.harvard.hms.dbmi.avillach.varload.etl.load;

import com.google.common.base.Strings;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureRecord;
import edu.harvard.hms.dbmi.avillach.varload.etl.failure.FailureSink;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads gene-drug associations from a CSV with a header row. Only associations whose gene occurs in
 * the loaded variants are kept; the first row wins for a repeated (gene, drug) pair.
 */
public class DrugAnnotationLoader implements SideInputLoader {

    private static final Logger log = LoggerFactory.getLogger(DrugAnnotationLoader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setHeader()
        .setSkipHeaderRecord(true)
        .setIgnoreEmptyLines(true)
        .setTrim(true)
        .build();

    private final Path file;
    private final FailureSink failureSink;
    private final String runId;

    public DrugAnnotationLoader(Path file, FailureSink failureSink, String runId) {
        this.file = file;
        this.failureSink = failureSink;
        this.runId = runId;
    }

    @Override
    public String name() {
        return VariantSchema.DRUG_ANNOTATIONS;
    }

    @Override
    public long load(VariantStore store) throws IOException {
        List<DrugAnnotation> annotations = read();
        if (annotations.isEmpty()) {
            log.info("No drug annotations available in {}", file);
            store.replaceDrugAnnotations(List.of());
            return 0;
        }
        Set<String> genes = store.geneSymbols();
        List<DrugAnnotation> matched = annotations.stream()
            .filter(a -> genes.contains(a.geneSymbol()))
            .toList();
        long written = store.replaceDrugAnnotations(matched);
        log.info("Loaded {} drug annotations ({} read, {} without a loaded gene)",
            written, annotations.size(), annotations.size() - matched.size());
        return written;
    }

    /**
     * @return the valid, de-duplicated rows of the file; empty when the file is absent or has no rows
     */
    List<DrugAnnotation> read() throws IOException {
        if (!Files.isRegularFile(file) || Files.size(file) == 0) {
            return List.of();
        }
        Map<String, DrugAnnotation> byPair = new LinkedHashMap<>();
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, FORMAT)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (!header.containsKey("gene_symbol") || !header.containsKey("drug_name")) {
                throw new IOException("Drug annotation file " + file + " needs gene_symbol and drug_name columns, found "
                    + header.keySet());
            }
            for (CSVRecord row : parser) {
                String gene = value(row, "gene_symbol", 64);
                String drug = value(row, "drug_name", 255);
                if (gene == null || drug == null || !row.isConsistent()) {
                    String detail = !row.isConsistent()
                        ? "Row has " + row.size() + " columns, header has " + header.size()
                        : "Missing gene_symbol or drug_name";
                    log.warn("Skipping drug annotation record {} of {}: {}", row.getRecordNumber(), file.getFileName(), detail);
                    failureSink.recordFailure(FailureRecord.invalidSideInputRow(runId, file.toString(),
                        row.getRecordNumber(), String.join(",", row.toList()), detail));
                    continue;
                }
                byPair.putIfAbsent(gene + '\u0000' + drug, new DrugAnnotation(
                    gene,
                    drug,
                    value(row, "drug_bank_id", 32),
                    value(row, "mechanism", Integer.MAX_VALUE),
                    value(row, "indication", Integer.MAX_VALUE),
                    value(row, "drug_response", 255),
                    value(row, "adverse_effects", Integer.MAX_VALUE),
                    value(row, "clinical_trials", 255),
                    value(row, "source", 128)
                ));
            }
        }
        return List.copyOf(byPair.values());
    }

    private static String value(CSVRecord row, String column, int width) {
        if (!row.isSet(column)) {
            return null;
        }
        String value = Strings.emptyToNull(row.get(column));
        return value == null || value.length() <= width ? value : value.substring(0, width);
    }
}
