package edu.harvard.hms.dbmi.avillach.varload.loader.config;

import edu.harvard.hms.dbmi.avillach.varload.etl.load.StoreDialect;
import edu.harvard.hms.dbmi.avillach.varload.etl.pipeline.PipelineSettings;
import edu.harvard.hms.dbmi.avillach.varload.etl.pipeline.RunMode;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.ClinicalSignificanceMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Configuration properties for the variant loader.
 *
 * Uses Spring Boot property binding with fail-fast validation.
 * All properties use the "varload.*" prefix.
 */
@ConfigurationProperties(prefix = "varload")
public class LoaderConfig {
    private static final Logger log = LoggerFactory.getLogger(LoaderConfig.class);

    private RunMode mode = RunMode.FULL;
    private String inputFile; // required unless mode=LOAD
    private String workDir = "./data/processed";
    private String intermediateFileName = PipelineSettings.DEFAULT_INTERMEDIATE_FILE_NAME;
    private boolean startFresh = false;
    private boolean reuseIntermediate = true;
    private Long maxRows; // null = no limit
    private int chunkSize = PipelineSettings.DEFAULT_CHUNK_SIZE;
    private int batchSize = 100_000;
    private int maxAlleleLength = 2000;
    private boolean pipelined = false;
    private boolean excludeDegraded = false;
    private String drugAnnotationsFile; // null = no drug annotations
    private Map<Integer, String> clinicalSignificanceCodes = new TreeMap<>();
    private final Datasource datasource = new Datasource();

    public static class Datasource {
        private String url = "jdbc:h2:file:./data/varload";
        private String username = "sa";
        private String password = "";
        private StoreDialect dialect = StoreDialect.H2;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public StoreDialect getDialect() {
            return dialect;
        }

        public void setDialect(StoreDialect dialect) {
            this.dialect = dialect;
        }
    }

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (mode == null) {
            errors.add("varload.mode is required (TRANSFORM, LOAD or FULL)");
        } else if (mode.transforms()) {
            if (inputFile == null || inputFile.isBlank()) {
                errors.add("varload.input-file is required for mode " + mode);
            } else if (!Files.isRegularFile(Path.of(inputFile))) {
                errors.add("Input file not found: " + inputFile);
            }
        }
        if (mode == RunMode.LOAD && !Files.isRegularFile(Path.of(workDir).resolve(intermediateFileName))) {
            errors.add("Intermediate file not found: " + Path.of(workDir).resolve(intermediateFileName));
        }
        if (mode != null && mode.loads() && (datasource.url == null || datasource.url.isBlank())) {
            errors.add("varload.datasource.url is required for mode " + mode);
        }
        if (chunkSize <= 0) {
            errors.add("varload.chunk-size must be positive, was " + chunkSize);
        }
        if (batchSize <= 0) {
            errors.add("varload.batch-size must be positive, was " + batchSize);
        }
        if (maxAlleleLength <= 0) {
            errors.add("varload.max-allele-length must be positive, was " + maxAlleleLength);
        }
        if (maxRows != null && maxRows <= 0) {
            errors.add("varload.max-rows must be positive when set, was " + maxRows);
        }

        Path workPath = Path.of(workDir);
        try {
            Files.createDirectories(workPath);
            if (!Files.isWritable(workPath)) {
                errors.add("Work directory is not writable: " + workDir);
            }
        } catch (Exception e) {
            errors.add("Cannot create work directory: " + workDir + " - " + e.getMessage());
        }

        if (drugAnnotationsFile != null && !drugAnnotationsFile.isBlank() && !Files.exists(Path.of(drugAnnotationsFile))) {
            log.warn("Drug annotations file {} not found; no drug annotations will be loaded", drugAnnotationsFile);
        }

        if (!errors.isEmpty()) {
            String errorMsg = "Configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE CONFIGURATION ===");
        log.info("Mode: {}", mode);
        log.info("Input file: {}", inputFile != null ? inputFile : "(none)");
        log.info("Work dir: {}", workDir);
        log.info("Intermediate file: {}", intermediateFileName);
        log.info("Start fresh: {}, reuse intermediate: {}", startFresh, reuseIntermediate);
        log.info("Max rows: {}", maxRows != null ? maxRows : "(unlimited)");
        log.info("Chunk size: {}, batch size: {}, max allele length: {}", chunkSize, batchSize, maxAlleleLength);
        log.info("Pipelined: {}, exclude degraded: {}", pipelined, excludeDegraded);
        log.info("Drug annotations: {}", drugAnnotationsFile != null ? drugAnnotationsFile : "(none)");
        log.info("Clinical significance codes: {}",
            clinicalSignificanceCodes.isEmpty() ? "(ClinVar defaults)" : clinicalSignificanceCodes);
        log.info("Datasource: {} ({})", datasource.url, datasource.dialect);
        log.info("================================");
    }

    /**
     * Freezes the bound properties into the settings of one run.
     */
    public PipelineSettings toSettings() {
        return PipelineSettings.builder()
            .runId(UUID.randomUUID().toString())
            .mode(mode)
            .inputFile(inputFile == null || inputFile.isBlank() ? null : Path.of(inputFile))
            .workDir(Path.of(workDir))
            .intermediateFileName(intermediateFileName)
            .startFresh(startFresh)
            .reuseIntermediate(reuseIntermediate)
            .maxRows(maxRows)
            .chunkSize(chunkSize)
            .batchSize(batchSize)
            .maxAlleleLength(maxAlleleLength)
            .pipelined(pipelined)
            .excludeDegraded(excludeDegraded)
            .drugAnnotationsFile(drugAnnotationsFile == null || drugAnnotationsFile.isBlank() ? null : Path.of(drugAnnotationsFile))
            .clinicalSignificanceCodes(clinicalSignificanceCodes.isEmpty()
                ? ClinicalSignificanceMapper.defaultCodes() : clinicalSignificanceCodes)
            .build();
    }

    public RunMode getMode() {
        return mode;
    }

    public void setMode(RunMode mode) {
        this.mode = mode;
    }

    public String getInputFile() {
        return inputFile;
    }

    public void setInputFile(String inputFile) {
        this.inputFile = inputFile;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public String getIntermediateFileName() {
        return intermediateFileName;
    }

    public void setIntermediateFileName(String intermediateFileName) {
        this.intermediateFileName = intermediateFileName;
    }

    public boolean isStartFresh() {
        return startFresh;
    }

    public void setStartFresh(boolean startFresh) {
        this.startFresh = startFresh;
    }

    public boolean isReuseIntermediate() {
        return reuseIntermediate;
    }

    public void setReuseIntermediate(boolean reuseIntermediate) {
        this.reuseIntermediate = reuseIntermediate;
    }

    public Long getMaxRows() {
        return maxRows;
    }

    public void setMaxRows(Long maxRows) {
        this.maxRows = maxRows;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxAlleleLength() {
        return maxAlleleLength;
    }

    public void setMaxAlleleLength(int maxAlleleLength) {
        this.maxAlleleLength = maxAlleleLength;
    }

    public boolean isPipelined() {
        return pipelined;
    }

    public void setPipelined(boolean pipelined) {
        this.pipelined = pipelined;
    }

    public boolean isExcludeDegraded() {
        return excludeDegraded;
    }

    public void setExcludeDegraded(boolean excludeDegraded) {
        this.excludeDegraded = excludeDegraded;
    }

    public String getDrugAnnotationsFile() {
        return drugAnnotationsFile;
    }

    public void setDrugAnnotationsFile(String drugAnnotationsFile) {
        this.drugAnnotationsFile = drugAnnotationsFile;
    }

    public Map<Integer, String> getClinicalSignificanceCodes() {
        return clinicalSignificanceCodes;
    }

    public void setClinicalSignificanceCodes(Map<Integer, String> clinicalSignificanceCodes) {
        this.clinicalSignificanceCodes = clinicalSignificanceCodes;
    }

    public Datasource getDatasource() {
        return datasource;
    }
}
