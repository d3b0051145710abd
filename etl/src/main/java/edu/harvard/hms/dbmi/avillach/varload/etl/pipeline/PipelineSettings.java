package edu.harvard.hms.dbmi.avillach.varload.etl.pipeline;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.varload.etl.load.LoadOptions;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.ClinicalSignificanceMapper;
import edu.harvard.hms.dbmi.avillach.varload.etl.transform.Normalizer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable settings of one pipeline run. Every component receives what it needs from here; nothing
 * reads global state.
 */
public final class PipelineSettings {

    public static final int DEFAULT_CHUNK_SIZE = 50_000;
    public static final String DEFAULT_INTERMEDIATE_FILE_NAME = "variants.csv";
    public static final String FAILURE_LOG_NAME = "failures.jsonl";

    private final String runId;
    private final RunMode mode;
    private final Path inputFile;
    private final Path workDir;
    private final String intermediateFileName;
    private final boolean startFresh;
    private final boolean reuseIntermediate;
    private final Long maxRows;
    private final int chunkSize;
    private final int batchSize;
    private final int maxAlleleLength;
    private final boolean pipelined;
    private final boolean excludeDegraded;
    private final Path drugAnnotationsFile;
    private final Map<Integer, String> clinicalSignificanceCodes;

    private PipelineSettings(Builder b) {
        this.runId = b.runId;
        this.mode = b.mode;
        this.inputFile = b.inputFile;
        this.workDir = b.workDir;
        this.intermediateFileName = b.intermediateFileName;
        this.startFresh = b.startFresh;
        this.reuseIntermediate = b.reuseIntermediate;
        this.maxRows = b.maxRows;
        this.chunkSize = b.chunkSize;
        this.batchSize = b.batchSize;
        this.maxAlleleLength = b.maxAlleleLength;
        this.pipelined = b.pipelined;
        this.excludeDegraded = b.excludeDegraded;
        this.drugAnnotationsFile = b.drugAnnotationsFile;
        this.clinicalSignificanceCodes = Map.copyOf(b.clinicalSignificanceCodes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getRunId() {
        return runId;
    }

    public RunMode getMode() {
        return mode;
    }

    /** Source VCF; null for {@link RunMode#LOAD}. */
    public Path getInputFile() {
        return inputFile;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path getIntermediateFile() {
        return workDir.resolve(intermediateFileName);
    }

    public Path getFailureLog() {
        return workDir.resolve(FAILURE_LOG_NAME);
    }

    public boolean isStartFresh() {
        return startFresh;
    }

    public boolean isReuseIntermediate() {
        return reuseIntermediate;
    }

    /** Row limit, or null for no limit. */
    public Long getMaxRows() {
        return maxRows;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getMaxAlleleLength() {
        return maxAlleleLength;
    }

    public boolean isPipelined() {
        return pipelined;
    }

    public boolean isExcludeDegraded() {
        return excludeDegraded;
    }

    public Path getDrugAnnotationsFile() {
        return drugAnnotationsFile;
    }

    public Map<Integer, String> getClinicalSignificanceCodes() {
        return clinicalSignificanceCodes;
    }

    public LoadOptions loadOptions() {
        return new LoadOptions(batchSize, startFresh, excludeDegraded);
    }

    @Override
    public String toString() {
        return "PipelineSettings{runId=" + runId + ", mode=" + mode + ", inputFile=" + inputFile + ", workDir=" + workDir
            + ", intermediateFile=" + intermediateFileName + ", startFresh=" + startFresh
            + ", reuseIntermediate=" + reuseIntermediate + ", maxRows=" + maxRows + ", chunkSize=" + chunkSize
            + ", batchSize=" + batchSize + ", maxAlleleLength=" + maxAlleleLength + ", pipelined=" + pipelined
            + ", excludeDegraded=" + excludeDegraded + ", drugAnnotationsFile=" + drugAnnotationsFile + "}";
    }

    public static final class Builder {
        private String runId = UUID.randomUUID().toString();
        private RunMode mode = RunMode.FULL;
        private Path inputFile;
        private Path workDir = Paths.get("data", "processed");
        private String intermediateFileName = DEFAULT_INTERMEDIATE_FILE_NAME;
        private boolean startFresh = false;
        private boolean reuseIntermediate = true;
        private Long maxRows;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int batchSize = LoadOptions.DEFAULT_BATCH_SIZE;
        private int maxAlleleLength = Normalizer.DEFAULT_MAX_ALLELE_LENGTH;
        private boolean pipelined = false;
        private boolean excludeDegraded = false;
        private Path drugAnnotationsFile;
        private Map<Integer, String> clinicalSignificanceCodes = ClinicalSignificanceMapper.defaultCodes();

        private Builder() {
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder mode(RunMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder inputFile(Path inputFile) {
            this.inputFile = inputFile;
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder intermediateFileName(String intermediateFileName) {
            this.intermediateFileName = intermediateFileName;
            return this;
        }

        public Builder startFresh(boolean startFresh) {
            this.startFresh = startFresh;
            return this;
        }

        public Builder reuseIntermediate(boolean reuseIntermediate) {
            this.reuseIntermediate = reuseIntermediate;
            return this;
        }

        public Builder maxRows(Long maxRows) {
            this.maxRows = maxRows;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxAlleleLength(int maxAlleleLength) {
            this.maxAlleleLength = maxAlleleLength;
            return this;
        }

        public Builder pipelined(boolean pipelined) {
            this.pipelined = pipelined;
            return this;
        }

        public Builder excludeDegraded(boolean excludeDegraded) {
            this.excludeDegraded = excludeDegraded;
            return this;
        }

        public Builder drugAnnotationsFile(Path drugAnnotationsFile) {
            this.drugAnnotationsFile = drugAnnotationsFile;
            return this;
        }

        public Builder clinicalSignificanceCodes(Map<Integer, String> codes) {
            this.clinicalSignificanceCodes = new TreeMap<>(codes);
            return this;
        }

        public PipelineSettings build() {
            Preconditions.checkNotNull(runId, "runId");
            Preconditions.checkNotNull(mode, "mode");
            Preconditions.checkNotNull(workDir, "workDir");
            Preconditions.checkArgument(intermediateFileName != null && !intermediateFileName.isBlank(),
                "intermediate file name must not be blank");
            Preconditions.checkArgument(!mode.transforms() || inputFile != null, "mode %s needs an input file", mode);
            Preconditions.checkArgument(maxRows == null || maxRows > 0, "maxRows must be positive: %s", maxRows);
            Preconditions.checkArgument(chunkSize > 0, "chunkSize must be positive: %s", chunkSize);
            Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
            Preconditions.checkArgument(maxAlleleLength > 0, "maxAlleleLength must be positive: %s", maxAlleleLength);
            Preconditions.checkNotNull(clinicalSignificanceCodes, "clinicalSignificanceCodes");
            return new PipelineSettings(this);
        }
    }
}
