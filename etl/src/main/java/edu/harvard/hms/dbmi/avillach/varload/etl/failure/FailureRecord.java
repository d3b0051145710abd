package edu.harvard.hms.dbmi.avillach.varload.etl.failure;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSONL record for failure capture. Enough detail is kept to reprocess the item later.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureRecord(
    String runId,
    Stage stage,
    String sourceFile,
    Long lineNumber,
    String variantKey,
    String rawText,
    FailureReason reasonCode,
    String reasonDetail
) {
    public enum Stage {
        PARSE,
        LOAD,
        SIDE_INPUT
    }

    public static FailureRecord malformedLine(String runId, String sourceFile, long lineNumber, String rawText, String detail) {
        return new FailureRecord(runId, Stage.PARSE, sourceFile, lineNumber, null, rawText, FailureReason.MALFORMED_LINE, detail);
    }

    public static FailureRecord rejectedRow(String runId, String sourceFile, String variantKey, String rawText, String detail) {
        return new FailureRecord(runId, Stage.LOAD, sourceFile, null, variantKey, rawText, FailureReason.ROW_REJECTED, detail);
    }

    public static FailureRecord discardedIntermediateRow(String runId, String sourceFile, long rowNumber, String detail) {
        return new FailureRecord(runId, Stage.LOAD, sourceFile, rowNumber, null, null, FailureReason.TRUNCATED_INTERMEDIATE_ROW, detail);
    }

    public static FailureRecord invalidSideInputRow(String runId, String sourceFile, long lineNumber, String rawText, String detail) {
        return new FailureRecord(runId, Stage.SIDE_INPUT, sourceFile, lineNumber, null, rawText, FailureReason.SIDE_INPUT_ROW_INVALID, detail);
    }
}
