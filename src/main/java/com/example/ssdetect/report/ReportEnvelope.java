package com.example.ssdetect.report;

/**
 * Wrapper used to emit per-image records and the closing summary into one stream.
 */
public record ReportEnvelope(
        String type,
        Object payload
) {
    public static ReportEnvelope result(ResultRecord record) {
        return new ReportEnvelope("result", record);
    }

    public static ReportEnvelope summary(SummaryRecord summary) {
        return new ReportEnvelope("summary", summary);
    }
}
