package com.example.ssdetect.report;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.PrintStream;

/**
 * One JSON object per line for scripts: a {@code result} envelope per image, then one
 * {@code summary} envelope.
 */
public final class JsonLinesResultSink implements ResultSink {
    private final ObjectMapper mapper;
    private final PrintStream out;

    public JsonLinesResultSink(ObjectMapper mapper, PrintStream out) {
        this.mapper = mapper;
        this.out = out;
    }

    @Override
    public void accept(ResultRecord record) throws IOException {
        write(ReportEnvelope.result(record));
    }

    @Override
    public void complete(SummaryRecord summary) throws IOException {
        write(ReportEnvelope.summary(summary));
    }

    private void write(ReportEnvelope envelope) throws IOException {
        out.println(mapper.writeValueAsString(envelope));
        if (out.checkError()) {
            throw new IOException("Failed to write JSON output");
        }
    }

    @Override
    public void close() {
        out.flush();
    }
}
