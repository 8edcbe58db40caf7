package com.example.ssdetect.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Report directory sink. Result records are written in batches of {@code batchSize} to
 * {@code results_000001.json}, {@code results_000002.json}, ...; the run summary goes to
 * {@code summary.json} once the run completes.
 */
public class ReportBuffer implements ResultSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportBuffer.class);

    static final String PREFIX = "results_";
    static final String SUMMARY_FILE = "summary.json";

    private final ObjectWriter writer;
    private final Path reportDirectory;
    private final int batchSize;
    private final List<ResultRecord> pending;
    private int nextBatch = 1;

    public ReportBuffer(ObjectMapper mapper, Path reportDirectory, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.writer = mapper.writerWithDefaultPrettyPrinter();
        this.reportDirectory = reportDirectory;
        this.batchSize = batchSize;
        this.pending = new ArrayList<>(batchSize);
    }

    @Override
    public synchronized void accept(ResultRecord record) throws IOException {
        pending.add(record);
        if (pending.size() >= batchSize) {
            writeBatch();
        }
    }

    @Override
    public synchronized void complete(SummaryRecord summary) throws IOException {
        writeBatch();
        write(SUMMARY_FILE, summary);
    }

    @Override
    public synchronized void close() throws IOException {
        writeBatch();
    }

    synchronized int nextBatch() {
        return nextBatch;
    }

    private void writeBatch() throws IOException {
        if (pending.isEmpty()) {
            return;
        }
        String name = String.format("%s%06d.json", PREFIX, nextBatch);
        write(name, List.copyOf(pending));
        nextBatch++;
        pending.clear();
    }

    private void write(String name, Object value) throws IOException {
        Files.createDirectories(reportDirectory);
        Path file = reportDirectory.resolve(name);
        writer.writeValue(file.toFile(), value);
        LOGGER.debug("Wrote report file {}", file);
    }
}
