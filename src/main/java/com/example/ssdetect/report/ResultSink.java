package com.example.ssdetect.report;

import java.io.IOException;
import java.util.List;

/**
 * Receives every result exactly once, in the order the collector drained them, followed by
 * one summary. Only the collector thread calls {@link #accept}.
 */
public interface ResultSink extends AutoCloseable {
    void accept(ResultRecord record) throws IOException;

    default void complete(SummaryRecord summary) throws IOException {
        // no-op
    }

    @Override
    default void close() throws IOException {
        // no-op
    }

    static ResultSink noop() {
        return record -> {
        };
    }

    static ResultSink composite(List<ResultSink> sinks) {
        List<ResultSink> copy = List.copyOf(sinks);
        return new ResultSink() {
            @Override
            public void accept(ResultRecord record) throws IOException {
                for (ResultSink sink : copy) {
                    sink.accept(record);
                }
            }

            @Override
            public void complete(SummaryRecord summary) throws IOException {
                for (ResultSink sink : copy) {
                    sink.complete(summary);
                }
            }

            @Override
            public void close() throws IOException {
                IOException failure = null;
                for (ResultSink sink : copy) {
                    try {
                        sink.close();
                    } catch (IOException ex) {
                        if (failure == null) {
                            failure = ex;
                        } else {
                            failure.addSuppressed(ex);
                        }
                    }
                }
                if (failure != null) {
                    throw failure;
                }
            }
        };
    }
}
