package com.example.ssdetect;

public enum ExitCode {
    SUCCESS(0),
    FAILURE(1),
    // 128 + SIGINT, what shells report for an interrupted process.
    CANCELLED(130);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
