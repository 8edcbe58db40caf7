package com.example.ssdetect;

import java.util.Locale;

public enum RelocationMode {
    NONE,
    MOVE,
    COPY;

    public boolean active() {
        return this != NONE;
    }

    public static RelocationMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("relocation must be one of none, move, copy but was '" + value + "'.", ex);
        }
    }
}
