package com.example.ssdetect;

import java.util.Locale;

public enum OutputFormat {
    LOG,
    JSON;

    public static OutputFormat parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("outputFormat must be log or json but was '" + value + "'.", ex);
        }
    }
}
