package com.example.ssdetect.detect;

/**
 * A detector model could not be loaded. Fatal to the worker that tried, never retried.
 */
public class ModelLoadException extends Exception {
    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
