package com.example.ssdetect.detect;

/**
 * Base type for per-image failures. These become error verdicts and never stop a worker.
 */
public abstract class ImageProcessingException extends Exception {
    protected ImageProcessingException(String message) {
        super(message);
    }

    protected ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
