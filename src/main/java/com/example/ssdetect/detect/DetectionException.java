package com.example.ssdetect.detect;

public class DetectionException extends ImageProcessingException {
    public DetectionException(String message) {
        super(message);
    }

    public DetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
