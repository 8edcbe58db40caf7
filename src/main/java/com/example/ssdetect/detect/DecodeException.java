package com.example.ssdetect.detect;

public class DecodeException extends ImageProcessingException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
