package com.example.ssdetect;

public enum Verdict {
    SCREENSHOT,
    REGULAR,
    ERROR
}
