package com.example.ssdetect;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class ConfigLoader {
    private static final int DEFAULT_WORKER_COUNT = 8;
    private static final int MAX_WORKER_COUNT = 32;
    private static final int DEFAULT_OCR_MIN_CHARS = 10;
    private static final double DEFAULT_OCR_MIN_CONFIDENCE = 0.6;
    private static final int DEFAULT_QUEUE_CAPACITY_FACTOR = 4;
    private static final long DEFAULT_POLL_TIMEOUT_MILLIS = 100L;
    private static final int DEFAULT_MAX_CONFLICT_ATTEMPTS = 10_000;
    private static final int DEFAULT_REPORT_BATCH_SIZE = 500;
    private static final String DEFAULT_OCR_LANGUAGE = "eng";
    private static final List<String> DEFAULT_SIDECAR_EXTENSIONS = List.of("xmp");
    private static final List<String> DEFAULT_EXCLUDE_DIRECTORIES = List.of(
            "$RECYCLE.BIN",
            "System Volume Information",
            ".git"
    );

    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public DetectorConfig load(Path path) throws IOException {
        RawConfig raw = mapper.readValue(path.toFile(), RawConfig.class);
        return resolve(raw);
    }

    DetectorConfig resolve(RawConfig raw) {
        if (raw.inputDirectory == null || raw.inputDirectory.isBlank()) {
            throw new IllegalArgumentException("Config must include an inputDirectory.");
        }

        DetectionMode mode = raw.mode == null ? DetectionMode.BOTH : DetectionMode.parse(raw.mode);
        int workerCount = raw.workerCount != null && raw.workerCount > 0
                ? Math.min(raw.workerCount, MAX_WORKER_COUNT)
                : DEFAULT_WORKER_COUNT;

        int ocrMinChars = raw.ocrMinChars == null ? DEFAULT_OCR_MIN_CHARS : raw.ocrMinChars;
        if (ocrMinChars < 0) {
            throw new IllegalArgumentException("ocrMinChars must not be negative.");
        }
        double ocrMinConfidence = raw.ocrMinConfidence == null ? DEFAULT_OCR_MIN_CONFIDENCE : raw.ocrMinConfidence;
        if (ocrMinConfidence < 0.0 || ocrMinConfidence > 1.0) {
            throw new IllegalArgumentException("ocrMinConfidence must be between 0.0 and 1.0.");
        }
        double ocrResizeFactor = raw.ocrResizeFactor == null ? 1.0 : raw.ocrResizeFactor;
        if (ocrResizeFactor <= 0.0 || ocrResizeFactor > 1.0) {
            throw new IllegalArgumentException("ocrResizeFactor must be greater than 0.0 and at most 1.0.");
        }
        boolean extraHeuristics = raw.extraHeuristics == null || raw.extraHeuristics;
        boolean gpuEnabled = raw.gpuEnabled == null || raw.gpuEnabled;

        RelocationMode relocation = raw.relocation == null ? RelocationMode.NONE : RelocationMode.parse(raw.relocation);
        Optional<Path> relocationTarget = Optional.ofNullable(raw.relocationTarget)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        if (relocation.active() && relocationTarget.isEmpty()) {
            throw new IllegalArgumentException("relocationTarget is required when relocation is "
                    + relocation.name().toLowerCase(Locale.ROOT) + ".");
        }

        int queueCapacityFactor = raw.queueCapacityFactor != null && raw.queueCapacityFactor > 0
                ? raw.queueCapacityFactor
                : DEFAULT_QUEUE_CAPACITY_FACTOR;
        long pollTimeoutMillis = raw.pollTimeoutMillis != null && raw.pollTimeoutMillis > 0
                ? raw.pollTimeoutMillis
                : DEFAULT_POLL_TIMEOUT_MILLIS;
        boolean followLinks = raw.followLinks != null && raw.followLinks;
        int maxConflictAttempts = raw.maxConflictAttempts != null && raw.maxConflictAttempts > 0
                ? raw.maxConflictAttempts
                : DEFAULT_MAX_CONFLICT_ATTEMPTS;

        List<String> excludeDirectoryPatterns = mergePatterns(DEFAULT_EXCLUDE_DIRECTORIES, raw.excludeDirectoryPatterns);
        List<String> sidecarExtensions = raw.sidecarExtensions == null
                ? DEFAULT_SIDECAR_EXTENSIONS
                : raw.sidecarExtensions.stream()
                        .filter(value -> value != null && !value.isBlank())
                        .map(value -> value.replaceFirst("^\\.", "").toLowerCase(Locale.ROOT))
                        .distinct()
                        .toList();

        OutputFormat outputFormat = raw.outputFormat == null ? OutputFormat.LOG : OutputFormat.parse(raw.outputFormat);
        Optional<Path> reportDirectory = Optional.ofNullable(raw.reportDirectory)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        int reportBatchSize = raw.reportBatchSize != null && raw.reportBatchSize > 0
                ? raw.reportBatchSize
                : DEFAULT_REPORT_BATCH_SIZE;

        Optional<Path> tessdataPath = Optional.ofNullable(raw.tessdataPath)
                .filter(value -> !value.isBlank())
                .map(Path::of);
        String ocrLanguage = optionalString(raw.ocrLanguage, DEFAULT_OCR_LANGUAGE);

        return new DetectorConfig(
                Path.of(raw.inputDirectory),
                mode,
                workerCount,
                ocrMinChars,
                ocrMinConfidence,
                ocrResizeFactor,
                extraHeuristics,
                gpuEnabled,
                relocation,
                relocationTarget,
                queueCapacityFactor,
                pollTimeoutMillis,
                followLinks,
                excludeDirectoryPatterns,
                sidecarExtensions,
                maxConflictAttempts,
                outputFormat,
                reportDirectory,
                reportBatchSize,
                tessdataPath,
                ocrLanguage
        );
    }

    private List<String> mergePatterns(List<String> defaults, List<String> overrides) {
        List<String> merged = new ArrayList<>(defaults);
        if (overrides != null) {
            for (String pattern : overrides) {
                if (pattern == null || pattern.isBlank() || merged.contains(pattern)) {
                    continue;
                }
                merged.add(pattern);
            }
        }
        return List.copyOf(merged);
    }

    private String optionalString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value;
    }

    static class RawConfig {
        public String inputDirectory;
        public String mode;
        public Integer workerCount;
        public Integer ocrMinChars;
        public Double ocrMinConfidence;
        public Double ocrResizeFactor;
        public Boolean extraHeuristics;
        public Boolean gpuEnabled;
        public String relocation;
        public String relocationTarget;
        public Integer queueCapacityFactor;
        public Long pollTimeoutMillis;
        public Boolean followLinks;
        public List<String> excludeDirectoryPatterns;
        public List<String> sidecarExtensions;
        public Integer maxConflictAttempts;
        public String outputFormat;
        public String reportDirectory;
        public Integer reportBatchSize;
        public String tessdataPath;
        public String ocrLanguage;
    }
}
