package com.archiver.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the configuration before a run so bad values fail early instead of mid-download.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateEngine(config, errors);
        validateHttp(config, errors);
        validateDirectories(config, errors);
        validateDiskSpace(config, errors);

        return errors;
    }

    private void validateEngine(Configuration config, List<ValidationError> errors) {
        if (config.concurrency < 1) {
            errors.add(new ValidationError("concurrency must be at least 1, got " + config.concurrency, "ERROR"));
        } else if (config.concurrency > 32) {
            errors.add(new ValidationError(
                    "concurrency " + config.concurrency + " is high - the server may start refusing requests",
                    "WARNING"));
        }

        if (config.maxAttempts < 1) {
            errors.add(new ValidationError("maxAttempts must be at least 1, got " + config.maxAttempts, "ERROR"));
        }
    }

    private void validateHttp(Configuration config, List<ValidationError> errors) {
        if (config.connectTimeoutMs < 0 || config.readTimeoutMs < 0) {
            errors.add(new ValidationError("HTTP timeouts must not be negative", "ERROR"));
        }
        if (config.userAgent == null || config.userAgent.isBlank()) {
            errors.add(new ValidationError("userAgent is empty - some servers reject such requests", "WARNING"));
        }
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        if (config.downloadPath == null || config.downloadPath.isBlank()) {
            errors.add(new ValidationError("downloadPath is not set", "ERROR"));
            return;
        }

        File dlPath = new File(config.downloadPath);
        if (dlPath.exists() && !dlPath.isDirectory()) {
            errors.add(new ValidationError("downloadPath is a file: " + config.downloadPath, "ERROR"));
        } else if (!dlPath.exists()) {
            if (!dlPath.mkdirs()) {
                errors.add(new ValidationError("Cannot create download directory: " + config.downloadPath, "ERROR"));
            } else {
                logger.info("✅ Created download directory: {}", config.downloadPath);
            }
        }
    }

    private void validateDiskSpace(Configuration config, List<ValidationError> errors) {
        File root = new File(config.downloadPath == null || config.downloadPath.isBlank() ? "." : config.downloadPath);
        if (!root.exists()) return;

        long freeGB = root.getUsableSpace() / 1024 / 1024 / 1024;
        if (freeGB < 1) {
            errors.add(new ValidationError(
                    String.format("Less than 1 GB free in %s - downloads may fail", root.getAbsolutePath()),
                    "WARNING"));
        }
    }

    /**
     * Validate and report errors to the log.
     *
     * @throws IllegalStateException if any ERROR was found
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.severity.equals("ERROR")) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.debug("Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s).", errorCount));
        }
    }
}
