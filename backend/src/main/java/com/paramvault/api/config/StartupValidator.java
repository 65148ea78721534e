package com.paramvault.api.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Validates pool and generator configuration on application startup.
 * Invalid thresholds fail fast; a missing generator binary only warns, since
 * it may be provisioned after boot.
 */
@Slf4j
@Component
public class StartupValidator {

    @Value("${generator.executable-path}")
    private String generatorExecutablePath;

    @Value("${pool.batch-size:2}")
    private int batchSize;

    @Value("${pool.target-capacity:100}")
    private int targetCapacity;

    @Value("${pool.low-water-mark:20}")
    private int lowWaterMark;

    @Value("${pool.fresh-use-limit:2}")
    private int freshUseLimit;

    @Value("${pool.cooldown-seconds:3600}")
    private long cooldownSeconds;

    @Value("${cache.ttl-seconds:3000}")
    private long cacheTtlSeconds;

    @PostConstruct
    public void validate() {
        log.info("Validating startup configuration...");

        validateGeneratorExecutable();
        validatePoolThresholds();
        validateCache();

        log.info("Startup configuration validation complete");
    }

    private void validateGeneratorExecutable() {
        if (generatorExecutablePath == null || generatorExecutablePath.isBlank()) {
            throw new IllegalStateException(
                    "GENERATOR_EXECUTABLE_PATH must be configured for credential generation");
        }

        File executable = new File(generatorExecutablePath);
        if (!executable.exists()) {
            log.warn("Generator executable does not exist at: {}. " +
                    "Credential generation will fail until it is provisioned.", generatorExecutablePath);
        } else if (!executable.canExecute()) {
            throw new IllegalStateException(
                    "Generator executable exists but is not executable: " + generatorExecutablePath);
        } else {
            log.info("Generator executable validated: {}", generatorExecutablePath);
        }
    }

    private void validatePoolThresholds() {
        if (batchSize <= 0) {
            throw new IllegalStateException("pool.batch-size must be positive, got " + batchSize);
        }
        if (freshUseLimit <= 0) {
            throw new IllegalStateException("pool.fresh-use-limit must be positive, got " + freshUseLimit);
        }
        if (cooldownSeconds < 0) {
            throw new IllegalStateException("pool.cooldown-seconds must not be negative, got " + cooldownSeconds);
        }
        if (lowWaterMark < 0 || lowWaterMark > targetCapacity) {
            throw new IllegalStateException(
                    "pool.low-water-mark must be between 0 and pool.target-capacity (" + targetCapacity + "), got " + lowWaterMark);
        }

        log.info("Pool configured: target={}, lowWaterMark={}, batchSize={}, freshUseLimit={}, cooldown={}s",
                targetCapacity, lowWaterMark, batchSize, freshUseLimit, cooldownSeconds);
    }

    private void validateCache() {
        if (cacheTtlSeconds <= 0) {
            throw new IllegalStateException("cache.ttl-seconds must be positive, got " + cacheTtlSeconds);
        }
    }
}
