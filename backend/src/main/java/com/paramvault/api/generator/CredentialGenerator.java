package com.paramvault.api.generator;

import java.util.List;

/**
 * Source of fresh credentials. The production implementation is {@link GeneratorProcess};
 * the pool logic only depends on this interface.
 */
public interface CredentialGenerator {

    /**
     * Brings the generator to {@link GeneratorState#READY}. No-op when already running.
     *
     * @throws com.paramvault.api.exception.GeneratorStartupException if readiness is not signalled
     */
    void start();

    /**
     * Requests one batch of credentials, starting the generator first if needed.
     *
     * @param batchSize positive batch multiplier passed to the generator
     * @return credentials in the order the generator emitted them, possibly empty
     * @throws com.paramvault.api.exception.GeneratorIpcException on any channel failure
     */
    List<String> requestBatch(int batchSize);

    /**
     * Terminates the generator, force-killing it after a bounded grace period. Idempotent.
     */
    void stop();

    GeneratorState state();

    default boolean isRunning() {
        return state().isLive();
    }
}
