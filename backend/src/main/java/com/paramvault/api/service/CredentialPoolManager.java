package com.paramvault.api.service;

import com.paramvault.api.exception.GeneratorException;
import com.paramvault.api.exception.PoolExhaustedException;
import com.paramvault.api.exception.RefillFailedException;
import com.paramvault.api.exception.StoreException;
import com.paramvault.api.generator.CredentialGenerator;
import com.paramvault.api.model.dto.PoolStatusResponse;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out credentials from the persistent pool and keeps the pool supplied.
 *
 * Two refill paths exist. When allocation finds nothing usable, the caller blocks on a
 * direct generator request (emergency refill) and either gets a credential or a
 * {@link RefillFailedException}. When the fresh supply drops below the low-water mark,
 * a background warm-up tops the pool up to its target without blocking anyone.
 */
@Slf4j
@Service
public class CredentialPoolManager {

    private static final long CLOSE_WAIT_MILLIS = 5000;

    private final CredentialStore credentialStore;
    private final CredentialGenerator generator;
    private final AsyncTaskExecutor taskExecutor;
    private final int batchSize;
    private final int targetCapacity;
    private final int lowWaterMark;
    private final Duration warmUpBackoff;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final Condition warmUpFinished = lifecycleLock.newCondition();

    // Guarded by lifecycleLock
    private boolean warmingUp;
    private boolean warmUpRunning;
    private Future<?> warmUpTask;
    private boolean closed;

    public CredentialPoolManager(CredentialStore credentialStore,
                                 CredentialGenerator generator,
                                 @Qualifier("taskExecutor") AsyncTaskExecutor taskExecutor,
                                 @Value("${pool.batch-size:2}") int batchSize,
                                 @Value("${pool.target-capacity:100}") int targetCapacity,
                                 @Value("${pool.low-water-mark:20}") int lowWaterMark,
                                 @Value("${pool.warmup-backoff:5s}") Duration warmUpBackoff) {
        this.credentialStore = credentialStore;
        this.generator = generator;
        this.taskExecutor = taskExecutor;
        this.batchSize = batchSize;
        this.targetCapacity = targetCapacity;
        this.lowWaterMark = lowWaterMark;
        this.warmUpBackoff = warmUpBackoff;
    }

    /**
     * Returns a usable credential, refilling the pool synchronously if it is exhausted.
     *
     * @throws RefillFailedException if the pool is still empty after a direct generator request
     * @throws GeneratorException if the generator cannot be started or talked to
     * @throws StoreException if the pool cannot be read or updated
     */
    public String getCredential() {
        String credential;
        try {
            credential = credentialStore.allocate()
                    .orElseThrow(() -> new PoolExhaustedException("No fresh or cooled-down credential in pool"));
        } catch (PoolExhaustedException e) {
            log.warn("{}. Emergency fetch of a new batch", e.getMessage());
            credential = emergencyRefill(e);
        }

        checkLowWaterMark();
        return credential;
    }

    private String emergencyRefill(PoolExhaustedException exhausted) {
        List<String> batch = generator.requestBatch(batchSize);
        if (batch.isEmpty()) {
            throw new RefillFailedException("Generator returned an empty batch during emergency refill", exhausted);
        }

        int added = credentialStore.addCredentials(batch);
        log.info("Emergency refill added {} of {} credentials", added, batch.size());

        Optional<String> credential = credentialStore.allocate();
        if (credential.isEmpty()) {
            throw new RefillFailedException(
                    "No credential available even after emergency refill of " + batch.size() + " credentials",
                    exhausted);
        }
        return credential.get();
    }

    private void checkLowWaterMark() {
        long available;
        try {
            available = credentialStore.countAvailable();
        } catch (StoreException e) {
            // The credential is already claimed; the next call checks again
            log.warn("Skipping low-water check: {}", e.getMessage());
            return;
        }
        if (available < lowWaterMark && !isWarmingUp()) {
            log.info("Credential pool is low ({} available, low-water mark {}). Triggering background refill",
                    available, lowWaterMark);
            triggerWarmUp();
        }
    }

    /**
     * Starts a background warm-up unless one is already running.
     *
     * @return true if a new warm-up was submitted
     */
    public boolean triggerWarmUp() {
        lifecycleLock.lock();
        try {
            if (closed || warmingUp) {
                return false;
            }
            warmingUp = true;
            try {
                warmUpTask = taskExecutor.submit(this::runWarmUp);
            } catch (RuntimeException e) {
                warmingUp = false;
                throw e;
            }
            return true;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Runs a warm-up on the calling thread unless one is already running.
     *
     * @return false if another warm-up was in flight and this call did nothing
     */
    public boolean warmUp() {
        lifecycleLock.lock();
        try {
            if (closed || warmingUp) {
                return false;
            }
            warmingUp = true;
        } finally {
            lifecycleLock.unlock();
        }
        runWarmUp();
        return true;
    }

    /**
     * Fills the pool until the fresh supply reaches the target. Generator failures are
     * logged and retried after the backoff; interruption or {@link #close()} ends the run.
     */
    private void runWarmUp() {
        lifecycleLock.lock();
        try {
            if (closed) {
                warmingUp = false;
                return;
            }
            warmUpRunning = true;
        } finally {
            lifecycleLock.unlock();
        }

        try {
            long available = credentialStore.countAvailable();
            log.info("Replenishing credential pool ({}/{})", Math.min(available, targetCapacity), targetCapacity);

            while (available < targetCapacity) {
                if (Thread.currentThread().isInterrupted() || isClosed()) {
                    log.info("Pool warm-up cancelled at {}/{}", available, targetCapacity);
                    return;
                }
                try {
                    List<String> batch = generator.requestBatch(batchSize);
                    if (batch.isEmpty()) {
                        log.warn("Generator returned an empty batch. Retrying in {}ms", warmUpBackoff.toMillis());
                        backOff();
                    } else {
                        int added = credentialStore.addCredentials(batch);
                        available = credentialStore.countAvailable();
                        log.info("Pool warm-up added {} credentials ({}/{})",
                                added, Math.min(available, targetCapacity), targetCapacity);
                        if (added == 0) {
                            log.warn("Generator batch contained only known credentials. Retrying in {}ms",
                                    warmUpBackoff.toMillis());
                            backOff();
                        }
                    }
                } catch (GeneratorException e) {
                    if (Thread.currentThread().isInterrupted()) {
                        log.info("Pool warm-up cancelled during generator request");
                        return;
                    }
                    log.warn("Warm-up error: {}. Retrying in {}ms", e.getMessage(), warmUpBackoff.toMillis());
                    backOff();
                }
            }
            log.info("Credential pool is full ({} available)", available);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Pool warm-up cancelled during backoff");
        } catch (StoreException e) {
            log.error("Pool warm-up stopped by store error: {}", e.getMessage(), e);
        } finally {
            lifecycleLock.lock();
            try {
                warmingUp = false;
                warmUpRunning = false;
                warmUpFinished.signalAll();
            } finally {
                lifecycleLock.unlock();
            }
        }
    }

    private void backOff() throws InterruptedException {
        TimeUnit.MILLISECONDS.sleep(warmUpBackoff.toMillis());
    }

    /**
     * Starts the generator ahead of the first request and optionally begins a warm-up.
     */
    public void prime(boolean warmUp) {
        generator.start();
        if (warmUp) {
            triggerWarmUp();
        }
    }

    private boolean isClosed() {
        lifecycleLock.lock();
        try {
            return closed;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isWarmingUp() {
        lifecycleLock.lock();
        try {
            return warmingUp;
        } finally {
            lifecycleLock.unlock();
        }
    }

    public PoolStatusResponse status() {
        PoolStatusResponse status = credentialStore.stats();
        status.setTargetCapacity(targetCapacity);
        status.setLowWaterMark(lowWaterMark);
        status.setGeneratorState(generator.state().name());
        status.setWarmingUp(isWarmingUp());
        return status;
    }

    /**
     * Cancels any running warm-up and stops the generator process.
     */
    @PreDestroy
    public void close() {
        Future<?> pending;
        lifecycleLock.lock();
        try {
            closed = true;
            pending = warmUpTask;
            warmUpTask = null;
        } finally {
            lifecycleLock.unlock();
        }

        if (pending != null && !pending.isDone()) {
            log.info("Cancelling pool warm-up");
            pending.cancel(true);
        }

        // Stopping first unblocks a warm-up stuck on a generator read
        generator.stop();
        awaitWarmUpExit();
    }

    private void awaitWarmUpExit() {
        lifecycleLock.lock();
        try {
            long remaining = TimeUnit.MILLISECONDS.toNanos(CLOSE_WAIT_MILLIS);
            while (warmUpRunning) {
                if (remaining <= 0) {
                    log.warn("Pool warm-up did not finish within {}ms of cancellation", CLOSE_WAIT_MILLIS);
                    return;
                }
                remaining = warmUpFinished.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            lifecycleLock.unlock();
        }
    }
}
