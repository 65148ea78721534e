package com.paramvault.api.service;

import com.paramvault.api.exception.StoreException;
import com.paramvault.api.model.dto.PoolStatusResponse;
import com.paramvault.api.model.entity.PoolCredential;
import com.paramvault.api.repository.PoolCredentialRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Durable credential pool. The database is the single source of truth for usage
 * counts, so pool state survives restarts without asking the generator again.
 *
 * Allocation policy:
 * <ol>
 *   <li>a fresh credential (used fewer than {@code freshUseLimit} times), least used first,
 *       then least recently used;</li>
 *   <li>otherwise the exhausted credential that has rested longest, provided it has
 *       cooled down for longer than {@code cooldownSeconds}.</li>
 * </ol>
 */
@Slf4j
@Service
public class CredentialStore {

    private static final Pageable FIRST = PageRequest.of(0, 1);

    private final PoolCredentialRepository poolCredentialRepository;
    private final Clock clock;
    private final int freshUseLimit;
    private final long cooldownSeconds;
    private final int allocateAttempts;
    private final ReentrantLock allocationLock = new ReentrantLock();

    // Self-injection for @Transactional to work on internal calls
    @Autowired
    @Lazy
    private CredentialStore self;

    public CredentialStore(PoolCredentialRepository poolCredentialRepository,
                           Clock clock,
                           @Value("${pool.fresh-use-limit:2}") int freshUseLimit,
                           @Value("${pool.cooldown-seconds:3600}") long cooldownSeconds,
                           @Value("${pool.allocate-attempts:5}") int allocateAttempts) {
        this.poolCredentialRepository = poolCredentialRepository;
        this.clock = clock;
        this.freshUseLimit = freshUseLimit;
        this.cooldownSeconds = cooldownSeconds;
        this.allocateAttempts = allocateAttempts;
    }

    /**
     * Atomically picks a credential, bumps its use count and stamps its last use.
     * Allocations in this process are serialized; the claim itself is a conditional
     * update on the usage state that was read, so an allocator in another process that
     * shares the database never wins the same row twice. A lost claim or a lock
     * conflict retries in a fresh transaction.
     *
     * @return the claimed credential, or empty when nothing is fresh or cooled down
     */
    public Optional<String> allocate() {
        allocationLock.lock();
        try {
            for (int attempt = 1; attempt <= allocateAttempts; attempt++) {
                try {
                    return self.claimNext();
                } catch (ConcurrencyFailureException e) {
                    log.debug("Allocation attempt {}/{} lost to a concurrent writer: {}",
                            attempt, allocateAttempts, e.getMessage());
                } catch (DataAccessException e) {
                    throw new StoreException("Credential allocation failed", e);
                }
            }
        } finally {
            allocationLock.unlock();
        }

        throw new StoreException("Credential allocation kept losing races after " + allocateAttempts + " attempts", null);
    }

    /**
     * One allocation attempt in its own transaction. Callers go through {@link #allocate()}.
     *
     * @throws OptimisticLockingFailureException if another writer claimed the candidate first
     */
    @Transactional
    public Optional<String> claimNext() {
        long now = clock.instant().getEpochSecond();
        Optional<PoolCredential> candidate = findCandidate(now);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }

        PoolCredential row = candidate.get();
        int claimed = poolCredentialRepository.claim(row.getParam(), row.getUseCount(), row.getLastUsed(), now);
        if (claimed != 1) {
            throw new OptimisticLockingFailureException("Candidate credential was claimed concurrently");
        }
        log.debug("Allocated credential (useCount {} -> {})", row.getUseCount(), row.getUseCount() + 1);
        return Optional.of(row.getParam());
    }

    private Optional<PoolCredential> findCandidate(long now) {
        List<PoolCredential> fresh = poolCredentialRepository.findFreshCandidates(freshUseLimit, FIRST);
        if (!fresh.isEmpty()) {
            return Optional.of(fresh.get(0));
        }
        long cutoff = now - cooldownSeconds;
        return poolCredentialRepository.findCooledDownCandidates(freshUseLimit, cutoff, FIRST)
                .stream()
                .findFirst();
    }

    /**
     * Inserts new credentials with a zero use count. Credentials already in the pool keep
     * their usage state; blank entries are skipped.
     *
     * @return number of credentials actually added
     */
    public int addCredentials(Collection<String> params) {
        Set<String> batch = new LinkedHashSet<>();
        for (String param : params) {
            if (param != null && !param.isBlank()) {
                batch.add(param);
            }
        }
        if (batch.isEmpty()) {
            return 0;
        }

        try {
            return self.insertIgnoringDuplicates(batch);
        } catch (DataIntegrityViolationException e) {
            // A concurrent writer inserted one of these first; the retry skips it
            log.debug("Concurrent insert detected, retrying batch of {}: {}", batch.size(), e.getMessage());
            try {
                return self.insertIgnoringDuplicates(batch);
            } catch (DataAccessException retryFailure) {
                throw new StoreException("Failed to add credentials to pool", retryFailure);
            }
        } catch (DataAccessException e) {
            throw new StoreException("Failed to add credentials to pool", e);
        }
    }

    @Transactional
    public int insertIgnoringDuplicates(Collection<String> params) {
        int inserted = 0;
        for (String param : params) {
            inserted += poolCredentialRepository.insertIfAbsent(param);
        }
        log.debug("Inserted {} of {} credentials into pool", inserted, params.size());
        return inserted;
    }

    /**
     * Number of credentials below the reuse limit, the pool's fresh supply.
     */
    @Transactional(readOnly = true)
    public long countAvailable() {
        try {
            return poolCredentialRepository.countByUseCountLessThan(freshUseLimit);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to count available credentials", e);
        }
    }

    @Transactional(readOnly = true)
    public PoolStatusResponse stats() {
        try {
            long total = poolCredentialRepository.count();
            long available = poolCredentialRepository.countByUseCountLessThan(freshUseLimit);
            long cutoff = clock.instant().getEpochSecond() - cooldownSeconds;
            long reusable = poolCredentialRepository
                    .countByUseCountGreaterThanEqualAndLastUsedLessThan(freshUseLimit, cutoff);
            return PoolStatusResponse.builder()
                    .total(total)
                    .available(available)
                    .reusable(reusable)
                    .cooling(total - available - reusable)
                    .build();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read pool statistics", e);
        }
    }
}
