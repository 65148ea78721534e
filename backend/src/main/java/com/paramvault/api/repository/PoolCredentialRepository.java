package com.paramvault.api.repository;

import com.paramvault.api.model.entity.PoolCredential;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PoolCredentialRepository extends JpaRepository<PoolCredential, String> {

    @Query("SELECT p FROM PoolCredential p WHERE p.useCount < :limit " +
           "ORDER BY p.useCount ASC, p.lastUsed ASC, p.param ASC")
    List<PoolCredential> findFreshCandidates(@Param("limit") int freshUseLimit, Pageable pageable);

    @Query("SELECT p FROM PoolCredential p WHERE p.useCount >= :limit AND p.lastUsed < :cutoff " +
           "ORDER BY p.lastUsed ASC, p.param ASC")
    List<PoolCredential> findCooledDownCandidates(@Param("limit") int freshUseLimit,
                                                  @Param("cutoff") long cutoff,
                                                  Pageable pageable);

    /**
     * Claims a credential only if it still has the usage state the caller observed.
     * Returns 0 when a concurrent allocation got there first.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PoolCredential p SET p.useCount = p.useCount + 1, p.lastUsed = :now " +
           "WHERE p.param = :param AND p.useCount = :useCount AND p.lastUsed = :lastUsed")
    int claim(@Param("param") String param,
              @Param("useCount") int observedUseCount,
              @Param("lastUsed") long observedLastUsed,
              @Param("now") long now);

    @Modifying
    @Query(value = "INSERT INTO param_pool (param, use_count, last_used) " +
                   "SELECT CAST(:param AS VARCHAR(2048)), 0, 0 WHERE NOT EXISTS (SELECT 1 FROM param_pool WHERE param = :param)",
           nativeQuery = true)
    int insertIfAbsent(@Param("param") String param);

    long countByUseCountLessThan(int freshUseLimit);

    long countByUseCountGreaterThanEqualAndLastUsedLessThan(int freshUseLimit, long cutoff);
}
