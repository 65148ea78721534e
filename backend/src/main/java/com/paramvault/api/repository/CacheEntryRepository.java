package com.paramvault.api.repository;

import com.paramvault.api.model.entity.CacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface CacheEntryRepository extends JpaRepository<CacheEntry, String> {

    @Modifying
    @Query("DELETE FROM CacheEntry c WHERE c.storedAt <= :cutoff")
    int deleteStoredAtOrBefore(@Param("cutoff") long cutoff);
}
