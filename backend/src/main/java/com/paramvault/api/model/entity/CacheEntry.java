package com.paramvault.api.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Cached upstream response keyed by request fingerprint.
 */
@Entity
@Table(name = "api_cache")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    public static final int MAX_PAYLOAD_BYTES = 16 * 1024 * 1024;

    @Id
    @Column(name = "cache_key", nullable = false, updatable = false, length = 512)
    private String key;

    @Column(name = "payload", nullable = false, length = MAX_PAYLOAD_BYTES)
    private byte[] payload;

    @Column(name = "stored_at", nullable = false)
    private long storedAt;

    public boolean isExpired(long nowEpochSeconds, long ttlSeconds) {
        return nowEpochSeconds - storedAt >= ttlSeconds;
    }
}
