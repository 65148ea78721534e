package com.paramvault.api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.paramvault.api.exception.StoreException;
import com.paramvault.api.model.entity.CacheEntry;
import com.paramvault.api.repository.CacheEntryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/**
 * Time-bounded cache of upstream responses, keyed by a fingerprint of the request.
 * Expired entries read as misses; a scheduled purge removes them physically.
 *
 * Read-through usage: {@code get} first, fetch upstream on a miss, then {@code put}.
 */
@Slf4j
@Service
public class ResponseCacheService {

    private final CacheEntryRepository cacheEntryRepository;
    private final ObjectMapper canonicalMapper;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long ttlSeconds;

    // Self-injection for @Transactional to work on internal calls
    @Autowired
    @Lazy
    private ResponseCacheService self;

    public ResponseCacheService(CacheEntryRepository cacheEntryRepository,
                                ObjectMapper objectMapper,
                                Clock clock,
                                @Value("${cache.ttl-seconds:3000}") long ttlSeconds) {
        this.cacheEntryRepository = cacheEntryRepository;
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * Returns the cached value only while it is younger than the TTL.
     */
    @Transactional(readOnly = true)
    public Optional<byte[]> getCache(String key) {
        try {
            long now = clock.instant().getEpochSecond();
            return cacheEntryRepository.findById(key)
                    .filter(entry -> !entry.isExpired(now, ttlSeconds))
                    .map(CacheEntry::getPayload);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read cache entry", e);
        }
    }

    /**
     * Upserts the value and restarts its TTL.
     */
    public void setCache(String key, byte[] value) {
        if (value.length > CacheEntry.MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("Cache payload too large: " + value.length + " bytes");
        }
        try {
            self.upsert(key, value);
        } catch (DataIntegrityViolationException e) {
            // Two writers raced on a new key; the second write becomes an update
            log.debug("Concurrent cache insert for key {}, retrying", key);
            try {
                self.upsert(key, value);
            } catch (DataAccessException retryFailure) {
                throw new StoreException("Failed to write cache entry", retryFailure);
            }
        } catch (DataAccessException e) {
            throw new StoreException("Failed to write cache entry", e);
        }
    }

    @Transactional
    public void upsert(String key, byte[] value) {
        long now = clock.instant().getEpochSecond();
        CacheEntry entry = cacheEntryRepository.findById(key)
                .map(existing -> {
                    existing.setPayload(value);
                    existing.setStoredAt(now);
                    return existing;
                })
                .orElseGet(() -> CacheEntry.builder()
                        .key(key)
                        .payload(value)
                        .storedAt(now)
                        .build());
        cacheEntryRepository.save(entry);
    }

    public Optional<byte[]> get(String method, String endpoint, Object payload) {
        return getCache(fingerprint(method, endpoint, payload));
    }

    public void put(String method, String endpoint, Object payload, byte[] value) {
        setCache(fingerprint(method, endpoint, payload), value);
    }

    /**
     * Typed read; an entry that no longer deserializes is treated as a miss.
     */
    public <T> Optional<T> getJson(String method, String endpoint, Object payload, TypeReference<T> type) {
        Optional<byte[]> cached = get(method, endpoint, payload);
        if (cached.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(cached.get(), type));
        } catch (IOException e) {
            log.warn("Discarding unreadable cache entry for {} {}: {}", method, endpoint, e.getMessage());
            return Optional.empty();
        }
    }

    public void putJson(String method, String endpoint, Object payload, Object value) {
        try {
            put(method, endpoint, payload, objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    /**
     * Stable cache key for a request: SHA-256 over the upper-cased method, the endpoint
     * and the payload serialized as JSON with sorted keys.
     */
    public String fingerprint(String method, String endpoint, Object payload) {
        String canonicalPayload;
        try {
            // Round-trip through a tree so nested maps and POJOs sort the same way
            canonicalPayload = payload == null
                    ? ""
                    : canonicalMapper.writeValueAsString(canonicalMapper.convertValue(payload, Object.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Request payload is not serializable as JSON", e);
        }

        String material = method.toUpperCase(Locale.ROOT) + " " + endpoint + " " + canonicalPayload;
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(material.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Deletes entries older than the TTL.
     */
    @Scheduled(cron = "${cache.purge-cron:0 0 * * * *}")
    @Transactional
    public int purgeExpired() {
        long cutoff = clock.instant().getEpochSecond() - ttlSeconds;
        int removed = cacheEntryRepository.deleteStoredAtOrBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} expired cache entries", removed);
        }
        return removed;
    }
}
