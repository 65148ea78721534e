package com.paramvault.api.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One generator-issued credential in the reuse pool.
 * Timestamps are epoch seconds; a never-used credential has {@code lastUsed = 0}.
 */
@Entity
@Table(name = "param_pool", indexes = {
        @Index(name = "idx_param_pool_usage", columnList = "use_count, last_used")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolCredential {

    @Id
    @Column(nullable = false, updatable = false, length = 2048)
    private String param;

    @Builder.Default
    @Column(name = "use_count", nullable = false)
    private int useCount = 0;

    @Builder.Default
    @Column(name = "last_used", nullable = false)
    private long lastUsed = 0L;
}
