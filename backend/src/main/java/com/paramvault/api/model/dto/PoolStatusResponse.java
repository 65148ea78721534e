package com.paramvault.api.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatusResponse {

    @JsonProperty("total")
    private long total;

    /** Credentials below the reuse limit. */
    @JsonProperty("available")
    private long available;

    /** Exhausted credentials still inside the cooldown window. */
    @JsonProperty("cooling")
    private long cooling;

    /** Exhausted credentials whose cooldown has elapsed. */
    @JsonProperty("reusable")
    private long reusable;

    @JsonProperty("target_capacity")
    private int targetCapacity;

    @JsonProperty("low_water_mark")
    private int lowWaterMark;

    @JsonProperty("generator_state")
    private String generatorState;

    @JsonProperty("warming_up")
    private boolean warmingUp;
}
