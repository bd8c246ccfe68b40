package com.github.jnthnclt.os.bloom.core.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;

/**
 * @author jonathan.colt
 */
public class BloomReaderConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public final int maxPageSize;
    public final boolean usePool;
    public final int poolMinPower;
    public final int poolMaxPower;
    public final int poolBuffersPerBucket;

    @JsonCreator
    public BloomReaderConfig(@JsonProperty("maxPageSize") int maxPageSize,
        @JsonProperty("usePool") boolean usePool,
        @JsonProperty("poolMinPower") int poolMinPower,
        @JsonProperty("poolMaxPower") int poolMaxPower,
        @JsonProperty("poolBuffersPerBucket") int poolBuffersPerBucket) {

        Preconditions.checkArgument(maxPageSize > 0, "maxPageSize must be positive, was %s", maxPageSize);
        this.maxPageSize = maxPageSize;
        this.usePool = usePool;
        this.poolMinPower = poolMinPower;
        this.poolMaxPower = poolMaxPower;
        this.poolBuffersPerBucket = poolBuffersPerBucket;
    }

    public static BloomReaderConfig fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, BloomReaderConfig.class);
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }

    @Override
    public String toString() {
        return "BloomReaderConfig{"
            + "maxPageSize=" + maxPageSize
            + ", usePool=" + usePool
            + ", poolMinPower=" + poolMinPower
            + ", poolMaxPower=" + poolMaxPower
            + ", poolBuffersPerBucket=" + poolBuffersPerBucket
            + '}';
    }
}
