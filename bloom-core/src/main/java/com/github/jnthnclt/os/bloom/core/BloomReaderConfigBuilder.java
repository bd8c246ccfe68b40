package com.github.jnthnclt.os.bloom.core;

import com.github.jnthnclt.os.bloom.core.api.BloomReaderConfig;

public class BloomReaderConfigBuilder {

    public int maxPageSize = 64 * 1024 * 1024;
    public boolean usePool = true;
    public int poolMinPower = 10;
    public int poolMaxPower = 26;
    public int poolBuffersPerBucket = 8;

    public BloomReaderConfig build() {
        return new BloomReaderConfig(maxPageSize,
            usePool,
            poolMinPower,
            poolMaxPower,
            poolBuffersPerBucket);
    }

    public BloomReaderConfigBuilder setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
        return this;
    }

    public BloomReaderConfigBuilder setUsePool(boolean usePool) {
        this.usePool = usePool;
        return this;
    }
}
