package com.github.jnthnclt.os.bloom.core.api;

import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;

public interface BloomQuerier {

    /**
     * Jumps straight to offset and decodes the bloom stored there.
     */
    Bloom seek(BloomOffset offset) throws BloomBlockException;
}
