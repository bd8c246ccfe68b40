package com.github.jnthnclt.os.bloom.core.guts.api;

import com.github.jnthnclt.os.bloom.core.api.Bloom;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageDecodeException;

/**
 * A cursor over one fully materialized page.
 *
 * @author jonathan.colt
 */
public interface BloomPageDecoder {

    int pageIndex();

    int bloomCount();

    /**
     * Moves to byteOffset, forward or backward, and decodes the bloom stored there. Failure is reported through {@link #err()}.
     */
    void seek(int byteOffset);

    /**
     * @return false at the end of the page or when decoding failed, {@link #err()} tells which
     */
    boolean next();

    /**
     * Valid only after a successful {@link #seek(int)} or {@link #next()}.
     */
    Bloom at();

    BloomPageDecodeException err();

    /**
     * Hands the page buffer back to its pool. Blooms read from this page must not be touched afterwards.
     */
    void relinquish();

    /**
     * Gives up the page without returning its buffer to the pool, blooms read from it stay valid.
     */
    void forfeit();
}
