package com.github.jnthnclt.os.bloom.core.api;

import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;

/**
 * The one error a cursor reports, tagged with where it was raised.
 */
public class CursorError {

    public enum Source {
        /** recorded by the cursor while loading headers or acquiring a page */
        CURSOR,
        /** raised by the page currently held while decoding */
        PAGE
    }

    public final Source source;
    public final BloomBlockException cause;

    public CursorError(Source source, BloomBlockException cause) {
        this.source = source;
        this.cause = cause;
    }

    @Override
    public String toString() {
        return "CursorError{" + "source=" + source + ", cause=" + cause + '}';
    }
}
