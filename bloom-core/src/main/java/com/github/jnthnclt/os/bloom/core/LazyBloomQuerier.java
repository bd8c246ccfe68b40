package com.github.jnthnclt.os.bloom.core;

import com.github.jnthnclt.os.bloom.core.api.Bloom;
import com.github.jnthnclt.os.bloom.core.api.BloomOffset;
import com.github.jnthnclt.os.bloom.core.api.BloomQuerier;
import com.github.jnthnclt.os.bloom.core.api.CursorError;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;

/**
 * Turns a cursor's recorded errors into thrown ones for point lookups.
 */
public class LazyBloomQuerier implements BloomQuerier, AutoCloseable {

    private final LazyBloomCursor cursor;

    public LazyBloomQuerier(LazyBloomCursor cursor) {
        this.cursor = cursor;
    }

    @Override
    public Bloom seek(BloomOffset offset) throws BloomBlockException {
        cursor.seek(offset);
        CursorError error = cursor.err();
        if (error != null) {
            throw error.cause;
        }
        return cursor.at();
    }

    @Override
    public void close() {
        cursor.close();
    }
}
