package com.github.jnthnclt.os.bloom.core.api;

import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import java.io.IOException;

/**
 * Hands out readable views of a block's bytes. Each call may open a new handle.
 */
@FunctionalInterface
public interface BloomBlockReader {

    IPointerReadable blooms() throws IOException;
}
