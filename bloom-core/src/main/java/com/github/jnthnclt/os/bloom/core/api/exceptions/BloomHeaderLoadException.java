package com.github.jnthnclt.os.bloom.core.api.exceptions;

/**
 * Block headers are corrupt or unreadable.
 */
public class BloomHeaderLoadException extends BloomBlockException {

    public BloomHeaderLoadException(String message) {
        super(message);
    }

    public BloomHeaderLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
