package com.github.jnthnclt.os.bloom.core.api.exceptions;

/**
 * A page failed to decode.
 */
public class BloomPageDecodeException extends BloomBlockException {

    public BloomPageDecodeException(String message) {
        super(message);
    }

    public BloomPageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
