package com.github.jnthnclt.os.bloom.core.api.exceptions;

/**
 * Root of everything that can go wrong reading a bloom block.
 *
 * @author jonathan.colt
 */
public class BloomBlockException extends Exception {

    public BloomBlockException(String message) {
        super(message);
    }

    public BloomBlockException(String message, Throwable cause) {
        super(message, cause);
    }
}
