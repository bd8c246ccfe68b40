package com.github.jnthnclt.os.bloom.core.api.exceptions;

/**
 * The block reader could not hand out a stream.
 */
public class BloomStreamAcquisitionException extends BloomBlockException {

    public BloomStreamAcquisitionException(String message) {
        super(message);
    }

    public BloomStreamAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
