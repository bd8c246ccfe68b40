package com.github.jnthnclt.os.bloom.core.api.exceptions;

/**
 * The requested page is bigger than the reader is willing to decode. Unlike its siblings this is
 * recoverable: a later seek to another page may succeed.
 */
public class BloomPageTooLargeException extends BloomBlockException {

    public final int pageIndex;
    public final int pageSize;
    public final int maxPageSize;

    public BloomPageTooLargeException(int pageIndex, int pageSize, int maxPageSize) {
        super("Page " + pageIndex + " is " + pageSize + " bytes which exceeds the max page size of " + maxPageSize + " bytes.");
        this.pageIndex = pageIndex;
        this.pageSize = pageSize;
        this.maxPageSize = maxPageSize;
    }
}
