package com.github.jnthnclt.os.bloom.core.guts.api;

import com.github.jnthnclt.os.bloom.core.BloomStats;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomHeaderLoadException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomStreamAcquisitionException;
import com.github.jnthnclt.os.bloom.core.guts.BloomPageHeader;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;

/**
 * A stored bloom block split into independently decodable pages. Shared read only between cursors.
 *
 * @author jonathan.colt
 */
public interface BloomBlock {

    /**
     * Loads page metadata. Idempotent and safe to call from many cursors.
     */
    void loadHeaders() throws BloomHeaderLoadException;

    /**
     * Only meaningful once {@link #loadHeaders()} succeeded.
     */
    int pageCount();

    BloomPageHeader pageHeader(int pageIndex);

    IPointerReadable blooms() throws BloomStreamAcquisitionException;

    /**
     * @return a decoder positioned at the start of the page, which the caller now owns and must relinquish or forfeit
     */
    BloomPageDecoder pageDecoder(IPointerReadable readable, int pageIndex, int maxPageSize, BloomStats stats) throws BloomBlockException;
}
