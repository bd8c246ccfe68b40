package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.base.PageBufferPool;
import com.github.jnthnclt.os.bloom.base.PageLease;
import com.github.jnthnclt.os.bloom.base.UIO;
import com.github.jnthnclt.os.bloom.core.BloomStats;
import com.github.jnthnclt.os.bloom.core.api.BloomBlockReader;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomHeaderLoadException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageDecodeException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageTooLargeException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomStreamAcquisitionException;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomBlock;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomPageDecoder;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import com.github.jnthnclt.os.bloom.log.BloomLogger;
import com.github.jnthnclt.os.bloom.log.BloomLoggerFactory;
import com.google.common.collect.Lists;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * @author jonathan.colt
 */
public class PagedBloomBlock implements BloomBlock {

    private static final BloomLogger LOG = BloomLoggerFactory.getLogger();

    private final String name;
    private final BloomBlockReader reader;
    private final PageBufferPool pool;
    private final BloomStats stats;

    private volatile List<BloomPageHeader> pageHeaders; // loaded on first use
    private BloomHeaderLoadException loadFailure;

    public PagedBloomBlock(String name, BloomBlockReader reader, PageBufferPool pool, BloomStats stats) {
        this.name = name;
        this.reader = reader;
        this.pool = pool;
        this.stats = stats;
    }

    @Override
    public void loadHeaders() throws BloomHeaderLoadException {
        if (pageHeaders != null) {
            return;
        }
        synchronized (this) {
            if (pageHeaders != null) {
                return;
            }
            if (loadFailure != null) {
                throw loadFailure;
            }
            try {
                pageHeaders = readHeaders();
                stats.headerLoads.increment();
                LOG.debug("Loaded {} page headers for {}", pageHeaders.size(), name);
            } catch (BloomHeaderLoadException x) {
                loadFailure = x;
                LOG.warn("Failed to load headers for {}: {}", name, x.getMessage());
                throw x;
            }
        }
    }

    private List<BloomPageHeader> readHeaders() throws BloomHeaderLoadException {
        IPointerReadable readable;
        try {
            readable = reader.blooms();
        } catch (IOException x) {
            throw new BloomHeaderLoadException("Failed to open " + name + " for reading headers.", x);
        }

        try {
            long length = readable.length();
            if (length < BloomBlockWriter.PREAMBLE_SIZE + 4 + 4 + 8) {
                throw corrupted("is only " + length + " bytes long");
            }
            int magic = readable.readInt(0);
            if (magic != BloomBlockWriter.MAGIC) {
                throw corrupted("has magic " + Integer.toHexString(magic) + " expected " + Integer.toHexString(BloomBlockWriter.MAGIC));
            }
            int version = readable.read(4);
            if (version != BloomBlockWriter.VERSION) {
                throw corrupted("has unsupported version " + version);
            }

            long tail = length - 8;
            long headersOffset = readable.readLong(tail);
            if (headersOffset < BloomBlockWriter.PREAMBLE_SIZE || headersOffset + 4 + 4 > tail) {
                throw corrupted("has headers offset " + headersOffset + " out of bounds");
            }
            int pageCount = readable.readInt(headersOffset);
            long headersLength = 4 + (long) pageCount * BloomPageHeader.SIZE_IN_BYTES;
            if (pageCount < 0 || headersOffset + headersLength + 4 != tail) {
                throw corrupted("claims " + pageCount + " pages which does not fit");
            }

            byte[] encoded = new byte[(int) headersLength];
            readable.read(headersOffset, encoded, 0, encoded.length);
            int checksum = readable.readInt(headersOffset + headersLength);
            if (Hashing.crc32c().hashBytes(encoded).asInt() != checksum) {
                throw corrupted("failed header checksum");
            }

            List<BloomPageHeader> headers = Lists.newArrayListWithCapacity(pageCount);
            long fp = headersOffset + 4;
            for (int i = 0; i < pageCount; i++) {
                BloomPageHeader header = BloomPageHeader.read(readable, fp);
                fp += BloomPageHeader.SIZE_IN_BYTES;
                if (header.offset < BloomBlockWriter.PREAMBLE_SIZE || header.length < 0 || header.offset + header.length + 4 > headersOffset) {
                    throw corrupted("has page " + i + " outside the data region " + header);
                }
                headers.add(header);
            }
            return Collections.unmodifiableList(headers);
        } catch (IOException x) {
            throw new BloomHeaderLoadException("Failed to read headers of " + name + ".", x);
        }
    }

    private BloomHeaderLoadException corrupted(String what) {
        return new BloomHeaderLoadException("Header corruption! Block " + name + " " + what + ".");
    }

    private List<BloomPageHeader> headers() {
        List<BloomPageHeader> got = pageHeaders;
        if (got == null) {
            throw new IllegalStateException("Headers for " + name + " have not been loaded.");
        }
        return got;
    }

    @Override
    public int pageCount() {
        return headers().size();
    }

    @Override
    public BloomPageHeader pageHeader(int pageIndex) {
        return headers().get(pageIndex);
    }

    @Override
    public IPointerReadable blooms() throws BloomStreamAcquisitionException {
        try {
            return reader.blooms();
        } catch (IOException x) {
            throw new BloomStreamAcquisitionException("Failed to get blooms reader for " + name + ".", x);
        }
    }

    @Override
    public BloomPageDecoder pageDecoder(IPointerReadable readable,
        int pageIndex,
        int maxPageSize,
        BloomStats stats) throws BloomBlockException {

        List<BloomPageHeader> headers = headers();
        if (pageIndex < 0 || pageIndex >= headers.size()) {
            throw new BloomPageDecodeException("Invalid page " + pageIndex + " for block " + name + " with " + headers.size() + " pages.");
        }
        BloomPageHeader header = headers.get(pageIndex);
        if (header.length > maxPageSize) {
            stats.pagesTooLarge.increment();
            LOG.debug("Skipping page {} of {}, {} exceeds max {}", pageIndex, name, UIO.ram(header.length), UIO.ram(maxPageSize));
            throw new BloomPageTooLargeException(pageIndex, header.length, maxPageSize);
        }

        PageLease lease = PageLease.acquire(pool, header.length);
        boolean verified = false;
        try {
            byte[] page = lease.bytes();
            readable.read(header.offset, page, 0, header.length);
            int expected = readable.readInt(header.offset + header.length);
            int actual = Hashing.crc32c().hashBytes(page, 0, header.length).asInt();
            if (expected != actual) {
                stats.pageChecksumFailures.increment();
                LOG.warn("Checksum mismatch on page {} of {}", pageIndex, name);
                throw new BloomPageDecodeException("Page " + pageIndex + " of " + name + " failed its checksum.");
            }
            verified = true;
        } catch (IOException x) {
            throw new BloomPageDecodeException("Failed to read page " + pageIndex + " of " + name + ".", x);
        } finally {
            if (!verified) {
                lease.release();
            }
        }

        stats.pagesDecoded.increment();
        stats.pageBytesRead.add(header.length);
        LOG.inc("bloom>pages>decoded");
        return new LeasedBloomPageDecoder(pageIndex, header.bloomCount, lease, stats);
    }

    @Override
    public String toString() {
        return "PagedBloomBlock{" + "name=" + name + ", pages=" + (pageHeaders == null ? "unloaded" : pageHeaders.size()) + '}';
    }
}
