package com.github.jnthnclt.os.bloom.core.guts;

import com.github.jnthnclt.os.bloom.core.api.BloomOffset;
import com.github.jnthnclt.os.bloom.io.AppendableHeap;
import com.github.jnthnclt.os.bloom.io.IAppendOnly;
import com.github.jnthnclt.os.bloom.log.BloomLogger;
import com.github.jnthnclt.os.bloom.log.BloomLoggerFactory;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Lays blooms out as pages followed by the page headers.
 * <pre>
 * [int magic][byte version]
 * page:    [int length][bytes]... [int crc32c]
 * headers: [int pageCount][long offset, int length, int bloomCount]... [int crc32c]
 * [long headersOffset]
 * </pre>
 *
 * @author jonathan.colt
 */
public class BloomBlockWriter {

    private static final BloomLogger LOG = BloomLoggerFactory.getLogger();

    public static final int MAGIC = 0xB100F11E;
    public static final byte VERSION = 1;
    public static final int PREAMBLE_SIZE = 4 + 1;

    private final IAppendOnly appendOnly;
    private final int targetPageSize;
    private final AppendableHeap page;
    private final List<BloomPageHeader> headers = Lists.newArrayList();
    private int pageBlooms = 0;
    private boolean finished = false;

    public BloomBlockWriter(IAppendOnly appendOnly, int targetPageSize) throws IOException {
        Preconditions.checkArgument(targetPageSize > 0, "targetPageSize must be positive, was %s", targetPageSize);
        Preconditions.checkArgument(appendOnly.getFilePointer() == 0, "Expected an empty sink but it is at %s", appendOnly.getFilePointer());
        this.appendOnly = appendOnly;
        this.targetPageSize = targetPageSize;
        this.page = new AppendableHeap(Math.min(targetPageSize, 1024 * 1024));
        appendOnly.appendInt(MAGIC);
        appendOnly.appendByte(VERSION);
    }

    /**
     * A bloom that alone exceeds the target page size gets a page to itself.
     */
    public BloomOffset append(byte[] filter) throws IOException {
        Preconditions.checkState(!finished, "Writer is already finished.");
        long recordLength = 4L + filter.length;
        if (pageBlooms > 0 && page.length() + recordLength > targetPageSize) {
            flushPage();
        }
        BloomOffset offset = new BloomOffset(headers.size(), (int) page.length());
        page.appendInt(filter.length);
        page.append(filter, 0, filter.length);
        pageBlooms++;
        return offset;
    }

    private void flushPage() throws IOException {
        byte[] records = page.getBytes();
        long offset = appendOnly.getFilePointer();
        appendOnly.append(records, 0, records.length);
        appendOnly.appendInt(Hashing.crc32c().hashBytes(records).asInt());
        headers.add(new BloomPageHeader(offset, records.length, pageBlooms));
        page.reset();
        pageBlooms = 0;
    }

    /**
     * Flushes the open page and writes the headers. The sink is flushed but left open.
     */
    public List<BloomPageHeader> finish(boolean fsync) throws IOException {
        Preconditions.checkState(!finished, "Writer is already finished.");
        if (pageBlooms > 0) {
            flushPage();
        }
        long headersOffset = appendOnly.getFilePointer();
        AppendableHeap headerBytes = new AppendableHeap(4 + headers.size() * BloomPageHeader.SIZE_IN_BYTES);
        headerBytes.appendInt(headers.size());
        for (BloomPageHeader header : headers) {
            header.write(headerBytes);
        }
        byte[] encoded = headerBytes.getBytes();
        appendOnly.append(encoded, 0, encoded.length);
        appendOnly.appendInt(Hashing.crc32c().hashBytes(encoded).asInt());
        appendOnly.appendLong(headersOffset);
        appendOnly.flush(fsync);
        finished = true;
        LOG.debug("Wrote {} pages, block is {} bytes", headers.size(), appendOnly.length());
        return Collections.unmodifiableList(headers);
    }
}
