package com.github.jnthnclt.os.bloom.core;

import com.github.jnthnclt.os.bloom.base.BucketedPageBufferPool;
import com.github.jnthnclt.os.bloom.core.api.Bloom;
import com.github.jnthnclt.os.bloom.core.api.BloomOffset;
import com.github.jnthnclt.os.bloom.core.api.CursorError;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomBlockException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomHeaderLoadException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageDecodeException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomPageTooLargeException;
import com.github.jnthnclt.os.bloom.core.api.exceptions.BloomStreamAcquisitionException;
import com.github.jnthnclt.os.bloom.core.guts.BloomPageHeader;
import com.github.jnthnclt.os.bloom.core.guts.CursorState;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomBlock;
import com.github.jnthnclt.os.bloom.core.guts.api.BloomPageDecoder;
import com.github.jnthnclt.os.bloom.io.IPointerReadable;
import com.github.jnthnclt.os.bloom.io.PointerReadableBytes;
import com.google.common.collect.Lists;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.lang3.mutable.MutableInt;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 *
 * @author jonathan.colt
 */
public class LazyBloomCursorNGTest {

    @Test
    public void testLayout() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        Assert.assertEquals(fixtures.offsets, Arrays.asList(
            new BloomOffset(0, 0),
            new BloomOffset(0, 10),
            new BloomOffset(0, 20),
            new BloomOffset(1, 0),
            new BloomOffset(1, 15)));
    }

    @Test
    public void testSeekMatchesWrittenBlooms() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("seek", fixtures.reader()));

        for (int i = fixtures.offsets.size() - 1; i >= 0; i--) {
            cursor.seek(fixtures.offsets.get(i));
            Assert.assertNull(cursor.err(), "seek " + i);
            Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(i));
            Assert.assertEquals(cursor.at().sizeInBytes(), fixtures.filters.get(i).length);
        }
        for (int i = 0; i < fixtures.offsets.size(); i++) {
            cursor.seek(fixtures.offsets.get(i));
            Assert.assertNull(cursor.err());
            Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(i));
        }
        cursor.close();
    }

    @Test
    public void testScanInOrder() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("scan", fixtures.reader()));

        List<byte[]> scanned = Lists.newArrayList();
        while (cursor.next()) {
            scanned.add(cursor.at().copy());
        }
        Assert.assertNull(cursor.err());
        Assert.assertEquals(scanned.size(), fixtures.filters.size());
        for (int i = 0; i < scanned.size(); i++) {
            Assert.assertEquals(scanned.get(i), fixtures.filters.get(i));
        }

        Assert.assertFalse(cursor.next());
        Assert.assertNull(cursor.err());
        Assert.assertEquals(cursor.pageIndex(), 2);
        Assert.assertEquals(readers.stats().pagesDecoded.sum(), 2);
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 2);
    }

    @Test
    public void testNextContinuesAfterSeek() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("seekNext", fixtures.reader()));

        cursor.seek(new BloomOffset(0, 10));
        Assert.assertTrue(cursor.next());
        Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(2));
        Assert.assertTrue(cursor.next());
        Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(3));
        Assert.assertTrue(cursor.next());
        Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(4));
        Assert.assertFalse(cursor.next());
        Assert.assertNull(cursor.err());
    }

    @Test
    public void testEmptyBlock() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.write(30);
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("empty", fixtures.reader()));
        Assert.assertFalse(cursor.next());
        Assert.assertNull(cursor.err());
        Assert.assertEquals(cursor.state().status, CursorState.Status.READY);
    }

    @Test
    public void testPageTooLargeOnlyClearedBySeek() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.write(30, 6, 6, 6, 40, 6);
        Assert.assertEquals(fixtures.offsets.get(3), new BloomOffset(1, 0));
        Assert.assertEquals(fixtures.offsets.get(4), new BloomOffset(2, 0));

        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().setMaxPageSize(32).build());
        BloomBlock block = readers.open("tooLarge", fixtures.reader());

        LazyBloomCursor scan = readers.cursor(block);
        for (int i = 0; i < 3; i++) {
            Assert.assertTrue(scan.next());
            Assert.assertEquals(scan.at().copy(), fixtures.filters.get(i));
        }
        Assert.assertFalse(scan.next());
        CursorError error = scan.err();
        Assert.assertNotNull(error);
        Assert.assertTrue(error.cause instanceof BloomPageTooLargeException);
        BloomPageTooLargeException tooLarge = (BloomPageTooLargeException) error.cause;
        Assert.assertEquals(tooLarge.pageIndex, 1);
        Assert.assertEquals(tooLarge.pageSize, 44);
        Assert.assertEquals(tooLarge.maxPageSize, 32);
        Assert.assertEquals(scan.state().status, CursorState.Status.PAGE_TOO_LARGE);

        // next never clears it
        Assert.assertFalse(scan.next());
        Assert.assertSame(scan.err().cause, tooLarge);

        scan.seek(fixtures.offsets.get(4));
        Assert.assertNull(scan.err());
        Assert.assertEquals(scan.state().status, CursorState.Status.READY);
        Assert.assertEquals(scan.at().copy(), fixtures.filters.get(4));

        LazyBloomCursor seeker = readers.cursor(block);
        seeker.seek(fixtures.offsets.get(3));
        Assert.assertTrue(seeker.err().cause instanceof BloomPageTooLargeException);
        seeker.seek(fixtures.offsets.get(0));
        Assert.assertNull(seeker.err());
        Assert.assertEquals(seeker.at().copy(), fixtures.filters.get(0));

        Assert.assertEquals(readers.stats().pagesTooLarge.sum(), 2);
    }

    @Test
    public void testPageDecoderReusedWithinPage() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        CountingBloomBlock block = new CountingBloomBlock(readers.open("reuse", fixtures.reader()));
        LazyBloomCursor cursor = readers.cursor(block);

        cursor.seek(new BloomOffset(0, 0));
        cursor.seek(new BloomOffset(0, 20));
        cursor.seek(new BloomOffset(0, 10));
        Assert.assertEquals(block.pageDecoders.intValue(), 1);

        cursor.seek(new BloomOffset(1, 15));
        cursor.seek(new BloomOffset(1, 0));
        Assert.assertEquals(block.pageDecoders.intValue(), 2);

        cursor.seek(new BloomOffset(0, 0));
        Assert.assertEquals(block.pageDecoders.intValue(), 3);
        Assert.assertNull(cursor.err());

        LazyBloomCursor scan = readers.cursor(block);
        while (scan.next()) {
        }
        Assert.assertEquals(block.pageDecoders.intValue(), 5);
    }

    @Test
    public void testPooledBufferReusedAcrossPages() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BucketedPageBufferPool pool = new BucketedPageBufferPool(4, 10, 1);
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build(), pool);
        LazyBloomCursor cursor = readers.cursor(readers.open("pooled", fixtures.reader()));

        cursor.seek(fixtures.offsets.get(0));
        Bloom first = cursor.at();
        byte[] kept = first.copy();

        cursor.seek(fixtures.offsets.get(3));
        Bloom second = cursor.at();

        // both pages round up to 32 bytes so the second page lands in the first page's buffer
        Assert.assertSame(second.filter().bytes, first.filter().bytes);
        Assert.assertEquals(pool.reused.sum(), 1);
        Assert.assertEquals(second.copy(), fixtures.filters.get(3));
        Assert.assertEquals(second.get(0), fixtures.filters.get(3)[0]);
        Assert.assertEquals(second.filter().offset, 4);
        Assert.assertEquals(kept, fixtures.filters.get(0));

        cursor.close();
        Assert.assertEquals(pool.pooled(32), 1);
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 2);
    }

    @Test
    public void testUnpooledForfeitsPages() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BucketedPageBufferPool pool = new BucketedPageBufferPool(4, 10, 1);
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().setUsePool(false).build(), pool);
        LazyBloomCursor cursor = readers.cursor(readers.open("unpooled", fixtures.reader()));

        cursor.seek(fixtures.offsets.get(0));
        Bloom first = cursor.at();
        cursor.seek(fixtures.offsets.get(3));

        Assert.assertEquals(first.copy(), fixtures.filters.get(0));
        Assert.assertEquals(pool.pooled(32), 0);
        Assert.assertEquals(readers.stats().pagesForfeited.sum(), 1);
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 0);
    }

    @Test
    public void testHeaderCorruptionIsSticky() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("badMagic", fixtures.corruptedReader(0)));

        cursor.seek(fixtures.offsets.get(0));
        CursorError error = cursor.err();
        Assert.assertNotNull(error);
        Assert.assertEquals(error.source, CursorError.Source.CURSOR);
        Assert.assertTrue(error.cause instanceof BloomHeaderLoadException);
        Assert.assertTrue(error.cause.getMessage().startsWith("Header corruption!"), error.cause.getMessage());
        Assert.assertEquals(cursor.state().status, CursorState.Status.FAILED);

        Assert.assertFalse(cursor.next());
        cursor.seek(fixtures.offsets.get(1));
        Assert.assertSame(cursor.err().cause, error.cause);
        Assert.assertEquals(readers.stats().headerLoads.sum(), 0);
    }

    @Test
    public void testStreamAcquisitionFailure() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        MutableInt opened = new MutableInt();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("flaky", () -> {
            if (opened.getAndIncrement() == 0) {
                return new PointerReadableBytes(fixtures.block);
            }
            throw new IOException("gone");
        }));

        cursor.seek(fixtures.offsets.get(0));
        CursorError error = cursor.err();
        Assert.assertNotNull(error);
        Assert.assertEquals(error.source, CursorError.Source.CURSOR);
        Assert.assertTrue(error.cause instanceof BloomStreamAcquisitionException);
        Assert.assertTrue(error.cause.getCause() instanceof IOException);
        Assert.assertEquals(opened.intValue(), 2);

        // a failed cursor never touches the block again
        cursor.seek(fixtures.offsets.get(3));
        Assert.assertFalse(cursor.next());
        Assert.assertEquals(opened.intValue(), 2);
        Assert.assertSame(cursor.err().cause, error.cause);
    }

    @Test
    public void testChecksumFailureFailsCursor() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        BloomBlock block = readers.open("badPage", fixtures.corruptedReader(39 + 6));
        LazyBloomCursor cursor = readers.cursor(block);

        for (int i = 0; i < 3; i++) {
            Assert.assertTrue(cursor.next());
        }
        Assert.assertFalse(cursor.next());
        CursorError error = cursor.err();
        Assert.assertNotNull(error);
        Assert.assertTrue(error.cause instanceof BloomPageDecodeException);
        Assert.assertEquals(cursor.state().status, CursorState.Status.FAILED);
        Assert.assertEquals(readers.stats().pageChecksumFailures.sum(), 1);

        BloomPageHeader header = block.pageHeader(1);
        Assert.assertEquals(header.offset, 39);
        Assert.assertEquals(header.length, 24);
    }

    @Test
    public void testSeekIntoRecordIsPageLocal() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("midRecord", fixtures.reader()));

        cursor.seek(new BloomOffset(0, 5));
        CursorError error = cursor.err();
        Assert.assertNotNull(error);
        Assert.assertEquals(error.source, CursorError.Source.PAGE);
        Assert.assertTrue(error.cause instanceof BloomPageDecodeException);
        Assert.assertEquals(cursor.state().status, CursorState.Status.READY);

        cursor.seek(new BloomOffset(0, 10));
        Assert.assertNull(cursor.err());
        Assert.assertEquals(cursor.at().copy(), fixtures.filters.get(1));

        cursor.seek(new BloomOffset(0, 28));
        Assert.assertEquals(cursor.err().source, CursorError.Source.PAGE);

        Assert.assertFalse(cursor.next());
        Assert.assertEquals(cursor.err().source, CursorError.Source.PAGE);
        Assert.assertEquals(cursor.state().status, CursorState.Status.FAILED);

        cursor.seek(new BloomOffset(0, 0));
        Assert.assertEquals(cursor.state().status, CursorState.Status.FAILED);
    }

    @Test
    public void testSeekPastLastPage() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        LazyBloomCursor cursor = readers.cursor(readers.open("pastEnd", fixtures.reader()));

        cursor.seek(new BloomOffset(2, 0));
        Assert.assertEquals(cursor.err().source, CursorError.Source.CURSOR);
        Assert.assertTrue(cursor.err().cause instanceof BloomPageDecodeException);
        Assert.assertEquals(cursor.state().status, CursorState.Status.FAILED);
    }

    @Test
    public void testCloseRelinquishesHeldPage() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BucketedPageBufferPool pool = new BucketedPageBufferPool(4, 10, 4);
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build(), pool);
        LazyBloomCursor cursor = readers.cursor(readers.open("close", fixtures.reader()));

        cursor.seek(fixtures.offsets.get(1));
        Assert.assertEquals(pool.pooled(32), 0);
        cursor.close();
        Assert.assertEquals(pool.pooled(32), 1);
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 1);

        cursor.close();
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 1);
    }

    @Test
    public void testClosedCursorIsUnusable() throws Exception {
        BloomBlockFixtures fixtures = BloomBlockFixtures.twoPages();
        BloomReaders readers = new BloomReaders(new BloomReaderConfigBuilder().build());
        CountingBloomBlock block = new CountingBloomBlock(readers.open("closed", fixtures.reader()));
        LazyBloomCursor cursor = readers.cursor(block);

        Assert.assertTrue(cursor.next());
        Assert.assertTrue(cursor.next());
        cursor.close();

        Assert.assertFalse(cursor.next());
        Assert.assertFalse(cursor.next());
        cursor.seek(fixtures.offsets.get(3));
        Assert.assertFalse(cursor.next());

        Assert.assertEquals(block.pageDecoders.intValue(), 1);
        Assert.assertEquals(readers.stats().pagesDecoded.sum(), 1);
        Assert.assertEquals(readers.stats().pagesRelinquished.sum(), 1);
        Assert.assertNull(cursor.err());
    }

    private static class CountingBloomBlock implements BloomBlock {

        private final BloomBlock delegate;
        private final MutableInt pageDecoders = new MutableInt();

        CountingBloomBlock(BloomBlock delegate) {
            this.delegate = delegate;
        }

        @Override
        public void loadHeaders() throws BloomHeaderLoadException {
            delegate.loadHeaders();
        }

        @Override
        public int pageCount() {
            return delegate.pageCount();
        }

        @Override
        public BloomPageHeader pageHeader(int pageIndex) {
            return delegate.pageHeader(pageIndex);
        }

        @Override
        public IPointerReadable blooms() throws BloomStreamAcquisitionException {
            return delegate.blooms();
        }

        @Override
        public BloomPageDecoder pageDecoder(IPointerReadable readable,
            int pageIndex,
            int maxPageSize,
            BloomStats stats) throws BloomBlockException {
            pageDecoders.increment();
            return delegate.pageDecoder(readable, pageIndex, maxPageSize, stats);
        }
    }
}
