package com.github.jnthnclt.os.bloom.io;

import com.github.jnthnclt.os.bloom.base.UIO;
import com.google.common.io.Files;
import java.io.File;
import org.testng.Assert;
import org.testng.annotations.Test;

/**
 *
 * @author jonathan.colt
 */
public class PointerReadableByteBufferFileNGTest {

    @Test
    public void test() throws Exception {
        File file = new File(Files.createTempDir(), "pointerReadableByteBuffer.bin");

        AppendOnlyFile appendOnlyFile = new AppendOnlyFile(file);
        IAppendOnly appendOnly = appendOnlyFile.appender();

        for (int i = 0; i < 1_000; i++) {
            appendOnly.appendLong(i);
        }
        appendOnly.flush(true);
        Assert.assertEquals(appendOnly.getFilePointer(), 8_000);
        appendOnly.close();

        // 33 rounds up to 64 byte segments so most reads straddle segments
        PointerReadableByteBufferFile pointerReadable = new PointerReadableByteBufferFile(33, file);
        Assert.assertEquals(pointerReadable.length(), 8_000);

        for (int i = 0; i < 1_000; i++) {
            Assert.assertEquals(pointerReadable.readLong(i * 8L), i);
        }

        for (int i = 0; i < 1_000; i++) {
            Assert.assertEquals(pointerReadable.readInt(i * 8L), 0);
            Assert.assertEquals(pointerReadable.readInt(i * 8L + 4), i);
        }

        byte[] readBytes = new byte[8 * 4];
        for (int i = 0; i < 1_000 - 4; i++) {
            pointerReadable.read(i * 8L, readBytes, 0, readBytes.length);
            Assert.assertEquals(UIO.bytesLong(readBytes, 0), i);
            Assert.assertEquals(UIO.bytesLong(readBytes, 24), i + 3);
        }

        byte[] expected = UIO.longBytes(999);
        for (int j = 0; j < 8; j++) {
            Assert.assertEquals((byte) pointerReadable.read(999 * 8L + j), expected[j]);
        }
        Assert.assertEquals(pointerReadable.read(8_000), -1);
    }

    @Test(expectedExceptions = java.io.EOFException.class)
    public void testReadPastEnd() throws Exception {
        File file = new File(Files.createTempDir(), "short.bin");
        AppendOnlyFile appendOnlyFile = new AppendOnlyFile(file);
        IAppendOnly appendOnly = appendOnlyFile.appender();
        appendOnly.appendInt(1);
        appendOnly.close();

        new PointerReadableByteBufferFile(64, file).readLong(0);
    }
}
