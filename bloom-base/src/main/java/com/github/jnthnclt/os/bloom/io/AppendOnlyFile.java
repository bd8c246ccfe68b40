package com.github.jnthnclt.os.bloom.io;

import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * @author jonathan.colt
 */
public class AppendOnlyFile {

    private final File file;
    private final FileOutputStream fileOutputStream;
    private final AtomicLong size;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AppendOnlyFile(File file) throws IOException {
        this.file = file;
        this.size = new AtomicLong(file.length());
        this.fileOutputStream = new FileOutputStream(file, true);
    }

    public File getFile() {
        return file;
    }

    public IAppendOnly appender() throws IOException {
        if (closed.get()) {
            throw new IOException("Cannot get an appender from " + file + " because it is already closed.");
        }
        DataOutputStream writer = new DataOutputStream(fileOutputStream);
        return new IAppendOnly() {
            @Override
            public void appendByte(byte b) throws IOException {
                writer.writeByte(b);
                size.addAndGet(1);
            }

            @Override
            public void appendInt(int i) throws IOException {
                writer.writeInt(i);
                size.addAndGet(4);
            }

            @Override
            public void appendLong(long l) throws IOException {
                writer.writeLong(l);
                size.addAndGet(8);
            }

            @Override
            public void append(byte[] b, int _offset, int _len) throws IOException {
                writer.write(b, _offset, _len);
                size.addAndGet(_len);
            }

            @Override
            public void flush(boolean fsync) throws IOException {
                writer.flush();
                if (fsync) {
                    fileOutputStream.getFD().sync();
                }
            }

            @Override
            public void close() throws IOException {
                writer.flush();
                AppendOnlyFile.this.close();
            }

            @Override
            public long length() throws IOException {
                return size.get();
            }

            @Override
            public long getFilePointer() throws IOException {
                return length();
            }
        };
    }

    public void close() throws IOException {
        synchronized (closed) {
            if (closed.compareAndSet(false, true)) {
                fileOutputStream.close();
            }
        }
    }

    public long length() {
        return size.get();
    }

    @Override
    public String toString() {
        return "AppendOnlyFile{"
            + "file=" + file
            + ", size=" + size.get()
            + ", closed=" + closed.get()
            + '}';
    }
}
