/*
 * Copyright 2013 Jive Software, Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package com.github.jnthnclt.os.bloom.io;

import com.github.jnthnclt.os.bloom.base.UIO;
import com.google.common.math.IntMath;
import java.io.IOException;
import java.util.Arrays;

/**
 * In memory block sink. Unsynchronized.
 */
public class AppendableHeap implements IAppendOnly {

    private final byte[] scratch = new byte[8];
    private byte[] bytes;
    private int fp = 0;

    public AppendableHeap(int initialSize) {
        bytes = new byte[initialSize];
    }

    public byte[] getBytes() {
        return fp == bytes.length ? bytes : Arrays.copyOf(bytes, fp);
    }

    public void reset() {
        fp = 0;
    }

    @Override
    public void appendByte(byte b) throws IOException {
        ensure(1);
        bytes[fp] = b;
        fp++;
    }

    @Override
    public void appendInt(int i) throws IOException {
        append(UIO.intBytes(i, scratch, 0), 0, 4);
    }

    @Override
    public void appendLong(long l) throws IOException {
        append(UIO.longBytes(l, scratch, 0), 0, 8);
    }

    @Override
    public void append(byte _b[], int _offset, int _len) throws IOException {
        ensure(_len);
        System.arraycopy(_b, _offset, bytes, fp, _len);
        fp += _len;
    }

    @Override
    public long getFilePointer() throws IOException {
        return fp;
    }

    @Override
    public long length() throws IOException {
        return fp;
    }

    @Override
    public void close() throws IOException {
    }

    @Override
    public void flush(boolean fsync) throws IOException {
    }

    private void ensure(int amount) {
        if (fp + amount > bytes.length) {
            int grown = IntMath.checkedAdd(bytes.length, Math.max(amount, bytes.length));
            bytes = Arrays.copyOf(bytes, grown);
        }
    }

}
