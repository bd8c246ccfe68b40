/*
 * UIO.java
 *
 * Created on 03-12-2010 11:24:38 PM
 *
 * Copyright 2010 Jonathan Colt
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.jnthnclt.os.bloom.base;

import java.text.DecimalFormat;

/**
 * Big-endian helpers shared by the block writer, the block readers and the page decoder.
 */
public class UIO {

    static final DecimalFormat df = new DecimalFormat("0.0");

    private UIO() {
    }

    public static String ram(long _bytes) {
        if (_bytes < 1024) {
            return _bytes + "b";
        }
        if (_bytes < 1024 * 1024) {
            return df.format(_bytes / 1024d) + "kb";
        }
        if (_bytes < 1024L * 1024 * 1024) {
            return df.format(_bytes / (1024d * 1024)) + "mb";
        }
        return df.format(_bytes / (1024d * 1024 * 1024)) + "gb";
    }

    public static byte[] intBytes(int v) {
        return intBytes(v, new byte[4], 0);
    }

    public static byte[] intBytes(int v, byte[] _bytes, int _offset) {
        _bytes[_offset] = (byte) (v >>> 24);
        _bytes[_offset + 1] = (byte) (v >>> 16);
        _bytes[_offset + 2] = (byte) (v >>> 8);
        _bytes[_offset + 3] = (byte) v;
        return _bytes;
    }

    public static int bytesInt(byte[] _bytes) {
        return bytesInt(_bytes, 0);
    }

    public static int bytesInt(byte[] bytes, int offset) {
        int v = 0;
        v |= (bytes[offset] & 0xFF);
        v <<= 8;
        v |= (bytes[offset + 1] & 0xFF);
        v <<= 8;
        v |= (bytes[offset + 2] & 0xFF);
        v <<= 8;
        v |= (bytes[offset + 3] & 0xFF);
        return v;
    }

    public static byte[] longBytes(long _v) {
        return longBytes(_v, new byte[8], 0);
    }

    public static byte[] longBytes(long v, byte[] _bytes, int _offset) {
        for (int i = 7; i >= 0; i--) {
            _bytes[_offset + i] = (byte) v;
            v >>>= 8;
        }
        return _bytes;
    }

    public static long bytesLong(byte[] _bytes) {
        return bytesLong(_bytes, 0);
    }

    public static long bytesLong(byte[] bytes, int _offset) {
        long v = 0;
        for (int i = 0; i < 8; i++) {
            v <<= 8;
            v |= (bytes[_offset + i] & 0xFF);
        }
        return v;
    }

    /**
     * Smallest power of two that holds length, but never less than _minPower.
     */
    public static int chunkPower(long length, int _minPower) {
        if (length == 0) {
            return 0;
        }
        int numberOfLeadingZeros = Long.numberOfLeadingZeros(length - 1);
        return Math.max(_minPower, 64 - numberOfLeadingZeros);
    }

    public static long chunkLength(int _chunkPower) {
        return 1L << _chunkPower;
    }
}
