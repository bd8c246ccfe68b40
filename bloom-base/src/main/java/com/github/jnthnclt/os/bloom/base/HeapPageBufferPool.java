package com.github.jnthnclt.os.bloom.base;

public class HeapPageBufferPool implements PageBufferPool {

    public static final HeapPageBufferPool INSTANCE = new HeapPageBufferPool();

    private HeapPageBufferPool() {
    }

    @Override
    public byte[] acquire(int size) {
        return new byte[size];
    }

    @Override
    public void recycle(byte[] bytes) {
    }
}
