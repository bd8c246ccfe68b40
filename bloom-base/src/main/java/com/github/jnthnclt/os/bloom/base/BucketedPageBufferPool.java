package com.github.jnthnclt.os.bloom.base;

import com.google.common.base.Preconditions;
import java.util.concurrent.atomic.LongAdder;

/**
 * Power of two size classes, each a bounded stack of free buffers. Buffers larger than the biggest
 * class are allocated on demand and dropped on recycle.
 *
 * @author jonathan.colt
 */
public class BucketedPageBufferPool implements PageBufferPool {

    static private final class BucketLock {
    }

    private final int minPower;
    private final int maxPower;
    private final byte[][][] buckets;
    private final int[] depths;
    private final BucketLock[] locks;

    public final LongAdder allocated = new LongAdder();
    public final LongAdder reused = new LongAdder();
    public final LongAdder recycled = new LongAdder();
    public final LongAdder dropped = new LongAdder();

    public BucketedPageBufferPool(int minPower, int maxPower, int buffersPerBucket) {
        Preconditions.checkArgument(minPower >= 0 && minPower <= maxPower && maxPower < 31,
            "invalid powers min:%s max:%s", minPower, maxPower);
        Preconditions.checkArgument(buffersPerBucket > 0, "buffersPerBucket must be positive, was %s", buffersPerBucket);
        this.minPower = minPower;
        this.maxPower = maxPower;
        int bucketCount = maxPower - minPower + 1;
        this.buckets = new byte[bucketCount][buffersPerBucket][];
        this.depths = new int[bucketCount];
        this.locks = new BucketLock[bucketCount];
        for (int i = 0; i < bucketCount; i++) {
            locks[i] = new BucketLock();
        }
    }

    @Override
    public byte[] acquire(int size) {
        Preconditions.checkArgument(size >= 0, "negative size %s", size);
        int bucket = bucketFor(size);
        if (bucket < 0) {
            allocated.increment();
            return new byte[size];
        }
        synchronized (locks[bucket]) {
            int depth = depths[bucket];
            if (depth > 0) {
                depths[bucket] = depth - 1;
                byte[] got = buckets[bucket][depth - 1];
                buckets[bucket][depth - 1] = null;
                reused.increment();
                return got;
            }
        }
        allocated.increment();
        return new byte[(int) UIO.chunkLength(bucket + minPower)];
    }

    @Override
    public void recycle(byte[] bytes) {
        if (bytes == null) {
            return;
        }
        int bucket = bucketFor(bytes.length);
        if (bucket < 0 || UIO.chunkLength(bucket + minPower) != bytes.length) {
            dropped.increment();
            return;
        }
        synchronized (locks[bucket]) {
            int depth = depths[bucket];
            if (depth < buckets[bucket].length) {
                buckets[bucket][depth] = bytes;
                depths[bucket] = depth + 1;
                recycled.increment();
                return;
            }
        }
        dropped.increment();
    }

    public int pooled(int size) {
        int bucket = bucketFor(size);
        if (bucket < 0) {
            return 0;
        }
        synchronized (locks[bucket]) {
            return depths[bucket];
        }
    }

    private int bucketFor(int size) {
        int power = UIO.chunkPower(size, minPower);
        if (power > maxPower) {
            return -1;
        }
        return Math.max(power, minPower) - minPower;
    }
}
