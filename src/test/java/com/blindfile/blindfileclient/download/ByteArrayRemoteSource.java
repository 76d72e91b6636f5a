package com.blindfile.blindfileclient.download;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Ciphertext object held in memory whose streams deliver reads in irregular sizes.
 */
public final class ByteArrayRemoteSource implements RemoteSource {

    private final byte[] object;
    private final int maxRead;
    private final long seed;
    private final AtomicInteger rangeRequests = new AtomicInteger();

    public ByteArrayRemoteSource(byte[] object, int maxRead, long seed) {
        this.object = object;
        this.maxRead = maxRead;
        this.seed = seed;
    }

    public static InputStream irregular(byte[] data, int maxRead, long seed) {
        Random random = new Random(seed);
        return new FilterInputStream(new ByteArrayInputStream(data)) {
            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                int limit = maxRead <= 1 ? 1 : 1 + random.nextInt(maxRead);
                return super.read(b, off, Math.min(len, limit));
            }
        };
    }

    @Override
    public InputStream open() {
        return irregular(object, maxRead, seed);
    }

    @Override
    public InputStream openRange(long start, long endInclusive) {
        rangeRequests.incrementAndGet();
        int from = (int) Math.min(start, object.length);
        int to = (int) Math.min(endInclusive + 1, object.length);
        return irregular(Arrays.copyOfRange(object, from, to), maxRead, seed);
    }

    public int getRangeRequests() {
        return rangeRequests.get();
    }
}
