/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 02:54
File: ThroughputMeter.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Bytes-per-second over a sliding window. Advisory only.
 */
public final class ThroughputMeter {

    private static final long DEFAULT_WINDOW_NANOS = 5_000_000_000L;

    private final long windowNanos;
    private final LongSupplier nanoClock;
    private final Deque<long[]> samples;
    private final long startedAt;
    private long bytesInWindow;

    public ThroughputMeter() {
        this(DEFAULT_WINDOW_NANOS, System::nanoTime);
    }

    public ThroughputMeter(long windowNanos, LongSupplier nanoClock) {
        this.windowNanos = windowNanos;
        this.nanoClock = nanoClock;
        this.samples = new ArrayDeque<>();
        this.startedAt = nanoClock.getAsLong();
        this.bytesInWindow = 0;
    }

    public synchronized void record(long bytes) {
        long now = nanoClock.getAsLong();
        samples.addLast(new long[]{now, bytes});
        bytesInWindow += bytes;
        evict(now);
    }

    public synchronized double bytesPerSecond() {
        long now = nanoClock.getAsLong();
        evict(now);
        long span = Math.min(windowNanos, now - startedAt);
        if (span <= 0 || bytesInWindow == 0) {
            return 0;
        }
        return bytesInWindow * 1_000_000_000.0 / span;
    }

    private void evict(long now) {
        while (!samples.isEmpty() && now - samples.peekFirst()[0] > windowNanos) {
            bytesInWindow -= samples.pollFirst()[1];
        }
    }
}
