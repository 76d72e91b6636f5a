package com.blindfile.blindfileclient.transfer;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ThroughputMeterTest {

    private static final long SECOND = 1_000_000_000L;

    @Test
    void reportsZeroBeforeAnyBytes() {
        AtomicLong clock = new AtomicLong();
        ThroughputMeter meter = new ThroughputMeter(5 * SECOND, clock::get);
        clock.addAndGet(SECOND);
        assertEquals(0.0, meter.bytesPerSecond());
    }

    @Test
    void averagesOverElapsedTime() {
        AtomicLong clock = new AtomicLong();
        ThroughputMeter meter = new ThroughputMeter(5 * SECOND, clock::get);
        clock.addAndGet(SECOND);
        meter.record(1000);
        clock.addAndGet(SECOND);
        meter.record(1000);
        assertEquals(1000.0, meter.bytesPerSecond(), 0.001);
    }

    @Test
    void forgetsSamplesOutsideWindow() {
        AtomicLong clock = new AtomicLong();
        ThroughputMeter meter = new ThroughputMeter(2 * SECOND, clock::get);
        meter.record(10_000);
        clock.addAndGet(3 * SECOND);
        meter.record(400);
        assertEquals(200.0, meter.bytesPerSecond(), 0.001);
    }
}
