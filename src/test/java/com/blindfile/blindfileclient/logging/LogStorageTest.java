package com.blindfile.blindfileclient.logging;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogStorageTest {

    @Test
    void evictsOldestBeyondCapacity() {
        LogStorage storage = new LogStorage(3);
        for (int i = 1; i <= 5; i++) {
            storage.add(new LogEntry(LogLevel.INFO, "Test", "message " + i));
        }
        List<LogEntry> entries = storage.getAll();
        assertEquals(3, storage.size());
        assertEquals(2, storage.getEvictedCount());
        assertEquals("message 3", entries.get(0).getMessage());
        assertEquals("message 5", entries.get(2).getMessage());
    }

    @Test
    void filtersByLevelAndSource() {
        LogStorage storage = new LogStorage(10);
        storage.add(new LogEntry(LogLevel.DEBUG, "UploadScheduler", "admitted"));
        storage.add(new LogEntry(LogLevel.WARN, "UploadScheduler", "retrying"));
        storage.add(new LogEntry(LogLevel.ERROR, "ProxyBridge", "aborted"));

        assertEquals(2, storage.filterByLevel(LogLevel.WARN).size());
        assertEquals(2, storage.filterBySource("uploadscheduler").size());
        storage.clear();
        assertEquals(0, storage.size());
    }

    @Test
    void tailReturnsMostRecentInOrder() {
        LogStorage storage = new LogStorage(10);
        for (int i = 1; i <= 4; i++) {
            storage.add(new LogEntry(LogLevel.INFO, "Test", "m" + i));
        }
        List<LogEntry> tail = storage.tail(2);
        assertEquals("m3", tail.get(0).getMessage());
        assertEquals("m4", tail.get(1).getMessage());
        assertEquals(4, storage.tail(20).size());
    }

    @Test
    void sinceIncludesEntriesAtOrAfterInstant() {
        LogStorage storage = new LogStorage(10);
        Instant before = Instant.now();
        storage.add(new LogEntry(LogLevel.INFO, "Test", "after"));
        assertEquals(1, storage.since(before).size());
        assertTrue(storage.since(Instant.now().plusSeconds(60)).isEmpty());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new LogStorage(0));
    }

    @Test
    void formatsEntry() {
        String line = new LogEntry(LogLevel.WARN, "ChunkCipher", "bad tag").format();
        assertTrue(line.contains(" WARN  ["));
        assertTrue(line.endsWith("ChunkCipher: bad tag"));
    }
}
