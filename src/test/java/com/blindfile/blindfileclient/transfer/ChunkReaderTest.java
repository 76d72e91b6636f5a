package com.blindfile.blindfileclient.transfer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void emptyInputEndsImmediately() throws IOException {
        ChunkReader reader = new ChunkReader(new ByteArrayInputStream(new byte[0]), 16);
        assertNull(reader.next());
        assertEquals(0, reader.position());
    }

    @Test
    void slicesIntoFullChunksAndRemainder() throws IOException {
        byte[] data = new byte[50];
        new Random(1).nextBytes(data);
        ChunkReader reader = new ChunkReader(new ByteArrayInputStream(data), 16);

        for (int part = 1; part <= 3; part++) {
            ChunkReader.Chunk chunk = reader.next();
            assertEquals(part, chunk.getPartNumber());
            assertEquals(16, chunk.length());
            assertFalse(chunk.isLast());
            assertArrayEquals(Arrays.copyOfRange(data, (part - 1) * 16, part * 16), chunk.getData());
        }
        ChunkReader.Chunk last = reader.next();
        assertEquals(2, last.length());
        assertTrue(last.isLast());
        assertEquals(50, reader.position());
        assertNull(reader.next());
    }

    @Test
    void exactMultipleFlagsLastFullChunk() throws IOException {
        ChunkReader reader = new ChunkReader(new ByteArrayInputStream(new byte[32]), 16);
        assertFalse(reader.next().isLast());
        ChunkReader.Chunk second = reader.next();
        assertEquals(16, second.length());
        assertTrue(second.isLast());
        assertNull(reader.next());
    }

    @Test
    void fillsChunksFromShortReads() throws IOException {
        byte[] data = new byte[40];
        new Random(2).nextBytes(data);
        InputStream trickle = new FilterInputStream(new ByteArrayInputStream(data)) {
            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                return super.read(b, off, Math.min(len, 3));
            }
        };
        ChunkReader reader = new ChunkReader(trickle, 16);

        assertEquals(16, reader.next().length());
        assertEquals(16, reader.next().length());
        assertEquals(8, reader.next().length());
    }

    @Test
    void opensFiles() throws IOException {
        Path file = tempDir.resolve("input.bin");
        Files.write(file, new byte[100]);
        try (ChunkReader reader = ChunkReader.open(file, 64)) {
            assertEquals(64, reader.next().length());
            assertEquals(36, reader.next().length());
            assertNull(reader.next());
        }
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkReader(new ByteArrayInputStream(new byte[1]), 0));
    }
}
