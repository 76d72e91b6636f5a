package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.ChunkAuthenticationException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class DecryptingInputStreamTest {

    private static final int CHUNK = 64;

    private final TransferKey key = TransferKey.generate();

    @Test
    void readsAllPlaintext() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 5 + 9, 1);
        byte[] object = TestObjects.encryptObject(key, data, CHUNK);
        try (InputStream in = new DecryptingInputStream(
                new FrameCoalescer(ByteArrayRemoteSource.irregular(object, 50, 2), CHUNK, key))) {
            assertArrayEquals(data, in.readAllBytes());
        }
    }

    @Test
    void singleByteReadsMatch() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 2 + 3, 3);
        byte[] object = TestObjects.encryptObject(key, data, CHUNK);
        InputStream in = new DecryptingInputStream(new FrameCoalescer(new ByteArrayInputStream(object), CHUNK, key));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            out.write(b);
        }
        assertArrayEquals(data, out.toByteArray());
        assertEquals(-1, in.read());
    }

    @Test
    void tamperingSurfacesAsIOException() {
        byte[] object = TestObjects.encryptObject(key, TestObjects.randomPlaintext(CHUNK * 2, 4), CHUNK);
        object[object.length - 1] ^= 0x01;
        InputStream in = new DecryptingInputStream(new FrameCoalescer(new ByteArrayInputStream(object), CHUNK, key));

        IOException error = assertThrows(IOException.class, in::readAllBytes);
        assertInstanceOf(ChunkAuthenticationException.class, error.getCause());
    }
}
