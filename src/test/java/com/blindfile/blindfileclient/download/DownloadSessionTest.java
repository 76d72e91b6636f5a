package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.storage.DownloadInfo;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadSessionTest {

    private static final int CHUNK = 256;

    private final TransferKey key = TransferKey.generate();

    private DownloadInfo info(int partSize, long fileSize) {
        return new DownloadInfo("f1", "encrypted-payload.bin", fileSize, "application/octet-stream",
                null, partSize, null);
    }

    @Test
    void yieldsWholePlaintextChunkByChunk() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 6 + 100, 7);
        RemoteSource source = new ByteArrayRemoteSource(TestObjects.encryptObject(key, data, CHUNK), 333, 7);

        try (DownloadSession session = DownloadSession.forObject(info(CHUNK, data.length), source, key)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] chunk;
            while ((chunk = session.nextChunk()) != null) {
                assertTrue(chunk.length <= CHUNK);
                out.writeBytes(chunk);
            }
            assertArrayEquals(data, out.toByteArray());
            assertEquals(data.length, session.getPlaintextBytes());
        }
    }

    @Test
    void plaintextStreamView() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK + 1, 8);
        RemoteSource source = new ByteArrayRemoteSource(TestObjects.encryptObject(key, data, CHUNK), 10, 8);

        try (DownloadSession session = new DownloadSession(source, CHUNK, key);
             InputStream in = session.openPlaintext()) {
            assertArrayEquals(data, in.readAllBytes());
            assertThrows(IllegalStateException.class, session::openPlaintext);
        }
    }

    @Test
    void missingPartSizeIsProtocolViolation() {
        RemoteSource source = new ByteArrayRemoteSource(new byte[0], 1, 0);
        assertThrows(ProtocolViolationException.class, () -> DownloadSession.forObject(info(0, 10), source, key));
    }
}
