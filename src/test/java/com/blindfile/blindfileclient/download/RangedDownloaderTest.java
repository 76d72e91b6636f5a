package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.transfer.CancellationSignal;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;
import com.blindfile.blindfileclient.transfer.TransferPlan;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RangedDownloaderTest {

    private static final int CHUNK = 500;

    @TempDir
    Path tempDir;

    private final TransferKey key = TransferKey.generate();

    @Test
    void fetchesOneRangePerFrame() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 4 + 123, 11);
        ByteArrayRemoteSource source = new ByteArrayRemoteSource(TestObjects.encryptObject(key, data, CHUNK), 97, 11);
        RangedDownloader downloader = new RangedDownloader(source, TransferPlan.of(data.length, CHUNK), key);
        List<DownloadProgress> updates = new ArrayList<>();
        downloader.setProgressCallback(updates::add);
        Path output = tempDir.resolve("out.bin");

        long written = downloader.download(output, new CancellationSignal());

        assertEquals(data.length, written);
        assertArrayEquals(data, Files.readAllBytes(output));
        assertEquals(5, source.getRangeRequests());
        assertEquals(100.0, updates.get(updates.size() - 1).getPercentage(), 0.001);
    }

    @Test
    void tamperedFrameDeletesPartialOutput() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 3, 12);
        byte[] object = TestObjects.encryptObject(key, data, CHUNK);
        object[2 * (CHUNK + 28) + 30] ^= 0x01;
        RangedDownloader downloader = new RangedDownloader(new ByteArrayRemoteSource(object, 1000, 12),
                TransferPlan.of(data.length, CHUNK), key);
        Path output = tempDir.resolve("tampered.bin");

        assertThrows(IOException.class, () -> downloader.download(output, new CancellationSignal()));
        assertFalse(Files.exists(output));
    }

    @Test
    void shortRangeIsProtocolViolation() throws IOException {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 2, 13);
        byte[] object = TestObjects.encryptObject(key, data, CHUNK);
        byte[] truncated = Arrays.copyOf(object, object.length - 10);
        RangedDownloader downloader = new RangedDownloader(new ByteArrayRemoteSource(truncated, 1000, 13),
                TransferPlan.of(data.length, CHUNK), key);
        Path output = tempDir.resolve("short.bin");

        assertThrows(ProtocolViolationException.class, () -> downloader.download(output, new CancellationSignal()));
        assertFalse(Files.exists(output));
    }

    @Test
    void cancellationDeletesPartialOutput() {
        byte[] data = TestObjects.randomPlaintext(CHUNK * 3, 14);
        RangedDownloader downloader = new RangedDownloader(
                new ByteArrayRemoteSource(TestObjects.encryptObject(key, data, CHUNK), 1000, 14),
                TransferPlan.of(data.length, CHUNK), key);
        CancellationSignal signal = new CancellationSignal();
        downloader.setProgressCallback(progress -> signal.cancel());
        Path output = tempDir.resolve("cancelled.bin");

        assertThrows(IOException.class, () -> downloader.download(output, signal));
        assertFalse(Files.exists(output));
    }
}
