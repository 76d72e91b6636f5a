package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.download.FrameCoalescer;
import com.blindfile.blindfileclient.storage.ContentMeta;
import com.blindfile.blindfileclient.storage.MultipartSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileUploadServiceTest {

    private static final int MB = 1024 * 1024;
    private static final String ORIGIN = "https://blindfile.test";

    @TempDir
    Path tempDir;

    private Path writeRandomFile(String name, int size) throws IOException {
        byte[] data = new byte[size];
        new Random(size).nextBytes(data);
        Path file = tempDir.resolve(name);
        Files.write(file, data);
        return file;
    }

    @Test
    void uploadsTwentyFiveMegabytesInThreeTenMegabyteParts() throws IOException {
        Path file = writeRandomFile("holiday.mov", 25 * MB);
        InMemoryTransferClient client = new InMemoryTransferClient(10 * MB);
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        UploadOutcome outcome = service.upload(file, null);

        assertTrue(outcome.isCompleted());
        assertEquals(3, outcome.getPartsCompleted());
        assertEquals(10 * MB + 28, client.frame(1).length);
        assertEquals(10 * MB + 28, client.frame(2).length);
        assertEquals(5 * MB + 28, client.frame(3).length);
        assertEquals(3, client.finalizedParts().size());

        ShareLink link = ShareLink.parse(outcome.getShareLink().format());
        assertEquals("file-1", link.getFileId());
        assertTrue(outcome.getShareLink().format().startsWith(ORIGIN + "/download/file-1#"));

        byte[] stored = client.storedObject();
        assertEquals(25L * MB + 3 * 28, stored.length);
        ByteArrayOutputStream plaintext = new ByteArrayOutputStream();
        try (FrameCoalescer coalescer = new FrameCoalescer(new ByteArrayInputStream(stored), 10 * MB, link.key())) {
            byte[] chunk;
            while ((chunk = coalescer.next()) != null) {
                plaintext.writeBytes(chunk);
            }
        }
        assertArrayEquals(Files.readAllBytes(file), plaintext.toByteArray());
    }

    @Test
    void realNameTravelsOnlyInsideEncryptedMetadata() throws IOException {
        Path file = writeRandomFile("secret-plans.pdf", 2000);
        InMemoryTransferClient client = new InMemoryTransferClient(1024);
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        UploadOutcome outcome = service.upload(file, null);

        ContentMeta meta = client.beganWith();
        assertEquals(ContentMeta.PLACEHOLDER_NAME, meta.getFileName());
        assertEquals(ContentMeta.OCTET_STREAM, meta.getContentType());
        assertFalse(meta.getEncryptedMetadata().contains("secret-plans"));

        TransferKey key = outcome.getShareLink().key();
        assertEquals("secret-plans.pdf", MetadataCipher.decrypt(meta.getEncryptedMetadata(), key).getName());
    }

    @Test
    void partCountMismatchFailsBeforeAnyPartMoves() throws IOException {
        Path file = writeRandomFile("data.bin", 3000);
        InMemoryTransferClient client = new InMemoryTransferClient(1024);
        client.reportTotalParts(5);
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        assertThrows(ProtocolViolationException.class, () -> service.upload(file, null));
        assertEquals(0, client.attemptsFor(1));
        assertEquals(1, client.abortCount());
    }

    @Test
    void missingPartSizeIsProtocolViolation() {
        MultipartSession remote = new MultipartSession("s", "r", 0, 1, null);
        assertThrows(ProtocolViolationException.class, () -> FileUploadService.validatePlan(remote, 100));
    }

    @Test
    void emptyFileIsRejected() throws IOException {
        Path file = tempDir.resolve("empty.txt");
        Files.createFile(file);
        InMemoryTransferClient client = new InMemoryTransferClient(1024);
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        assertThrows(TransferException.class, () -> service.upload(file, null));
        assertNull(client.beganWith());
    }

    @Test
    void resumeIsUnsupported() {
        FileUploadService service = new FileUploadService(new InMemoryTransferClient(1024), ORIGIN, 3, 3, 1);
        TransferException error = assertThrows(TransferException.class, () -> service.resume("session-1"));
        assertTrue(error.getMessage().contains("not supported"));
    }

    @Test
    void sourceVanishingAfterBeginAbortsRemoteSession() throws IOException {
        Path file = writeRandomFile("gone.bin", 3000);
        InMemoryTransferClient client = new InMemoryTransferClient(1024);
        client.afterBegin(() -> {
            try {
                Files.delete(file);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        assertThrows(NoSuchFileException.class, () -> service.upload(file, null));
        assertEquals(1, client.abortCount());
        assertEquals(0, client.attemptsFor(1));
    }

    @Test
    void unexpectedRuntimeFailureAbortsRemoteSession() throws IOException {
        Path file = writeRandomFile("callback.bin", 3000);
        InMemoryTransferClient client = new InMemoryTransferClient(1024);
        FileUploadService service = new FileUploadService(client, ORIGIN, 3, 3, 1);

        assertThrows(IllegalStateException.class, () -> service.upload(file, progress -> {
            if (progress.getState() == UploadProgress.UploadState.UPLOADING) {
                throw new IllegalStateException("progress sink broke");
            }
        }));
        assertEquals(1, client.abortCount());
    }
}
