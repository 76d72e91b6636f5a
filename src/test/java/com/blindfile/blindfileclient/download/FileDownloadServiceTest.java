package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.storage.HttpMultipartTransferClient;
import com.blindfile.blindfileclient.storage.StubApiServer;
import com.blindfile.blindfileclient.transfer.CancellationSignal;
import com.blindfile.blindfileclient.transfer.FileUploadService;
import com.blindfile.blindfileclient.transfer.MetadataCipher;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;
import com.blindfile.blindfileclient.transfer.ShareLink;
import com.blindfile.blindfileclient.transfer.UploadOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileDownloadServiceTest {

    private static final int PART_SIZE = 4096;

    @TempDir
    Path tempDir;

    private StubApiServer server;
    private HttpMultipartTransferClient client;
    private FileDownloadService service;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubApiServer(PART_SIZE);
        HttpClient httpClient = HttpClient.newHttpClient();
        client = new HttpMultipartTransferClient(server.apiBaseUrl(), httpClient);
        service = new FileDownloadService(client, httpClient);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private ShareLink upload(Path file) throws IOException {
        FileUploadService uploader = new FileUploadService(client, "https://blindfile.test", 3, 3, 1);
        UploadOutcome outcome = uploader.upload(file, null);
        assertTrue(outcome.isCompleted());
        return outcome.getShareLink();
    }

    @Test
    void uploadThenRangedFetchRestoresFile() throws IOException {
        Path source = tempDir.resolve("report.csv");
        Files.write(source, TestObjects.randomPlaintext(PART_SIZE * 5 + 777, 21));
        ShareLink link = upload(source);
        Path downloads = Files.createDirectory(tempDir.resolve("downloads"));

        Path saved = service.fetch(link, downloads, new CancellationSignal(), null);

        assertEquals(downloads.resolve("report.csv"), saved);
        assertArrayEquals(Files.readAllBytes(source), Files.readAllBytes(saved));
    }

    @Test
    void plaintextStreamMatchesUpload() throws IOException {
        Path source = tempDir.resolve("log.txt");
        Files.write(source, TestObjects.randomPlaintext(PART_SIZE * 3 + 5, 22));
        ShareLink link = upload(source);

        try (InputStream plaintext = service.openPlaintext(link)) {
            assertArrayEquals(Files.readAllBytes(source), plaintext.readAllBytes());
        }
    }

    @Test
    void resolveDecryptsMetadata() throws IOException {
        Path source = tempDir.resolve("notes.txt");
        Files.writeString(source, "hello");
        ShareLink link = upload(source);

        ResolvedDownload resolved = service.resolve(link);

        assertEquals("notes.txt", resolved.getFileName());
        assertEquals(5, resolved.getFileSize());
        assertEquals(PART_SIZE, resolved.getPlainChunkSize());
        assertTrue(resolved.getRemoteAddress().endsWith("/download/" + link.getFileId() + "/file"));
    }

    @Test
    void wrongKeyIsRejectedBeforeDownloading() throws IOException {
        Path source = tempDir.resolve("notes.txt");
        Files.writeString(source, "hello");
        ShareLink link = upload(source);
        ShareLink forged = ShareLink.of(link.getOrigin(), link.getFileId(), TransferKey.generate());

        assertThrows(ProtocolViolationException.class, () -> service.resolve(forged));
    }

    @Test
    void missingPartSizeIsProtocolViolation() {
        TransferKey key = TransferKey.generate();
        String metadata = MetadataCipher.encrypt(new MetadataCipher.FileDescriptor("a.bin", "x/y"), key);
        server.omitPartSize();
        server.store("legacy", new byte[64], 36, metadata);

        assertThrows(ProtocolViolationException.class,
                () -> service.resolve(ShareLink.of("https://blindfile.test", "legacy", key)));
    }

    @Test
    void safeFileNameStripsPathCharacters() {
        assertEquals(".._etc_passwd", FileDownloadService.safeFileName("../etc/passwd"));
        assertEquals("download.bin", FileDownloadService.safeFileName(".."));
        assertEquals("download.bin", FileDownloadService.safeFileName(null));
        assertEquals("a_b.txt", FileDownloadService.safeFileName("a:b.txt"));
    }
}
