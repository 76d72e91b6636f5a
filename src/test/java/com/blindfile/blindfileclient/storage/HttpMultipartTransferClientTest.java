package com.blindfile.blindfileclient.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpMultipartTransferClientTest {

    private StubApiServer server;
    private HttpMultipartTransferClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubApiServer(100);
        client = new HttpMultipartTransferClient(server.apiBaseUrl());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void beginReturnsServicePlan() {
        MultipartSession session = client.begin(250, ContentMeta.opaque("enc-meta"));

        assertEquals("file-1", session.getSessionId());
        assertEquals("r2-file-1", session.getRemoteUploadId());
        assertEquals(100, session.getPlainChunkSize());
        assertEquals(3, session.getTotalParts());
        assertEquals("2026-10-19T00:00:00Z", session.getExpiresAt());
    }

    @Test
    void uploadsPartsAndFinalizesInOrder() {
        MultipartSession session = client.begin(150, ContentMeta.opaque("enc-meta"));
        byte[] first = new byte[128];
        byte[] second = new byte[78];
        first[0] = 1;
        second[0] = 2;

        String etag2 = client.uploadPart(session.getSessionId(), 2, second);
        String etag1 = client.uploadPart(session.getSessionId(), 1, first);
        ObjectHandle handle = client.finalizeUpload(session.getSessionId(),
                List.of(new CompletedPart(1, etag1), new CompletedPart(2, etag2)));

        assertEquals("\"etag-1\"", etag1);
        assertEquals("file-1", handle.getId());
        assertEquals("/download/file-1", handle.getDownloadUrl());
        byte[] object = server.object("file-1");
        assertEquals(206, object.length);
        assertEquals(1, object[0]);
        assertEquals(2, object[128]);
    }

    @Test
    void serverErrorsAreTransient() {
        MultipartSession session = client.begin(100, ContentMeta.opaque("enc-meta"));
        server.failNextParts(1, 503);

        StorageException error = assertThrows(StorageException.class,
                () -> client.uploadPart(session.getSessionId(), 1, new byte[128]));
        assertEquals(503, error.getStatusCode());
        assertTrue(error.isTransient());
        assertTrue(error.getMessage().contains("Injected failure"));
    }

    @Test
    void clientErrorsAreNotTransient() {
        StorageException error = assertThrows(StorageException.class,
                () -> client.begin(0, ContentMeta.opaque("enc-meta")));
        assertEquals(400, error.getStatusCode());
        assertFalse(error.isTransient());
    }

    @Test
    void abortMarksSessionAndNeverThrows() {
        MultipartSession session = client.begin(100, ContentMeta.opaque("enc-meta"));
        client.abort(session.getSessionId());
        assertTrue(server.isAborted(session.getSessionId()));

        assertDoesNotThrow(() -> client.abort("no-such-session"));
    }

    @Test
    void unreachableServiceIsTransient() {
        server.close();
        StorageException error = assertThrows(StorageException.class,
                () -> client.begin(100, ContentMeta.opaque("enc-meta")));
        assertTrue(error.isTransient());
    }

    @Test
    void readsDownloadInfo() {
        server.store("abc", new byte[]{1, 2, 3}, 1234, "sealed");

        DownloadInfo info = client.getDownloadInfo("abc");

        assertEquals("abc", info.getId());
        assertEquals(1234, info.getFileSize());
        assertEquals(100, info.getPartSize());
        assertEquals("sealed", info.getEncryptedMetadata());
        assertTrue(client.fileUri("abc").toString().endsWith("/api/download/abc/file"));
        assertArrayEquals(new byte[]{1, 2, 3}, server.object("abc"));
    }

    @Test
    void missingDownloadIsNotTransient() {
        StorageException error = assertThrows(StorageException.class, () -> client.getDownloadInfo("missing"));
        assertEquals(404, error.getStatusCode());
        assertFalse(error.isTransient());
    }
}
