/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 21:35
File: HttpMultipartTransferClient.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

import com.blindfile.blindfileclient.logging.BlindFileLogger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MultipartTransferClient} over the BlindFile HTTP API ({@code /upload/*} and
 * {@code /download/*}).
 */
public final class HttpMultipartTransferClient implements MultipartTransferClient {

    private static final BlindFileLogger LOG = BlindFileLogger.get(HttpMultipartTransferClient.class);
    private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration PART_TIMEOUT = Duration.ofMinutes(5);

    private final String apiBaseUrl;
    private final HttpClient httpClient;
    private final Map<String, String> remoteUploadIds;

    public HttpMultipartTransferClient(String apiBaseUrl) {
        this(apiBaseUrl, HttpClient.newBuilder()
                .connectTimeout(HTTP_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpMultipartTransferClient(String apiBaseUrl, HttpClient httpClient) {
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.httpClient = httpClient;
        this.remoteUploadIds = new ConcurrentHashMap<>();
    }

    @Override
    public MultipartSession begin(long totalSize, ContentMeta contentMeta) {
        String json = JsonFields.object(
                "fileName", contentMeta.getFileName(),
                "fileSize", totalSize,
                "contentType", contentMeta.getContentType(),
                "encryptedMetadata", contentMeta.getEncryptedMetadata()
        );
        String body = postJson("/upload/init", json, "Failed to initialize upload");

        String sessionId = JsonFields.extractString(body, "id");
        String remoteUploadId = JsonFields.extractString(body, "uploadId");
        int partSize = JsonFields.extractInt(body, "partSize", 0);
        int totalParts = JsonFields.extractInt(body, "totalParts", -1);
        if (sessionId == null || remoteUploadId == null) {
            throw new StorageException("Upload init response is missing identifiers", 502);
        }
        remoteUploadIds.put(sessionId, remoteUploadId);
        LOG.debug("Opened multipart session %s (part size %d, %d parts)", sessionId, partSize, totalParts);
        return new MultipartSession(sessionId, remoteUploadId, partSize, totalParts,
                JsonFields.extractString(body, "expiresAt"));
    }

    @Override
    public String uploadPart(String sessionId, int partNumber, byte[] frameBytes) {
        String remoteUploadId = remoteUploadIds.getOrDefault(sessionId, sessionId);
        String query = "id=" + encode(sessionId)
                + "&uploadId=" + encode(sessionId)
                + "&r2UploadId=" + encode(remoteUploadId)
                + "&partNumber=" + partNumber;

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + "/upload/part?" + query))
                .timeout(PART_TIMEOUT)
                .header("Content-Type", "application/octet-stream")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(frameBytes))
                .build();

        String body = send(request, "Failed to upload part " + partNumber);
        String etag = JsonFields.extractString(body, "etag");
        if (etag == null) {
            throw new StorageException("Part " + partNumber + " response carried no etag", 502);
        }
        return etag;
    }

    @Override
    public ObjectHandle finalizeUpload(String sessionId, List<CompletedPart> orderedParts) {
        List<String> parts = new ArrayList<>(orderedParts.size());
        for (CompletedPart part : orderedParts) {
            parts.add(part.toJson());
        }
        String json = JsonFields.object("uploadId", sessionId, "parts", JsonFields.array(parts));
        String body = postJson("/upload/complete", json, "Failed to complete upload");
        remoteUploadIds.remove(sessionId);

        String id = JsonFields.extractString(body, "id");
        return new ObjectHandle(id != null ? id : sessionId,
                JsonFields.extractString(body, "downloadUrl"),
                JsonFields.extractString(body, "expiresAt"));
    }

    @Override
    public void abort(String sessionId) {
        if (sessionId == null) {
            return;
        }
        try {
            postJson("/upload/abort", JsonFields.object("uploadId", sessionId), "Failed to abort upload");
            LOG.info("Aborted multipart session %s", sessionId);
        } catch (StorageException e) {
            LOG.warn("Abort of session %s failed: %s", sessionId, e.getMessage());
        } finally {
            remoteUploadIds.remove(sessionId);
        }
    }

    public DownloadInfo getDownloadInfo(String fileId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + "/download/" + encode(fileId)))
                .timeout(HTTP_TIMEOUT)
                .GET()
                .build();
        return DownloadInfo.fromJson(send(request, "Failed to load download info"));
    }

    /**
     * Address of the stored ciphertext. Supports {@code Range} requests.
     */
    public URI fileUri(String fileId) {
        return URI.create(apiBaseUrl + "/download/" + encode(fileId) + "/file");
    }

    private String postJson(String path, String json, String failureMessage) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + path))
                .timeout(HTTP_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        return send(request, failureMessage);
    }

    private String send(HttpRequest request, String failureMessage) {
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 200 && status < 300) {
                return response.body();
            }
            String serverMessage = JsonFields.extractErrorMessage(response.body());
            throw new StorageException(failureMessage + ": "
                    + (serverMessage != null ? serverMessage : "HTTP " + status), status);
        } catch (IOException e) {
            throw new StorageException(failureMessage + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException(failureMessage + ": interrupted", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
