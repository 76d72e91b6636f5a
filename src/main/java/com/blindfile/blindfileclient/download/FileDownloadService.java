/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 17:15
File: FileDownloadService.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.storage.ContentMeta;
import com.blindfile.blindfileclient.storage.DownloadInfo;
import com.blindfile.blindfileclient.storage.HttpMultipartTransferClient;
import com.blindfile.blindfileclient.storage.StorageException;
import com.blindfile.blindfileclient.transfer.CancellationSignal;
import com.blindfile.blindfileclient.transfer.MetadataCipher;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;
import com.blindfile.blindfileclient.transfer.ShareLink;
import com.blindfile.blindfileclient.transfer.TransferException;
import com.blindfile.blindfileclient.transfer.TransferPlan;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

public final class FileDownloadService {

    private static final BlindFileLogger LOG = BlindFileLogger.get(FileDownloadService.class);

    private static final String FALLBACK_NAME = "download.bin";

    private final HttpMultipartTransferClient client;
    private final HttpClient httpClient;

    public FileDownloadService(HttpMultipartTransferClient client, HttpClient httpClient) {
        this.client = client;
        this.httpClient = httpClient;
    }

    public ResolvedDownload resolve(ShareLink link) throws IOException {
        DownloadInfo info;
        try {
            info = client.getDownloadInfo(link.getFileId());
        } catch (StorageException e) {
            throw new TransferException("Failed to look up " + link.getFileId() + ": " + e.getMessage(), e);
        }
        DownloadSession.requirePartSize(info);
        if (info.getFileSize() <= 0) {
            throw new ProtocolViolationException("Object " + link.getFileId() + " has no file size recorded");
        }

        TransferKey key;
        try {
            key = link.key();
        } catch (CipherException e) {
            throw new ProtocolViolationException("Share link key is malformed: " + e.getMessage());
        }
        MetadataCipher.FileDescriptor descriptor = describe(info, key);
        LOG.info("Resolved %s: %d bytes in %d-byte parts", link, info.getFileSize(), info.getPartSize());
        URI fileUri = client.fileUri(link.getFileId());
        return new ResolvedDownload(info, descriptor, key, fileUri.toString(), new HttpRemoteSource(httpClient, fileUri));
    }

    /**
     * Downloads with one {@code Range} request per frame. When {@code output} is a directory
     * the decrypted file name is used inside it.
     *
     * @return the file written
     */
    public Path fetch(ShareLink link, Path output, CancellationSignal cancellation,
                      Consumer<DownloadProgress> progressCallback) throws IOException {
        ResolvedDownload download = resolve(link);
        Path target = targetFor(output, download.getFileName());
        TransferPlan plan = TransferPlan.of(download.getFileSize(), download.getPlainChunkSize());

        RangedDownloader downloader = new RangedDownloader(download.getSource(), plan, download.getKey());
        downloader.setProgressCallback(progressCallback);
        downloader.download(target, cancellation);
        return target;
    }

    /**
     * Streams the decrypted object in one sequential read. The caller closes the stream.
     */
    public InputStream openPlaintext(ShareLink link) throws IOException {
        ResolvedDownload download = resolve(link);
        DownloadSession session = new DownloadSession(download.getSource(), download.getPlainChunkSize(),
                download.getKey());
        return session.openPlaintext();
    }

    public static Path targetFor(Path output, String fileName) {
        if (Files.isDirectory(output)) {
            return output.resolve(safeFileName(fileName));
        }
        return output;
    }

    static String safeFileName(String name) {
        if (name == null) {
            return FALLBACK_NAME;
        }
        String cleaned = name.replaceAll("[\\\\/:*?\"<>|\\p{Cntrl}]", "_").trim();
        if (cleaned.isEmpty() || cleaned.equals(".") || cleaned.equals("..")) {
            return FALLBACK_NAME;
        }
        return cleaned;
    }

    private static MetadataCipher.FileDescriptor describe(DownloadInfo info, TransferKey key)
            throws ProtocolViolationException {
        String encrypted = info.getEncryptedMetadata();
        if (encrypted == null || encrypted.isEmpty()) {
            String type = info.getContentType() != null ? info.getContentType() : ContentMeta.OCTET_STREAM;
            return new MetadataCipher.FileDescriptor(info.getFileName(), type);
        }
        try {
            return MetadataCipher.decrypt(encrypted, key);
        } catch (CipherException e) {
            throw new ProtocolViolationException("Share link key does not open this file's metadata");
        }
    }
}
