/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 00:58
File: FileUploadService.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.config.TransferSettings;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.storage.ContentMeta;
import com.blindfile.blindfileclient.storage.MultipartSession;
import com.blindfile.blindfileclient.storage.MultipartTransferClient;
import com.blindfile.blindfileclient.storage.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

public final class FileUploadService {

    private static final BlindFileLogger LOG = BlindFileLogger.get(FileUploadService.class);

    private final MultipartTransferClient client;
    private final String origin;
    private final int maxInFlight;
    private final int maxAttempts;
    private final long retryBaseDelayMs;

    public FileUploadService(MultipartTransferClient client, TransferSettings settings) {
        this(client, settings.getServerUrl(), settings.getMaxConcurrentUploads(), settings.getMaxAttempts(),
                settings.getRetryBaseDelayMs());
    }

    public FileUploadService(MultipartTransferClient client, String origin, int maxInFlight, int maxAttempts,
                             long retryBaseDelayMs) {
        this.client = client;
        this.origin = origin;
        this.maxInFlight = maxInFlight;
        this.maxAttempts = maxAttempts;
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public UploadOutcome upload(Path file, Consumer<UploadProgress> progressCallback) throws IOException {
        return upload(file, new CancellationSignal(), progressCallback);
    }

    /**
     * Encrypts and uploads {@code file} under a freshly generated key.
     *
     * @return the outcome, carrying a share link when the upload completed
     * @throws ProtocolViolationException if the service proposes a plan that does not cover the file
     * @throws TransferException          if the upload fails after retries
     */
    public UploadOutcome upload(Path file, CancellationSignal cancellation, Consumer<UploadProgress> progressCallback)
            throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new TransferException("Not a regular file: " + file);
        }
        long size = Files.size(file);
        if (size == 0) {
            throw new TransferException("Refusing to upload empty file: " + file.getFileName());
        }

        TransferKey key = TransferKey.generate();
        String fileName = file.getFileName().toString();
        String encryptedMetadata = MetadataCipher.encrypt(
                new MetadataCipher.FileDescriptor(fileName, probeContentType(file)), key);

        report(progressCallback, new UploadProgress(0, size, 0, 0, 0, 0,
                UploadProgress.UploadState.INITIALIZING));

        MultipartSession remote;
        try {
            remote = client.begin(size, ContentMeta.opaque(encryptedMetadata));
        } catch (StorageException e) {
            throw new TransferException("Failed to start upload: " + e.getMessage(), e);
        }

        TransferPlan plan;
        try {
            plan = validatePlan(remote, size);
        } catch (ProtocolViolationException e) {
            client.abort(remote.getSessionId());
            throw e;
        }
        LOG.info("Started session %s for %d bytes in %d parts", remote.getSessionId(), size, plan.getTotalParts());

        UploadScheduler scheduler = new UploadScheduler(client, maxInFlight, maxAttempts, retryBaseDelayMs);
        scheduler.setProgressCallback(progressCallback);
        UploadSession session = new UploadSession(remote, plan, cancellation);

        UploadOutcome outcome;
        try (ChunkReader reader = ChunkReader.open(file, plan.getPlainChunkSize())) {
            outcome = scheduler.run(session, reader, key);
        } catch (TransferException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            LOG.error("Upload of session %s failed before completion: %s", remote.getSessionId(), e.getMessage());
            client.abort(remote.getSessionId());
            throw e;
        }
        if (!outcome.isCompleted()) {
            return outcome;
        }
        ShareLink link = ShareLink.of(origin, outcome.getHandle().getId(), key);
        LOG.info("Upload complete: %s", link);
        return outcome.withShareLink(link);
    }

    /**
     * Sessions live only in memory, so an interrupted upload cannot be picked up again.
     */
    public UploadOutcome resume(String sessionId) throws TransferException {
        throw new TransferException("Resuming session " + sessionId + " is not supported; start a new upload");
    }

    static TransferPlan validatePlan(MultipartSession remote, long size) throws ProtocolViolationException {
        if (remote.getPlainChunkSize() <= 0) {
            throw new ProtocolViolationException("Service returned no usable part size for session "
                    + remote.getSessionId());
        }
        TransferPlan plan = TransferPlan.of(size, remote.getPlainChunkSize());
        if (remote.getTotalParts() != plan.getTotalParts()) {
            throw new ProtocolViolationException("Service planned " + remote.getTotalParts() + " parts but "
                    + size + " bytes at " + remote.getPlainChunkSize() + " per part need " + plan.getTotalParts());
        }
        return plan;
    }

    private static String probeContentType(Path file) {
        try {
            String type = Files.probeContentType(file);
            return type != null ? type : ContentMeta.OCTET_STREAM;
        } catch (IOException e) {
            LOG.debug("Could not probe content type of %s: %s", file.getFileName(), e.getMessage());
            return ContentMeta.OCTET_STREAM;
        }
    }

    private static void report(Consumer<UploadProgress> callback, UploadProgress progress) {
        if (callback != null) {
            callback.accept(progress);
        }
    }
}
