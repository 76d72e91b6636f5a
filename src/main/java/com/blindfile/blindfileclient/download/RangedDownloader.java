/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 18:19
File: RangedDownloader.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.ChunkCipher;
import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.transfer.CancellationSignal;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;
import com.blindfile.blindfileclient.transfer.TransferPlan;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Fetches one frame per {@code Range} request, computed from the plan, and writes plaintext
 * straight to disk. The next frame is fetched while the current one is decrypted and written.
 */
public final class RangedDownloader {

    private static final BlindFileLogger LOG = BlindFileLogger.get(RangedDownloader.class);

    private final RemoteSource source;
    private final TransferPlan plan;
    private final TransferKey key;
    private Consumer<DownloadProgress> progressCallback;

    public RangedDownloader(RemoteSource source, TransferPlan plan, TransferKey key) {
        this.source = source;
        this.plan = plan;
        this.key = key;
    }

    public void setProgressCallback(Consumer<DownloadProgress> callback) {
        this.progressCallback = callback;
    }

    /**
     * Downloads and decrypts the whole object into {@code output}. On any failure, including
     * cancellation, the partially written file is deleted before the exception propagates.
     *
     * @return number of plaintext bytes written
     */
    public long download(Path output, CancellationSignal cancellation) throws IOException {
        ExecutorService fetcher = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "blindfile-fetch");
            thread.setDaemon(true);
            return thread;
        });
        boolean success = false;
        try (OutputStream out = Files.newOutputStream(output,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            long written = pipeline(out, fetcher, cancellation);
            success = true;
            return written;
        } finally {
            fetcher.shutdownNow();
            if (!success) {
                deletePartial(output);
            }
        }
    }

    private long pipeline(OutputStream out, ExecutorService fetcher, CancellationSignal cancellation)
            throws IOException {
        int totalParts = plan.getTotalParts();
        long fetched = 0;
        long written = 0;
        Future<byte[]> pending = fetcher.submit(() -> fetchFrame(1));

        for (int part = 1; part <= totalParts; part++) {
            if (cancellation.isCancelled()) {
                throw new IOException("Download cancelled at part " + part);
            }
            byte[] frame = await(pending, part);
            if (part < totalParts) {
                int nextPart = part + 1;
                pending = fetcher.submit(() -> fetchFrame(nextPart));
            }
            fetched += frame.length;

            byte[] plaintext;
            try {
                plaintext = ChunkCipher.decode(key, frame, 0, frame.length);
            } catch (CipherException e) {
                throw new IOException("Part " + part + " failed to decrypt: " + e.getMessage(), e);
            }
            out.write(plaintext);
            written += plaintext.length;
            LOG.trace("Wrote part %d/%d", part, totalParts);
            report(fetched, written);
        }
        LOG.info("Downloaded %d bytes in %d parts", written, totalParts);
        return written;
    }

    private byte[] fetchFrame(int part) throws IOException {
        long start = plan.encryptedOffset(part);
        long end = plan.encryptedEnd(part);
        int expected = plan.frameLength(part);
        byte[] frame;
        try (InputStream in = source.openRange(start, end)) {
            frame = in.readNBytes(expected + 1);
        }
        if (frame.length != expected) {
            throw new ProtocolViolationException("Part " + part + " returned " + frame.length
                    + " bytes for range " + start + "-" + end + ", expected " + expected);
        }
        return frame;
    }

    private static byte[] await(Future<byte[]> pending, int part) throws IOException {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching part " + part, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("Fetching part " + part + " failed: " + cause.getMessage(), cause);
        }
    }

    private void report(long fetched, long written) {
        if (progressCallback != null) {
            progressCallback.accept(new DownloadProgress(fetched, plan.getTotalEncryptedSize(),
                    written, plan.getTotalPlaintextSize()));
        }
    }

    private static void deletePartial(Path output) {
        try {
            Files.deleteIfExists(output);
        } catch (IOException e) {
            LOG.warn("Could not delete partial download %s: %s", output, e.getMessage());
        }
    }
}
