/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 04:30
File: UploadScheduler.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.ChunkCipher;
import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.storage.CompletedPart;
import com.blindfile.blindfileclient.storage.MultipartTransferClient;
import com.blindfile.blindfileclient.storage.ObjectHandle;
import com.blindfile.blindfileclient.storage.StorageException;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Turns a chunk source into completed remote parts with at most {@code maxInFlight} uploads
 * outstanding.
 * <p>
 * The calling thread reads, encrypts and admits chunks and is the only thread that settles parts,
 * so session state and progress counters are never mutated concurrently. Worker threads only run
 * the network attempts of a single part, retrying it in place with a linear backoff.
 */
public final class UploadScheduler {

    private static final BlindFileLogger LOG = BlindFileLogger.get(UploadScheduler.class);

    public static final int DEFAULT_MAX_IN_FLIGHT = 3;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1000;

    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final MultipartTransferClient client;
    private final int maxInFlight;
    private final int maxAttempts;
    private final long retryBaseDelayMs;
    private Consumer<UploadProgress> progressCallback;

    public UploadScheduler(MultipartTransferClient client) {
        this(client, DEFAULT_MAX_IN_FLIGHT, DEFAULT_MAX_ATTEMPTS, DEFAULT_RETRY_BASE_DELAY_MS);
    }

    public UploadScheduler(MultipartTransferClient client, int maxInFlight, int maxAttempts, long retryBaseDelayMs) {
        if (maxInFlight < 1 || maxAttempts < 1 || retryBaseDelayMs < 0) {
            throw new IllegalArgumentException("Invalid scheduler limits");
        }
        this.client = client;
        this.maxInFlight = maxInFlight;
        this.maxAttempts = maxAttempts;
        this.retryBaseDelayMs = retryBaseDelayMs;
    }

    public void setProgressCallback(Consumer<UploadProgress> callback) {
        this.progressCallback = callback;
    }

    /**
     * Uploads every chunk of {@code reader} and finalizes the remote object.
     *
     * @return a completed outcome, or a cancelled one if the session's signal fired
     * @throws TransferException when a part exhausts its attempts, the source cannot be read, or
     *                           finalization fails; the remote session has been aborted by then
     */
    public UploadOutcome run(UploadSession session, ChunkReader reader, TransferKey key) throws TransferException {
        ExecutorService workers = newWorkerPool();
        try {
            return drive(session, reader, key, workers);
        } finally {
            workers.shutdownNow();
        }
    }

    private UploadOutcome drive(UploadSession session, ChunkReader reader, TransferKey key, ExecutorService workers)
            throws TransferException {
        ThroughputMeter meter = new ThroughputMeter();
        CompletionService<PartTask> completions = new ExecutorCompletionService<>(workers);
        int inFlight = 0;
        TransferException failure = null;

        LOG.info("Uploading %s", session.getPlan());
        reportProgress(session, 0, meter, UploadProgress.UploadState.UPLOADING);
        try {
            admission:
            while (!session.isCancelled()) {
                Future<PartTask> ready;
                while ((ready = inFlight >= maxInFlight ? completions.take() : completions.poll()) != null) {
                    inFlight--;
                    failure = settle(session, unwrap(ready), meter, inFlight);
                    if (failure != null) {
                        break admission;
                    }
                }
                if (session.isCancelled()) {
                    break;
                }

                ChunkReader.Chunk chunk = reader.next();
                if (chunk == null) {
                    break;
                }
                PartTask task = session.admit(chunk, ChunkCipher.encode(key, chunk.getData()), reader.position());
                completions.submit(() -> attemptUpload(session, task));
                inFlight++;
                LOG.trace("Admitted part %d (%d in flight)", task.getPartNumber(), inFlight);
            }
        } catch (TransferException e) {
            failure = e;
        } catch (IOException e) {
            failure = new TransferException("Failed to read source: " + e.getMessage(), e);
        } catch (CipherException e) {
            failure = new TransferException("Failed to encrypt chunk: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            client.abort(session.getSessionId());
            throw new TransferException("Upload interrupted", e);
        }

        try {
            while (inFlight > 0) {
                PartTask settled = unwrap(completions.take());
                inFlight--;
                TransferException partFailure = settle(session, settled, meter, inFlight);
                if (failure == null) {
                    failure = partFailure;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = new TransferException("Upload interrupted", e);
        } finally {
            workers.shutdownNow();
        }

        if (failure != null) {
            reportProgress(session, 0, meter, UploadProgress.UploadState.FAILED);
            LOG.error("Upload of session %s failed: %s", session.getSessionId(), failure.getMessage());
            client.abort(session.getSessionId());
            throw failure;
        }
        if (session.isCancelled()) {
            LOG.info("Upload of session %s cancelled after %d parts", session.getSessionId(), session.getCompletedParts());
            client.abort(session.getSessionId());
            reportProgress(session, 0, meter, UploadProgress.UploadState.CANCELLED);
            return UploadOutcome.cancelled(session);
        }
        return finish(session, meter);
    }

    private UploadOutcome finish(UploadSession session, ThroughputMeter meter) throws TransferException {
        reportProgress(session, 0, meter, UploadProgress.UploadState.FINALIZING);
        try {
            List<CompletedPart> ordered = session.orderedParts();
            ObjectHandle handle = client.finalizeUpload(session.getSessionId(), ordered);
            reportProgress(session, 0, meter, UploadProgress.UploadState.COMPLETED);
            LOG.info("Finalized session %s with %d parts", session.getSessionId(), ordered.size());
            return UploadOutcome.completed(session, handle);
        } catch (ProtocolViolationException e) {
            client.abort(session.getSessionId());
            throw e;
        } catch (StorageException e) {
            client.abort(session.getSessionId());
            throw new TransferException("Failed to finalize upload: " + e.getMessage(), e);
        }
    }

    private PartTask attemptUpload(UploadSession session, PartTask task) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (session.isCancelled()) {
                task.abandon();
                return task;
            }
            task.beginAttempt();
            try {
                task.recordSuccess(client.uploadPart(session.getSessionId(), task.getPartNumber(), task.frameBytes()));
                return task;
            } catch (StorageException e) {
                task.recordError(e);
                LOG.warn("Part %d attempt %d/%d failed: %s", task.getPartNumber(), attempt, maxAttempts, e.getMessage());
                if (!e.isTransient()) {
                    return task;
                }
            } catch (RuntimeException e) {
                task.recordError(e);
                LOG.warn("Part %d attempt %d/%d failed: %s", task.getPartNumber(), attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !backoff(attempt)) {
                task.abandon();
                return task;
            }
        }
        return task;
    }

    private boolean backoff(int attempt) {
        try {
            Thread.sleep(attempt * retryBaseDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private PartTask unwrap(Future<PartTask> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // attemptUpload never throws; anything here is a defect in the worker itself
            throw new IllegalStateException("Upload worker failed", e.getCause());
        }
    }

    private TransferException settle(UploadSession session, PartTask task, ThroughputMeter meter, int inFlight) {
        task.settle();
        switch (task.getState()) {
            case COMPLETED:
                session.recordCompletion(task);
                meter.record(task.getPlaintextLength());
                LOG.debug("Part %d completed (%d/%d)", task.getPartNumber(), session.getCompletedParts(),
                        session.getPlan().getTotalParts());
                reportProgress(session, inFlight, meter, UploadProgress.UploadState.UPLOADING);
                return null;
            case CANCELLED:
                return null;
            default:
                if (session.isCancelled()) {
                    return null;
                }
                RuntimeException cause = task.getLastError();
                String reason = cause != null ? cause.getMessage() : "unknown error";
                return new TransferException("Part " + task.getPartNumber() + " failed after "
                        + task.getAttempts() + " attempts: " + reason, cause);
        }
    }

    private void reportProgress(UploadSession session, int inFlight, ThroughputMeter meter, UploadProgress.UploadState state) {
        if (progressCallback == null) {
            return;
        }
        TransferPlan plan = session.getPlan();
        progressCallback.accept(new UploadProgress(session.getCompletedBytes(), plan.getTotalPlaintextSize(),
                session.getCompletedParts(), plan.getTotalParts(), inFlight, meter.bytesPerSecond(), state));
    }

    private ExecutorService newWorkerPool() {
        int poolId = POOL_COUNTER.incrementAndGet();
        AtomicInteger threadCounter = new AtomicInteger();
        return Executors.newFixedThreadPool(maxInFlight, r -> {
            Thread thread = new Thread(r, "blindfile-upload-" + poolId + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
