/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 05:02
File: UploadSession.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.ChunkFrame;
import com.blindfile.blindfileclient.storage.CompletedPart;
import com.blindfile.blindfileclient.storage.MultipartSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one multipart upload. Mutated only from the scheduling thread.
 */
public final class UploadSession {

    private final MultipartSession remote;
    private final TransferPlan plan;
    private final CancellationSignal cancellation;
    private final Map<Integer, PartTask> tasks;
    private final List<PartTask> completed;
    private long cursor;
    private long completedBytes;

    public UploadSession(MultipartSession remote, TransferPlan plan, CancellationSignal cancellation) {
        this.remote = remote;
        this.plan = plan;
        this.cancellation = cancellation;
        this.tasks = new LinkedHashMap<>();
        this.completed = new ArrayList<>();
        this.cursor = 0;
        this.completedBytes = 0;
    }

    PartTask admit(ChunkReader.Chunk chunk, ChunkFrame frame, long sourcePosition) throws ProtocolViolationException {
        int partNumber = chunk.getPartNumber();
        if (partNumber != tasks.size() + 1) {
            throw new IllegalStateException("Part " + partNumber + " admitted out of sequence");
        }
        if (partNumber > plan.getTotalParts()) {
            throw new ProtocolViolationException("Source is longer than the planned " + plan.getTotalParts() + " parts");
        }
        if (sourcePosition < cursor) {
            throw new IllegalStateException("Source cursor moved backwards");
        }
        cursor = sourcePosition;
        PartTask task = new PartTask(partNumber, frame, chunk.length());
        tasks.put(partNumber, task);
        task.markInFlight();
        return task;
    }

    void recordCompletion(PartTask task) {
        completed.add(task);
        completedBytes += task.getPlaintextLength();
    }

    /**
     * Completed parts sorted by part number, verified to be exactly 1..totalParts.
     */
    public List<CompletedPart> orderedParts() throws ProtocolViolationException {
        List<CompletedPart> ordered = new ArrayList<>(completed.size());
        for (PartTask task : completed) {
            ordered.add(task.toCompletedPart());
        }
        Collections.sort(ordered);
        for (int i = 0; i < ordered.size(); i++) {
            if (ordered.get(i).getPartNumber() != i + 1) {
                throw new ProtocolViolationException("Completed parts are not contiguous at part " + (i + 1));
            }
        }
        if (ordered.size() != plan.getTotalParts()) {
            throw new ProtocolViolationException("Completed " + ordered.size() + " parts but the plan has "
                    + plan.getTotalParts());
        }
        return ordered;
    }

    public String getSessionId() {
        return remote.getSessionId();
    }

    public MultipartSession getRemote() {
        return remote;
    }

    public TransferPlan getPlan() {
        return plan;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public PartTask getTask(int partNumber) {
        return tasks.get(partNumber);
    }

    public int getCompletedParts() {
        return completed.size();
    }

    public long getCompletedBytes() {
        return completedBytes;
    }

    public long getCursor() {
        return cursor;
    }
}
