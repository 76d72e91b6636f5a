/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 01:43
File: PartTask.java
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

/**
 * One encrypted chunk on its way to becoming a remote part. Retries reuse the same part number.
 * <p>
 * Attempt bookkeeping is written by the uploading worker; the terminal state is set by the
 * scheduling thread when it settles the task.
 */
public final class PartTask {

    public enum State {
        PENDING,
        IN_FLIGHT,
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private final int partNumber;
    private final int plaintextLength;
    private volatile ChunkFrame frame;
    private volatile State state;
    private volatile int attempts;
    private volatile String etag;
    private volatile RuntimeException lastError;
    private volatile boolean abandoned;

    PartTask(int partNumber, ChunkFrame frame, int plaintextLength) {
        this.partNumber = partNumber;
        this.frame = frame;
        this.plaintextLength = plaintextLength;
        this.state = State.PENDING;
        this.attempts = 0;
    }

    void markInFlight() {
        requireState(State.PENDING);
        state = State.IN_FLIGHT;
    }

    int beginAttempt() {
        return ++attempts;
    }

    void recordSuccess(String etag) {
        this.etag = etag;
    }

    void recordError(RuntimeException error) {
        this.lastError = error;
    }

    void abandon() {
        this.abandoned = true;
    }

    void settle() {
        requireState(State.IN_FLIGHT);
        if (etag != null) {
            state = State.COMPLETED;
        } else if (abandoned) {
            state = State.CANCELLED;
        } else {
            state = State.FAILED;
        }
        frame = null;
    }

    byte[] frameBytes() {
        ChunkFrame current = frame;
        if (current == null) {
            throw new IllegalStateException("Part " + partNumber + " no longer holds its frame");
        }
        return current.bytes();
    }

    public CompletedPart toCompletedPart() {
        requireState(State.COMPLETED);
        return new CompletedPart(partNumber, etag);
    }

    public int getPartNumber() {
        return partNumber;
    }

    public int getPlaintextLength() {
        return plaintextLength;
    }

    public State getState() {
        return state;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getEtag() {
        return etag;
    }

    public RuntimeException getLastError() {
        return lastError;
    }

    private void requireState(State expected) {
        if (state != expected) {
            throw new IllegalStateException("Part " + partNumber + " is " + state + ", expected " + expected);
        }
    }

    @Override
    public String toString() {
        return "PartTask{part=" + partNumber + ", state=" + state + ", attempts=" + attempts + "}";
    }
}
