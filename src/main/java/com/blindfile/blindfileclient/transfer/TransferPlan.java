/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 03:58
File: TransferPlan.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.ChunkFrame;

/**
 * Chunk geometry of one transfer. The chunk size is fixed for the transfer's lifetime and must be
 * the same on the encoding and decoding side.
 * <p>
 * Part numbers are 1-based. Every part except the last holds {@code plainChunkSize} plaintext
 * bytes; the last holds the remainder, or a full chunk when the size divides evenly.
 */
public final class TransferPlan {

    private final long totalPlaintextSize;
    private final int plainChunkSize;
    private final int totalParts;

    private TransferPlan(long totalPlaintextSize, int plainChunkSize, int totalParts) {
        this.totalPlaintextSize = totalPlaintextSize;
        this.plainChunkSize = plainChunkSize;
        this.totalParts = totalParts;
    }

    public static TransferPlan of(long totalPlaintextSize, int plainChunkSize) {
        if (totalPlaintextSize < 0) {
            throw new IllegalArgumentException("Negative plaintext size: " + totalPlaintextSize);
        }
        if (plainChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + plainChunkSize);
        }
        long parts = partsFor(totalPlaintextSize, plainChunkSize);
        if (parts > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Too many parts: " + parts);
        }
        return new TransferPlan(totalPlaintextSize, plainChunkSize, (int) parts);
    }

    public static long partsFor(long totalPlaintextSize, int plainChunkSize) {
        return (totalPlaintextSize + plainChunkSize - 1) / plainChunkSize;
    }

    public long getTotalPlaintextSize() {
        return totalPlaintextSize;
    }

    public int getPlainChunkSize() {
        return plainChunkSize;
    }

    public int getTotalParts() {
        return totalParts;
    }

    public int getEncryptedChunkSize() {
        return ChunkFrame.frameLength(plainChunkSize);
    }

    public int plaintextLength(int partNumber) {
        checkPart(partNumber);
        if (partNumber < totalParts) {
            return plainChunkSize;
        }
        long remainder = totalPlaintextSize % plainChunkSize;
        return remainder == 0 ? plainChunkSize : (int) remainder;
    }

    public int frameLength(int partNumber) {
        return ChunkFrame.frameLength(plaintextLength(partNumber));
    }

    /**
     * Offset of the part's frame within the concatenated ciphertext object.
     */
    public long encryptedOffset(int partNumber) {
        checkPart(partNumber);
        return (long) (partNumber - 1) * getEncryptedChunkSize();
    }

    /**
     * Inclusive end offset, as used by an HTTP {@code Range} header.
     */
    public long encryptedEnd(int partNumber) {
        return encryptedOffset(partNumber) + frameLength(partNumber) - 1;
    }

    public long getTotalEncryptedSize() {
        return totalPlaintextSize + (long) totalParts * ChunkFrame.OVERHEAD;
    }

    private void checkPart(int partNumber) {
        if (partNumber < 1 || partNumber > totalParts) {
            throw new IllegalArgumentException("Part " + partNumber + " outside 1.." + totalParts);
        }
    }

    @Override
    public String toString() {
        return "TransferPlan{size=" + totalPlaintextSize + ", chunk=" + plainChunkSize + ", parts=" + totalParts + "}";
    }
}
