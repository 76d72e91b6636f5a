/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 16:40
File: DownloadSession.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.storage.DownloadInfo;
import com.blindfile.blindfileclient.transfer.ProtocolViolationException;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * One sequential decryption of a stored object. The coalescer, and with it the carry-over
 * buffer, belongs to the single thread reading this session.
 */
public final class DownloadSession implements Closeable {

    private final RemoteSource source;
    private final int plainChunkSize;
    private final TransferKey key;
    private FrameCoalescer coalescer;
    private long plaintextBytes;

    public DownloadSession(RemoteSource source, int plainChunkSize, TransferKey key) {
        if (plainChunkSize <= 0) {
            throw new IllegalArgumentException("plainChunkSize must be positive: " + plainChunkSize);
        }
        this.source = source;
        this.plainChunkSize = plainChunkSize;
        this.key = key;
    }

    public static DownloadSession forObject(DownloadInfo info, RemoteSource source, TransferKey key)
            throws ProtocolViolationException {
        return new DownloadSession(source, requirePartSize(info), key);
    }

    public static int requirePartSize(DownloadInfo info) throws ProtocolViolationException {
        if (info.getPartSize() <= 0) {
            throw new ProtocolViolationException("Object " + info.getId() + " has no part size recorded");
        }
        return info.getPartSize();
    }

    /**
     * Opens the remote stream and returns the next plaintext chunk, or {@code null} at the end.
     */
    public byte[] nextChunk() throws IOException {
        if (coalescer == null) {
            coalescer = new FrameCoalescer(source.open(), plainChunkSize, key);
        }
        byte[] chunk = coalescer.next();
        if (chunk != null) {
            plaintextBytes += chunk.length;
        }
        return chunk;
    }

    /**
     * Plaintext as a stream. Closing the stream closes the remote source.
     */
    public InputStream openPlaintext() throws IOException {
        if (coalescer != null) {
            throw new IllegalStateException("Download session already opened");
        }
        coalescer = new FrameCoalescer(source.open(), plainChunkSize, key);
        return new DecryptingInputStream(coalescer);
    }

    public int getPlainChunkSize() {
        return plainChunkSize;
    }

    public long getPlaintextBytes() {
        return plaintextBytes;
    }

    @Override
    public void close() throws IOException {
        if (coalescer != null) {
            coalescer.close();
        }
    }
}
