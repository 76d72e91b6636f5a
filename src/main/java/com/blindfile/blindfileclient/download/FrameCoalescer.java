/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 17:32
File: FrameCoalescer.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.ChunkAuthenticationException;
import com.blindfile.blindfileclient.crypto.ChunkCipher;
import com.blindfile.blindfileclient.crypto.ChunkFrame;
import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.logging.BlindFileLogger;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * Rebuilds frame boundaries over a ciphertext stream whose reads arrive in arbitrary sizes.
 * <p>
 * Reads are kept as a list of segments and a frame is spliced out only once
 * {@code plainChunkSize + 28} bytes are buffered, so a partial frame is never handed to the
 * cipher. Whatever remains at end of input is the final, shorter frame. The first failure
 * poisons the coalescer and every later call rethrows it.
 */
public final class FrameCoalescer implements Closeable {

    private static final BlindFileLogger LOG = BlindFileLogger.get(FrameCoalescer.class);

    public static final int DEFAULT_READ_SIZE = 64 * 1024;

    private final InputStream source;
    private final TransferKey key;
    private final int frameLength;
    private final int readSize;
    private final Deque<byte[]> segments;
    private int headOffset;
    private long buffered;
    private boolean endOfInput;
    private boolean finished;
    private int framesDecoded;
    private IOException ioFailure;
    private CipherException cipherFailure;

    public FrameCoalescer(InputStream source, int plainChunkSize, TransferKey key) {
        this(source, plainChunkSize, key, DEFAULT_READ_SIZE);
    }

    public FrameCoalescer(InputStream source, int plainChunkSize, TransferKey key, int readSize) {
        if (plainChunkSize <= 0) {
            throw new IllegalArgumentException("plainChunkSize must be positive: " + plainChunkSize);
        }
        if (readSize <= 0) {
            throw new IllegalArgumentException("readSize must be positive: " + readSize);
        }
        this.source = source;
        this.key = key;
        this.frameLength = ChunkFrame.frameLength(plainChunkSize);
        this.readSize = readSize;
        this.segments = new ArrayDeque<>();
    }

    /**
     * Returns the next plaintext chunk, or {@code null} once the stream is exhausted.
     *
     * @throws ChunkAuthenticationException if a frame fails authentication or the stream ends
     *                                      with fewer bytes than a frame's overhead
     * @throws IOException                  if the source fails
     */
    public byte[] next() throws IOException {
        rethrowFailure();
        if (finished) {
            return null;
        }
        try {
            while (buffered < frameLength && !endOfInput) {
                fill();
            }
            if (buffered >= frameLength) {
                return decode(frameLength);
            }
            if (buffered == 0) {
                finished = true;
                LOG.debug("Stream ended after %d frames", framesDecoded);
                return null;
            }
            if (buffered < ChunkFrame.OVERHEAD) {
                throw new ChunkAuthenticationException("Stream ended with a " + buffered
                        + "-byte remainder, shorter than a frame's overhead");
            }
            finished = true;
            return decode((int) buffered);
        } catch (IOException e) {
            ioFailure = e;
            throw e;
        } catch (CipherException e) {
            cipherFailure = e;
            throw e;
        }
    }

    private void fill() throws IOException {
        byte[] block = new byte[readSize];
        int n = source.read(block);
        if (n < 0) {
            endOfInput = true;
            return;
        }
        if (n > 0) {
            segments.addLast(n == block.length ? block : Arrays.copyOf(block, n));
            buffered += n;
        }
    }

    private byte[] decode(int length) {
        byte[] frame = take(length);
        byte[] plaintext = ChunkCipher.decode(key, frame, 0, frame.length);
        framesDecoded++;
        LOG.trace("Decoded frame %d (%d bytes)", framesDecoded, plaintext.length);
        return plaintext;
    }

    private byte[] take(int length) {
        byte[] out = new byte[length];
        int written = 0;
        while (written < length) {
            byte[] head = segments.peekFirst();
            int available = head.length - headOffset;
            int count = Math.min(available, length - written);
            System.arraycopy(head, headOffset, out, written, count);
            written += count;
            headOffset += count;
            if (headOffset == head.length) {
                segments.removeFirst();
                headOffset = 0;
            }
        }
        buffered -= length;
        return out;
    }

    private void rethrowFailure() throws IOException {
        if (ioFailure != null) {
            throw ioFailure;
        }
        if (cipherFailure != null) {
            throw cipherFailure;
        }
    }

    public boolean isPoisoned() {
        return ioFailure != null || cipherFailure != null;
    }

    public int getFramesDecoded() {
        return framesDecoded;
    }

    @Override
    public void close() throws IOException {
        segments.clear();
        buffered = 0;
        source.close();
    }
}
