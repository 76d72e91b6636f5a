/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 00:34
File: ChunkReader.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PushbackInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sequential reader that slices a source into plaintext chunks of at most {@code plainChunkSize}
 * bytes without holding more than one chunk in memory. Only this class tracks the byte offset into
 * the source.
 */
public final class ChunkReader implements Closeable {

    private final PushbackInputStream input;
    private final int plainChunkSize;
    private long position;
    private int chunkIndex;
    private boolean finished;

    public ChunkReader(InputStream input, int plainChunkSize) {
        if (plainChunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + plainChunkSize);
        }
        this.input = new PushbackInputStream(input, 1);
        this.plainChunkSize = plainChunkSize;
        this.position = 0;
        this.chunkIndex = 0;
        this.finished = false;
    }

    public static ChunkReader open(Path file, int plainChunkSize) throws IOException {
        return new ChunkReader(new BufferedInputStream(Files.newInputStream(file)), plainChunkSize);
    }

    /**
     * @return the next chunk, or {@code null} once the source is exhausted
     */
    public Chunk next() throws IOException {
        if (finished) {
            return null;
        }

        byte[] data = input.readNBytes(plainChunkSize);
        if (data.length == 0) {
            finished = true;
            return null;
        }

        boolean last;
        if (data.length < plainChunkSize) {
            last = true;
        } else {
            int peek = input.read();
            if (peek == -1) {
                last = true;
            } else {
                input.unread(peek);
                last = false;
            }
        }

        finished = last;
        position += data.length;
        return new Chunk(++chunkIndex, data, last);
    }

    public long position() {
        return position;
    }

    public int getPlainChunkSize() {
        return plainChunkSize;
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    public static final class Chunk {

        private final int partNumber;
        private final byte[] data;
        private final boolean last;

        Chunk(int partNumber, byte[] data, boolean last) {
            this.partNumber = partNumber;
            this.data = data;
            this.last = last;
        }

        public int getPartNumber() {
            return partNumber;
        }

        public byte[] getData() {
            return data;
        }

        public int length() {
            return data.length;
        }

        public boolean isLast() {
            return last;
        }
    }
}
