/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 15:59
File: DecryptingInputStream.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.CipherException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Plaintext view of a {@link FrameCoalescer}. Authentication failures surface as
 * {@link IOException} so stream consumers never mistake a tampered stream for a clean end.
 */
public final class DecryptingInputStream extends InputStream {

    private final FrameCoalescer coalescer;
    private byte[] current;
    private int position;
    private boolean exhausted;

    public DecryptingInputStream(FrameCoalescer coalescer) {
        this.coalescer = coalescer;
    }

    @Override
    public int read() throws IOException {
        if (!ensureAvailable()) {
            return -1;
        }
        return current[position++] & 0xFF;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        if (len == 0) {
            return 0;
        }
        if (!ensureAvailable()) {
            return -1;
        }
        int count = Math.min(len, current.length - position);
        System.arraycopy(current, position, b, off, count);
        position += count;
        return count;
    }

    @Override
    public int available() {
        return current == null ? 0 : current.length - position;
    }

    private boolean ensureAvailable() throws IOException {
        while (current == null || position >= current.length) {
            if (exhausted) {
                return false;
            }
            try {
                current = coalescer.next();
            } catch (CipherException e) {
                throw new IOException("Decryption failed: " + e.getMessage(), e);
            }
            position = 0;
            if (current == null) {
                exhausted = true;
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() throws IOException {
        coalescer.close();
    }
}
