/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.crypto
Created by: Ashish Kushwaha on 12-10-2026 14:50
File: ChunkFrame.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.crypto;

import java.util.Arrays;

/**
 * One on-wire unit: {@code IV(12) || ciphertext(N) || tag(16)}.
 */
public final class ChunkFrame {

    public static final int IV_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int OVERHEAD = IV_LENGTH + TAG_LENGTH;

    private final byte[] bytes;

    private ChunkFrame(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Takes ownership of {@code bytes}; callers must not modify the array afterwards.
     */
    public static ChunkFrame wrap(byte[] bytes) {
        return new ChunkFrame(bytes);
    }

    public static int frameLength(int plaintextLength) {
        return plaintextLength + OVERHEAD;
    }

    public int length() {
        return bytes.length;
    }

    public int plaintextLength() {
        return bytes.length - OVERHEAD;
    }

    public byte[] iv() {
        return Arrays.copyOfRange(bytes, 0, Math.min(IV_LENGTH, bytes.length));
    }

    /**
     * The raw frame without copying. Treat as read-only.
     */
    public byte[] bytes() {
        return bytes;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(bytes, bytes.length);
    }
}
