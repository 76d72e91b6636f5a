/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.crypto
Created by: Ashish Kushwaha on 12-10-2026 15:18
File: TransferKey.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.crypto;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * The per-transfer 256-bit AES key. Lives only in memory; its sole transport is the
 * fragment of a share link, exported as unpadded base64url.
 */
public final class TransferKey {

    public static final int KEY_LENGTH = 32;
    private static final String KEY_ALGORITHM = "AES";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] keyBytes;
    private volatile boolean destroyed;

    private TransferKey(byte[] keyBytes) {
        this.keyBytes = keyBytes;
        this.destroyed = false;
    }

    public static TransferKey generate() {
        byte[] bytes = new byte[KEY_LENGTH];
        RANDOM.nextBytes(bytes);
        return new TransferKey(bytes);
    }

    public static TransferKey fromBytes(byte[] bytes) {
        if (bytes == null || bytes.length != KEY_LENGTH) {
            throw new CipherException("Transfer key must be " + KEY_LENGTH + " bytes");
        }
        return new TransferKey(Arrays.copyOf(bytes, bytes.length));
    }

    public static TransferKey fromBase64Url(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new CipherException("Transfer key is missing");
        }
        try {
            return fromBytes(Base64.getUrlDecoder().decode(encoded.trim()));
        } catch (IllegalArgumentException e) {
            throw new CipherException("Transfer key is not valid base64url", e);
        }
    }

    public String toBase64Url() {
        checkDestroyed();
        return Base64.getUrlEncoder().withoutPadding().encodeToString(keyBytes);
    }

    public SecretKey toSecretKey() {
        checkDestroyed();
        return new SecretKeySpec(keyBytes, KEY_ALGORITHM);
    }

    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        destroyed = true;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkDestroyed() {
        if (destroyed) {
            throw new CipherException("Transfer key has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "TransferKey[redacted]";
    }
}
