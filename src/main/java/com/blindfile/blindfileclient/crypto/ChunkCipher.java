/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.crypto
Created by: Ashish Kushwaha on 12-10-2026 14:24
File: ChunkCipher.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.crypto;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;

/**
 * Stateless AES-256-GCM codec for a single chunk. Every {@link #encode} draws a fresh random
 * 96-bit nonce and prepends it to the output, so frames carry their own IV.
 */
public final class ChunkCipher {

    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int GCM_TAG_LENGTH_BITS = ChunkFrame.TAG_LENGTH * 8;
    private static final SecureRandom RANDOM = new SecureRandom();

    private ChunkCipher() {
    }

    public static ChunkFrame encode(TransferKey key, byte[] plaintext) {
        return encode(key, plaintext, 0, plaintext.length);
    }

    public static ChunkFrame encode(TransferKey key, byte[] plaintext, int offset, int length) {
        byte[] iv = new byte[ChunkFrame.IV_LENGTH];
        RANDOM.nextBytes(iv);

        byte[] out = new byte[ChunkFrame.frameLength(length)];
        System.arraycopy(iv, 0, out, 0, ChunkFrame.IV_LENGTH);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key.toSecretKey(), new GCMParameterSpec(GCM_TAG_LENGTH_BITS, iv));
            int written = cipher.doFinal(plaintext, offset, length, out, ChunkFrame.IV_LENGTH);
            if (written != length + ChunkFrame.TAG_LENGTH) {
                throw new CipherException("Unexpected ciphertext length " + written);
            }
            return ChunkFrame.wrap(out);
        } catch (GeneralSecurityException e) {
            throw new CipherException("Chunk encryption failed", e);
        }
    }

    public static byte[] decode(TransferKey key, ChunkFrame frame) {
        return decode(key, frame.bytes(), 0, frame.length());
    }

    /**
     * Decrypts and authenticates one frame. Output is produced only after the tag verifies;
     * on any mismatch nothing is returned.
     */
    public static byte[] decode(TransferKey key, byte[] frame, int offset, int length) {
        if (length < ChunkFrame.OVERHEAD) {
            throw new ChunkAuthenticationException("Frame of " + length + " bytes is shorter than the "
                    + ChunkFrame.OVERHEAD + "-byte IV and tag overhead");
        }
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            GCMParameterSpec gcmSpec = new GCMParameterSpec(GCM_TAG_LENGTH_BITS, frame, offset, ChunkFrame.IV_LENGTH);
            cipher.init(Cipher.DECRYPT_MODE, key.toSecretKey(), gcmSpec);
            return cipher.doFinal(frame, offset + ChunkFrame.IV_LENGTH, length - ChunkFrame.IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new ChunkAuthenticationException("Authentication failed: frame integrity compromised", e);
        } catch (GeneralSecurityException e) {
            throw new CipherException("Chunk decryption failed", e);
        }
    }
}
