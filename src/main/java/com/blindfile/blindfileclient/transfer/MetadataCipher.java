/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 01:31
File: MetadataCipher.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.ChunkCipher;
import com.blindfile.blindfileclient.crypto.ChunkFrame;
import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.storage.JsonFields;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Seals the real file name and type into a single frame so the service only ever stores a
 * placeholder name.
 */
public final class MetadataCipher {

    private MetadataCipher() {
    }

    public static String encrypt(FileDescriptor descriptor, TransferKey key) {
        String json = JsonFields.object("name", descriptor.getName(), "type", descriptor.getType());
        ChunkFrame frame = ChunkCipher.encode(key, json.getBytes(StandardCharsets.UTF_8));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(frame.bytes());
    }

    public static FileDescriptor decrypt(String encryptedMetadata, TransferKey key) {
        byte[] frame;
        try {
            frame = Base64.getUrlDecoder().decode(encryptedMetadata);
        } catch (IllegalArgumentException e) {
            throw new CipherException("Encrypted metadata is not valid base64url", e);
        }
        String json = new String(ChunkCipher.decode(key, ChunkFrame.wrap(frame)), StandardCharsets.UTF_8);
        return new FileDescriptor(JsonFields.extractString(json, "name"), JsonFields.extractString(json, "type"));
    }

    public static final class FileDescriptor {

        private final String name;
        private final String type;

        public FileDescriptor(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }
    }
}
