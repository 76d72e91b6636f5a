/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.bridge
Created by: Ashish Kushwaha on 12-10-2026 12:02
File: RegisterMessage.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.bridge;

import com.blindfile.blindfileclient.crypto.TransferKey;

import java.util.Objects;

/**
 * Asks the bridge to serve decrypted plaintext of {@code remoteSource} at a virtual address.
 */
public final class RegisterMessage {

    public static final String TYPE_REGISTER = "register";

    private final String type;
    private final String address;
    private final String displayName;
    private final long size;
    private final String remoteSource;
    private final TransferKey key;
    private final int plainChunkSize;

    public RegisterMessage(String type, String address, String displayName, long size, String remoteSource,
                           TransferKey key, int plainChunkSize) {
        this.type = type;
        this.address = address;
        this.displayName = displayName;
        this.size = size;
        this.remoteSource = remoteSource;
        this.key = key;
        this.plainChunkSize = plainChunkSize;
    }

    public static RegisterMessage register(String address, String displayName, long size, String remoteSource,
                                           TransferKey key, int plainChunkSize) {
        return new RegisterMessage(TYPE_REGISTER, Objects.requireNonNull(address, "address"), displayName, size,
                Objects.requireNonNull(remoteSource, "remoteSource"), Objects.requireNonNull(key, "key"),
                plainChunkSize);
    }

    public String getType() {
        return type;
    }

    public String getAddress() {
        return address;
    }

    public String getDisplayName() {
        return displayName;
    }

    public long getSize() {
        return size;
    }

    public String getRemoteSource() {
        return remoteSource;
    }

    public TransferKey getKey() {
        return key;
    }

    public int getPlainChunkSize() {
        return plainChunkSize;
    }

    @Override
    public String toString() {
        return "RegisterMessage{type=" + type + ", address=" + address + ", size=" + size
                + ", plainChunkSize=" + plainChunkSize + "}";
    }
}
