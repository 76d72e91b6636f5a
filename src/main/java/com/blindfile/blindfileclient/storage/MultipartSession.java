/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 22:36
File: MultipartSession.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

/**
 * What the storage service answers to {@code begin}. The service picks the chunk size; clients
 * must use it as given.
 */
public final class MultipartSession {

    private final String sessionId;
    private final String remoteUploadId;
    private final int plainChunkSize;
    private final int totalParts;
    private final String expiresAt;

    public MultipartSession(String sessionId, String remoteUploadId, int plainChunkSize, int totalParts, String expiresAt) {
        this.sessionId = sessionId;
        this.remoteUploadId = remoteUploadId;
        this.plainChunkSize = plainChunkSize;
        this.totalParts = totalParts;
        this.expiresAt = expiresAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRemoteUploadId() {
        return remoteUploadId;
    }

    public int getPlainChunkSize() {
        return plainChunkSize;
    }

    public int getTotalParts() {
        return totalParts;
    }

    public String getExpiresAt() {
        return expiresAt;
    }

    @Override
    public String toString() {
        return "MultipartSession{" + sessionId + ", chunk=" + plainChunkSize + ", parts=" + totalParts + "}";
    }
}
