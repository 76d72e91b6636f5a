/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 23:01
File: MultipartTransferClient.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

import java.util.List;

/**
 * Client-side contract of the object-storage multipart protocol.
 * <p>
 * Implementations signal failures with {@link StorageException}; {@link StorageException#isTransient()}
 * tells the caller whether a retry can help.
 */
public interface MultipartTransferClient {

    /**
     * Opens a remote multipart session. The returned chunk size is authoritative.
     */
    MultipartSession begin(long totalSize, ContentMeta contentMeta);

    /**
     * Uploads one frame and returns the part's entity tag. {@code partNumber} is 1-based.
     */
    String uploadPart(String sessionId, int partNumber, byte[] frameBytes);

    /**
     * Assembles the object. {@code orderedParts} must be strictly increasing with no gaps.
     */
    ObjectHandle finalizeUpload(String sessionId, List<CompletedPart> orderedParts);

    /**
     * Best-effort cleanup. Safe to call on a finalized or half-created session and never throws.
     */
    void abort(String sessionId);
}
