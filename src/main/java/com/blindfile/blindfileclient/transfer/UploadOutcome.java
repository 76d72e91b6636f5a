/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 04:06
File: UploadOutcome.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.storage.ObjectHandle;

/**
 * Result of an upload that did not fail. A cancelled upload is an outcome, not an error.
 */
public final class UploadOutcome {

    public enum Status {
        COMPLETED,
        CANCELLED
    }

    private final Status status;
    private final String sessionId;
    private final ObjectHandle handle;
    private final ShareLink shareLink;
    private final int partsCompleted;
    private final long bytesUploaded;

    private UploadOutcome(Status status, String sessionId, ObjectHandle handle, ShareLink shareLink,
                          int partsCompleted, long bytesUploaded) {
        this.status = status;
        this.sessionId = sessionId;
        this.handle = handle;
        this.shareLink = shareLink;
        this.partsCompleted = partsCompleted;
        this.bytesUploaded = bytesUploaded;
    }

    static UploadOutcome completed(UploadSession session, ObjectHandle handle) {
        return new UploadOutcome(Status.COMPLETED, session.getSessionId(), handle, null,
                session.getCompletedParts(), session.getCompletedBytes());
    }

    static UploadOutcome cancelled(UploadSession session) {
        return new UploadOutcome(Status.CANCELLED, session.getSessionId(), null, null,
                session.getCompletedParts(), session.getCompletedBytes());
    }

    UploadOutcome withShareLink(ShareLink link) {
        return new UploadOutcome(status, sessionId, handle, link, partsCompleted, bytesUploaded);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ObjectHandle getHandle() {
        return handle;
    }

    /**
     * Link carrying the file id and the key fragment, or {@code null} when the upload was cancelled.
     */
    public ShareLink getShareLink() {
        return shareLink;
    }

    public int getPartsCompleted() {
        return partsCompleted;
    }

    public long getBytesUploaded() {
        return bytesUploaded;
    }
}
