/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 02:33
File: ShareLink.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

import com.blindfile.blindfileclient.crypto.TransferKey;

import java.util.Objects;

/**
 * {@code <origin>/download/<fileId>#<base64url key>}. The key sits in the fragment so it is never
 * sent to the server when the link is opened.
 */
public final class ShareLink {

    private static final String DOWNLOAD_SEGMENT = "/download/";

    private final String origin;
    private final String fileId;
    private final String encodedKey;

    public ShareLink(String origin, String fileId, String encodedKey) {
        this.origin = stripTrailingSlash(Objects.requireNonNull(origin, "origin"));
        this.fileId = Objects.requireNonNull(fileId, "fileId");
        this.encodedKey = Objects.requireNonNull(encodedKey, "encodedKey");
    }

    public static ShareLink of(String origin, String fileId, TransferKey key) {
        return new ShareLink(origin, fileId, key.toBase64Url());
    }

    public static ShareLink parse(String link) throws ProtocolViolationException {
        if (link == null) {
            throw new ProtocolViolationException("Share link is missing");
        }
        String trimmed = link.trim();
        int hash = trimmed.indexOf('#');
        if (hash < 0 || hash == trimmed.length() - 1) {
            throw new ProtocolViolationException("Share link carries no key fragment");
        }
        String beforeFragment = trimmed.substring(0, hash);
        int segment = beforeFragment.lastIndexOf(DOWNLOAD_SEGMENT);
        if (segment < 0) {
            throw new ProtocolViolationException("Share link has no download path");
        }
        String fileId = beforeFragment.substring(segment + DOWNLOAD_SEGMENT.length());
        int slash = fileId.indexOf('/');
        if (slash >= 0) {
            fileId = fileId.substring(0, slash);
        }
        if (fileId.isEmpty()) {
            throw new ProtocolViolationException("Share link has no file id");
        }
        return new ShareLink(beforeFragment.substring(0, segment), fileId, trimmed.substring(hash + 1));
    }

    public String getOrigin() {
        return origin;
    }

    public String getFileId() {
        return fileId;
    }

    public TransferKey key() {
        return TransferKey.fromBase64Url(encodedKey);
    }

    public String format() {
        return origin + DOWNLOAD_SEGMENT + fileId + "#" + encodedKey;
    }

    private static String stripTrailingSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    @Override
    public String toString() {
        return origin + DOWNLOAD_SEGMENT + fileId + "#<key>";
    }
}
