/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 21:16
File: DownloadInfo.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

/**
 * Public metadata the service keeps next to a stored object. {@code partSize} is the plaintext
 * chunk size used at upload time and is trusted as-is.
 */
public final class DownloadInfo {

    private final String id;
    private final String fileName;
    private final long fileSize;
    private final String contentType;
    private final String expiresAt;
    private final int partSize;
    private final String encryptedMetadata;

    public DownloadInfo(String id, String fileName, long fileSize, String contentType,
                        String expiresAt, int partSize, String encryptedMetadata) {
        this.id = id;
        this.fileName = fileName;
        this.fileSize = fileSize;
        this.contentType = contentType;
        this.expiresAt = expiresAt;
        this.partSize = partSize;
        this.encryptedMetadata = encryptedMetadata;
    }

    static DownloadInfo fromJson(String json) {
        return new DownloadInfo(
                JsonFields.extractString(json, "id"),
                JsonFields.extractString(json, "fileName"),
                JsonFields.extractLong(json, "fileSize", -1),
                JsonFields.extractString(json, "contentType"),
                JsonFields.extractString(json, "expiresAt"),
                JsonFields.extractInt(json, "partSize", 0),
                JsonFields.extractString(json, "encryptedMetadata")
        );
    }

    public String getId() {
        return id;
    }

    public String getFileName() {
        return fileName;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getContentType() {
        return contentType;
    }

    public String getExpiresAt() {
        return expiresAt;
    }

    /**
     * @return the plaintext chunk size, or 0 when the service did not report one
     */
    public int getPartSize() {
        return partSize;
    }

    public String getEncryptedMetadata() {
        return encryptedMetadata;
    }
}
