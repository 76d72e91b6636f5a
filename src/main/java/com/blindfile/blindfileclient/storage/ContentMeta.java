/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 20:41
File: ContentMeta.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

/**
 * Public description of an upload. The real file name never appears here; it travels only
 * inside {@code encryptedMetadata}.
 */
public final class ContentMeta {

    public static final String PLACEHOLDER_NAME = "encrypted-payload.bin";
    public static final String OCTET_STREAM = "application/octet-stream";

    private final String fileName;
    private final String contentType;
    private final String encryptedMetadata;

    public ContentMeta(String fileName, String contentType, String encryptedMetadata) {
        this.fileName = fileName;
        this.contentType = contentType;
        this.encryptedMetadata = encryptedMetadata;
    }

    public static ContentMeta opaque(String encryptedMetadata) {
        return new ContentMeta(PLACEHOLDER_NAME, OCTET_STREAM, encryptedMetadata);
    }

    public String getFileName() {
        return fileName;
    }

    public String getContentType() {
        return contentType;
    }

    public String getEncryptedMetadata() {
        return encryptedMetadata;
    }
}
