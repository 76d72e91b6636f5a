/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 23:39
File: ObjectHandle.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

public final class ObjectHandle {

    private final String id;
    private final String downloadUrl;
    private final String expiresAt;

    public ObjectHandle(String id, String downloadUrl, String expiresAt) {
        this.id = id;
        this.downloadUrl = downloadUrl;
        this.expiresAt = expiresAt;
    }

    public String getId() {
        return id;
    }

    public String getDownloadUrl() {
        return downloadUrl;
    }

    public String getExpiresAt() {
        return expiresAt;
    }
}
