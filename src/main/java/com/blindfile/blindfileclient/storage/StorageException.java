/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 23:46
File: StorageException.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

/**
 * A call to the object-storage service failed. Network failures and 5xx/429 responses are
 * transient and may be retried; everything else is final.
 */
public class StorageException extends RuntimeException {

    private final int statusCode;
    private final boolean transientFailure;

    public StorageException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
        this.transientFailure = statusCode >= 500 || statusCode == 429;
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.transientFailure = true;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
