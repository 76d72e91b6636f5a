/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.crypto
Created by: Ashish Kushwaha on 12-10-2026 13:49
File: ChunkAuthenticationException.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.crypto;

/**
 * A frame failed its GCM tag check. Never retried: the bytes are corrupt, forged, or were
 * decoded with the wrong key or chunk size.
 */
public class ChunkAuthenticationException extends CipherException {

    public ChunkAuthenticationException(String message) {
        super(message);
    }

    public ChunkAuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
