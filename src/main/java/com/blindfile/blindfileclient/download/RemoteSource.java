/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 18:30
File: RemoteSource.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import java.io.IOException;
import java.io.InputStream;

/**
 * Where stored ciphertext is read from.
 */
public interface RemoteSource {

    /**
     * Opens the whole ciphertext object as a stream.
     */
    InputStream open() throws IOException;

    /**
     * Opens the inclusive byte range {@code [start, endInclusive]} of the ciphertext object.
     */
    InputStream openRange(long start, long endInclusive) throws IOException;
}
