/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.bridge
Created by: Ashish Kushwaha on 12-10-2026 10:46
File: DownloadConsumer.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.bridge;

import java.io.IOException;
import java.net.URI;

/**
 * Pull-only reader of a bridge address, the role a browser plays for a navigated download.
 */
@FunctionalInterface
public interface DownloadConsumer {

    void consume(URI address) throws IOException;
}
