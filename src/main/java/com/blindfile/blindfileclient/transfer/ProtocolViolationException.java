/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 02:06
File: ProtocolViolationException.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

/**
 * The remote side handed back metadata the transfer cannot work with, for example a missing
 * chunk size or a part count that does not match the size. Raised before any bytes move.
 */
public class ProtocolViolationException extends TransferException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
