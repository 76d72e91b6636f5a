/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 16:08
File: DownloadProgress.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

public final class DownloadProgress {

    private final long encryptedBytesFetched;
    private final long totalEncryptedBytes;
    private final long plaintextBytesWritten;
    private final long totalPlaintextBytes;

    public DownloadProgress(long encryptedBytesFetched, long totalEncryptedBytes,
                            long plaintextBytesWritten, long totalPlaintextBytes) {
        this.encryptedBytesFetched = encryptedBytesFetched;
        this.totalEncryptedBytes = totalEncryptedBytes;
        this.plaintextBytesWritten = plaintextBytesWritten;
        this.totalPlaintextBytes = totalPlaintextBytes;
    }

    public long getEncryptedBytesFetched() {
        return encryptedBytesFetched;
    }

    public long getTotalEncryptedBytes() {
        return totalEncryptedBytes;
    }

    public long getPlaintextBytesWritten() {
        return plaintextBytesWritten;
    }

    public long getTotalPlaintextBytes() {
        return totalPlaintextBytes;
    }

    public double getPercentage() {
        if (totalPlaintextBytes == 0) {
            return 0;
        }
        return Math.min(100.0, (plaintextBytesWritten * 100.0) / totalPlaintextBytes);
    }
}
