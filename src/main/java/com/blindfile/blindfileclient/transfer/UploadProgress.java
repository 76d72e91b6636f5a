/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.transfer
Created by: Ashish Kushwaha on 13-10-2026 04:17
File: UploadProgress.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.transfer;

public final class UploadProgress {

    private final long bytesTransferred;
    private final long totalBytes;
    private final int partsCompleted;
    private final int totalParts;
    private final int partsInFlight;
    private final double bytesPerSecond;
    private final UploadState state;

    public UploadProgress(long bytesTransferred, long totalBytes, int partsCompleted, int totalParts,
                          int partsInFlight, double bytesPerSecond, UploadState state) {
        this.bytesTransferred = bytesTransferred;
        this.totalBytes = totalBytes;
        this.partsCompleted = partsCompleted;
        this.totalParts = totalParts;
        this.partsInFlight = partsInFlight;
        this.bytesPerSecond = bytesPerSecond;
        this.state = state;
    }

    public long getBytesTransferred() {
        return bytesTransferred;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public int getPartsCompleted() {
        return partsCompleted;
    }

    public int getTotalParts() {
        return totalParts;
    }

    public int getPartsInFlight() {
        return partsInFlight;
    }

    public double getBytesPerSecond() {
        return bytesPerSecond;
    }

    public UploadState getState() {
        return state;
    }

    public double getPercentage() {
        if (totalParts == 0) return 0;
        return (double) partsCompleted / totalParts * 100;
    }

    /**
     * Seconds left at the current rate, or -1 when the rate is unknown.
     */
    public long getSecondsRemaining() {
        if (bytesPerSecond <= 0) return -1;
        return (long) Math.ceil((totalBytes - bytesTransferred) / bytesPerSecond);
    }

    public enum UploadState {
        INITIALIZING,
        UPLOADING,
        FINALIZING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
