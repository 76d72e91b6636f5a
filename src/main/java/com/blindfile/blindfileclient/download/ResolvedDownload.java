/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 18:40
File: ResolvedDownload.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.download;

import com.blindfile.blindfileclient.crypto.TransferKey;
import com.blindfile.blindfileclient.storage.DownloadInfo;
import com.blindfile.blindfileclient.transfer.MetadataCipher;

/**
 * A share link resolved against the service: public object info, the decrypted file
 * descriptor and the key from the link fragment.
 */
public final class ResolvedDownload {

    private final DownloadInfo info;
    private final MetadataCipher.FileDescriptor descriptor;
    private final TransferKey key;
    private final String remoteAddress;
    private final RemoteSource source;

    public ResolvedDownload(DownloadInfo info, MetadataCipher.FileDescriptor descriptor, TransferKey key,
                            String remoteAddress, RemoteSource source) {
        this.info = info;
        this.descriptor = descriptor;
        this.key = key;
        this.remoteAddress = remoteAddress;
        this.source = source;
    }

    public DownloadInfo getInfo() {
        return info;
    }

    public String getFileName() {
        return descriptor.getName();
    }

    public String getContentType() {
        return descriptor.getType();
    }

    public TransferKey getKey() {
        return key;
    }

    /**
     * URL of the stored ciphertext.
     */
    public String getRemoteAddress() {
        return remoteAddress;
    }

    public RemoteSource getSource() {
        return source;
    }

    public int getPlainChunkSize() {
        return info.getPartSize();
    }

    public long getFileSize() {
        return info.getFileSize();
    }
}
