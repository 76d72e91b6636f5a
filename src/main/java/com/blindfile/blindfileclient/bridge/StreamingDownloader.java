/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.bridge
Created by: Ashish Kushwaha on 12-10-2026 13:18
File: StreamingDownloader.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.bridge;

import com.blindfile.blindfileclient.download.ResolvedDownload;
import com.blindfile.blindfileclient.logging.BlindFileLogger;

import java.io.IOException;
import java.net.URI;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Producer side of the bridge handshake: register, wait for {@code "ready"}, then hand the
 * virtual address to the consumer.
 */
public final class StreamingDownloader {

    private static final BlindFileLogger LOG = BlindFileLogger.get(StreamingDownloader.class);

    public static final long DEFAULT_HANDSHAKE_TIMEOUT_MS = 3000;

    private final ProxyBridge bridge;
    private final long handshakeTimeoutMs;

    public StreamingDownloader(ProxyBridge bridge) {
        this(bridge, DEFAULT_HANDSHAKE_TIMEOUT_MS);
    }

    public StreamingDownloader(ProxyBridge bridge, long handshakeTimeoutMs) {
        if (handshakeTimeoutMs <= 0) {
            throw new IllegalArgumentException("handshakeTimeoutMs must be positive: " + handshakeTimeoutMs);
        }
        this.bridge = bridge;
        this.handshakeTimeoutMs = handshakeTimeoutMs;
    }

    public void download(ResolvedDownload download, DownloadConsumer consumer) throws IOException {
        String address = ProxyBridge.STREAM_PREFIX + UUID.randomUUID();
        RegisterMessage message = RegisterMessage.register(address, download.getFileName(), download.getFileSize(),
                download.getRemoteAddress(), download.getKey(), download.getPlainChunkSize());
        consumer.consume(register(message));
    }

    /**
     * Registers {@code message} and waits for the bridge to acknowledge it.
     *
     * @return the URI the consumer should pull
     * @throws BridgeException if the bridge does not answer {@code "ready"} in time
     */
    public URI register(RegisterMessage message) throws BridgeException {
        CompletableFuture<String> reply = new CompletableFuture<>();
        bridge.post(message, reply::complete);

        String answer;
        try {
            answer = reply.get(handshakeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            bridge.unregister(message.getAddress());
            throw new BridgeException("Bridge did not acknowledge " + message.getAddress() + " within "
                    + handshakeTimeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            bridge.unregister(message.getAddress());
            throw new BridgeException("Interrupted while waiting for the bridge", e);
        } catch (ExecutionException e) {
            throw new BridgeException("Bridge handshake failed", e.getCause());
        }

        if (!ProxyBridge.READY.equals(answer)) {
            throw new BridgeException("Bridge refused " + message.getAddress() + ": " + answer);
        }
        URI uri = bridge.addressUri(message.getAddress());
        LOG.debug("Bridge ready at %s", uri);
        return uri;
    }
}
