/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.bridge
Created by: Ashish Kushwaha on 12-10-2026 11:44
File: ProxyBridge.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.bridge;

import com.blindfile.blindfileclient.crypto.CipherException;
import com.blindfile.blindfileclient.download.DownloadSession;
import com.blindfile.blindfileclient.download.HttpRemoteSource;
import com.blindfile.blindfileclient.download.RemoteSource;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Loopback proxy that serves decrypted plaintext to a consumer that can only pull a URL.
 * <p>
 * Registrations arrive as messages on the bridge's own loop thread and are answered with
 * {@code "ready"}. The first GET on a registered virtual address claims it, fetches the
 * ciphertext, re-frames it through a {@link DownloadSession} and streams plaintext with
 * chunked transfer encoding. If a frame fails after the response has started, the connection
 * is dropped without the terminating chunk so the consumer sees a broken transfer rather
 * than a complete file.
 */
public final class ProxyBridge implements Closeable {

    private static final BlindFileLogger LOG = BlindFileLogger.get(ProxyBridge.class);

    public static final String STREAM_PREFIX = "/stream-download/";
    public static final String READY = "ready";
    public static final String REJECTED = "rejected";

    private final int requestedPort;
    private final Function<String, RemoteSource> sourceResolver;
    private final Map<String, RegisterMessage> registrations;
    private final ExecutorService messageLoop;
    private final ExecutorService streamPool;
    private final AtomicBoolean running;
    private HttpServer server;

    public ProxyBridge(int port) {
        this(port, address -> new HttpRemoteSource(URI.create(address)));
    }

    public ProxyBridge(int port, Function<String, RemoteSource> sourceResolver) {
        this.requestedPort = port;
        this.sourceResolver = sourceResolver;
        this.registrations = new ConcurrentHashMap<>();
        this.running = new AtomicBoolean(false);
        this.messageLoop = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "ProxyBridge-messages");
            thread.setDaemon(true);
            return thread;
        });
        AtomicInteger streamCounter = new AtomicInteger();
        this.streamPool = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "ProxyBridge-stream-" + streamCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() throws IOException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), requestedPort), 0);
        } catch (IOException e) {
            running.set(false);
            throw new BridgeException("Failed to bind bridge on port " + requestedPort, e);
        }
        server.createContext("/", this::handle);
        server.setExecutor(streamPool);
        server.start();
        LOG.info("Proxy bridge listening on %s", getBaseUri());
    }

    /**
     * Delivers {@code message} to the bridge's loop. The answer arrives on {@code replyPort}.
     */
    public void post(RegisterMessage message, ReplyPort replyPort) {
        try {
            messageLoop.execute(() -> onMessage(message, replyPort));
        } catch (RejectedExecutionException e) {
            LOG.warn("Bridge is closed, dropping %s", message);
            replyPort.reply(REJECTED);
        }
    }

    /**
     * Drops a registration that was never consumed.
     */
    public void unregister(String address) {
        try {
            messageLoop.execute(() -> registrations.remove(address));
        } catch (RejectedExecutionException e) {
            LOG.debug("Bridge is closed, %s already gone", address);
        }
    }

    private void onMessage(RegisterMessage message, ReplyPort replyPort) {
        if (!RegisterMessage.TYPE_REGISTER.equals(message.getType())) {
            LOG.warn("Ignoring message of type %s", message.getType());
            return;
        }
        String address = message.getAddress();
        if (address == null || !address.startsWith(STREAM_PREFIX) || address.length() == STREAM_PREFIX.length()
                || message.getPlainChunkSize() <= 0 || message.getKey() == null || message.getRemoteSource() == null) {
            LOG.warn("Rejecting invalid registration %s", message);
            replyPort.reply(REJECTED);
            return;
        }
        registrations.put(address, message);
        LOG.debug("Registered %s", address);
        replyPort.reply(READY);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendStatus(exchange, 405, "Method not allowed");
            return;
        }
        RegisterMessage registration = registrations.remove(path);
        if (registration == null) {
            sendStatus(exchange, 404, "Not found");
            return;
        }
        RemoteSource source = sourceResolver.apply(registration.getRemoteSource());
        DownloadSession session = new DownloadSession(source, registration.getPlainChunkSize(), registration.getKey());
        try {
            stream(exchange, registration, session);
        } finally {
            closeSession(session, path);
        }
    }

    private void stream(HttpExchange exchange, RegisterMessage registration, DownloadSession session)
            throws IOException {
        byte[] chunk;
        try {
            chunk = session.nextChunk();
        } catch (IOException | CipherException e) {
            LOG.error("Could not start stream %s: %s", registration.getAddress(), e.getMessage());
            sendStatus(exchange, 502, "Upstream failure");
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "application/octet-stream");
        exchange.getResponseHeaders().set("Content-Disposition", contentDisposition(registration.getDisplayName()));
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.getResponseHeaders().set("X-Content-Type-Options", "nosniff");
        exchange.sendResponseHeaders(200, 0);

        OutputStream body = exchange.getResponseBody();
        try {
            while (chunk != null) {
                body.write(chunk);
                chunk = session.nextChunk();
            }
            body.close();
            LOG.info("Streamed %d bytes for %s", session.getPlaintextBytes(), registration.getAddress());
        } catch (CipherException e) {
            LOG.error("Aborting stream %s after %d bytes: %s", registration.getAddress(),
                    session.getPlaintextBytes(), e.getMessage());
            throw new BridgeException("Stream aborted: " + e.getMessage(), e);
        } catch (IOException e) {
            LOG.error("Aborting stream %s after %d bytes: %s", registration.getAddress(),
                    session.getPlaintextBytes(), e.getMessage());
            throw e;
        }
    }

    static String contentDisposition(String displayName) {
        String name = displayName == null || displayName.isBlank() ? "download.bin" : displayName;
        StringBuilder ascii = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '"' || c == '\\') {
                ascii.append('\\').append(c);
            } else if (c < 0x20 || c > 0x7E) {
                ascii.append('_');
            } else {
                ascii.append(c);
            }
        }
        String encoded = URLEncoder.encode(name, StandardCharsets.UTF_8).replace("+", "%20");
        return "attachment; filename=\"" + ascii + "\"; filename*=UTF-8''" + encoded;
    }

    private static void sendStatus(HttpExchange exchange, int status, String message) throws IOException {
        byte[] body = message.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    private static void closeSession(DownloadSession session, String address) {
        try {
            session.close();
        } catch (IOException e) {
            LOG.debug("Closing upstream of %s failed: %s", address, e.getMessage());
        }
    }

    public boolean isRegistered(String address) {
        return registrations.containsKey(address);
    }

    public int getRegistrationCount() {
        return registrations.size();
    }

    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Bridge is not started");
        }
        return server.getAddress().getPort();
    }

    public URI getBaseUri() {
        return URI.create("http://" + InetAddress.getLoopbackAddress().getHostAddress() + ":" + getPort());
    }

    public URI addressUri(String address) {
        return getBaseUri().resolve(address);
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Proxy bridge stopped");
        }
        messageLoop.shutdown();
        try {
            messageLoop.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        streamPool.shutdownNow();
        registrations.clear();
    }
}
