/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.download
Created by: Ashish Kushwaha on 12-10-2026 17:39
File: HttpRemoteSource.java
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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpRemoteSource implements RemoteSource {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);

    private final HttpClient httpClient;
    private final URI uri;

    public HttpRemoteSource(URI uri) {
        this(HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), uri);
    }

    public HttpRemoteSource(HttpClient httpClient, URI uri) {
        this.httpClient = httpClient;
        this.uri = uri;
    }

    @Override
    public InputStream open() throws IOException {
        HttpRequest request = HttpRequest.newBuilder().uri(uri).GET().build();
        return send(request, 200);
    }

    @Override
    public InputStream openRange(long start, long endInclusive) throws IOException {
        if (start < 0 || endInclusive < start) {
            throw new IllegalArgumentException("Invalid range " + start + "-" + endInclusive);
        }
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Range", "bytes=" + start + "-" + endInclusive)
                .GET()
                .build();
        return send(request, 206);
    }

    private InputStream send(HttpRequest request, int expectedStatus) throws IOException {
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while fetching " + uri, e);
        }
        if (response.statusCode() == expectedStatus) {
            return response.body();
        }
        String detail;
        try (InputStream body = response.body()) {
            detail = new String(body.readNBytes(512), StandardCharsets.UTF_8).trim();
        }
        throw new IOException("Fetching " + uri + " returned HTTP " + response.statusCode()
                + (detail.isEmpty() ? "" : ": " + detail));
    }

    public URI getUri() {
        return uri;
    }
}
