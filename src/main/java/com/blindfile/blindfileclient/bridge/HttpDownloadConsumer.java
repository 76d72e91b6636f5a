/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.bridge
Created by: Ashish Kushwaha on 12-10-2026 11:25
File: HttpDownloadConsumer.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.bridge;

import com.blindfile.blindfileclient.logging.BlindFileLogger;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Saves whatever a bridge address serves into a file. A transfer that does not end cleanly
 * leaves no file behind.
 */
public final class HttpDownloadConsumer implements DownloadConsumer {

    private static final BlindFileLogger LOG = BlindFileLogger.get(HttpDownloadConsumer.class);

    private final HttpClient httpClient;
    private final Path output;
    private long bytesWritten;

    public HttpDownloadConsumer(HttpClient httpClient, Path output) {
        this.httpClient = httpClient;
        this.output = output;
    }

    @Override
    public void consume(URI address) throws IOException {
        HttpRequest request = HttpRequest.newBuilder().uri(address).GET().build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgeException("Interrupted while reading " + address, e);
        }

        if (response.statusCode() != 200) {
            response.body().close();
            throw new BridgeException("Bridge answered HTTP " + response.statusCode() + " for " + address);
        }
        try (InputStream body = response.body()) {
            bytesWritten = Files.copy(body, output, StandardCopyOption.REPLACE_EXISTING);
            LOG.info("Saved %d bytes to %s", bytesWritten, output);
        } catch (IOException e) {
            Files.deleteIfExists(output);
            throw e;
        }
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public Path getOutput() {
        return output;
    }
}
