/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient
Created by: Ashish Kushwaha on 12-10-2026 09:35
File: Launcher.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient;

import com.blindfile.blindfileclient.bridge.HttpDownloadConsumer;
import com.blindfile.blindfileclient.bridge.ProxyBridge;
import com.blindfile.blindfileclient.bridge.StreamingDownloader;
import com.blindfile.blindfileclient.config.TransferSettings;
import com.blindfile.blindfileclient.download.FileDownloadService;
import com.blindfile.blindfileclient.download.ResolvedDownload;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.logging.LogSink;
import com.blindfile.blindfileclient.storage.HttpMultipartTransferClient;
import com.blindfile.blindfileclient.transfer.CancellationSignal;
import com.blindfile.blindfileclient.transfer.FileUploadService;
import com.blindfile.blindfileclient.transfer.ShareLink;
import com.blindfile.blindfileclient.transfer.UploadOutcome;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

public class Launcher {

    private static final BlindFileLogger LOG = BlindFileLogger.get(Launcher.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 64;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_CANCELLED = 130;

    public static void main(String[] args) {
        TransferSettings settings = new TransferSettings();
        settings.load();
        System.exit(run(args, settings, System.out));
    }

    static int run(String[] args, TransferSettings settings, PrintStream out) {
        BlindFileLogger.setGlobalLevel(settings.getLogLevel());
        if (args.length == 0) {
            printUsage(out);
            return EXIT_USAGE;
        }

        String command = args[0];
        try {
            switch (command) {
                case "upload":
                    if (args.length != 2) {
                        break;
                    }
                    return upload(Paths.get(args[1]), settings, out);
                case "download":
                    if (args.length != 3) {
                        break;
                    }
                    return download(ShareLink.parse(args[1]), Paths.get(args[2]), settings, out);
                case "cat":
                    if (args.length != 2) {
                        break;
                    }
                    return cat(ShareLink.parse(args[1]), settings, out);
                case "fetch":
                    if (args.length != 3) {
                        break;
                    }
                    return fetch(ShareLink.parse(args[1]), Paths.get(args[2]), settings, out);
                default:
                    break;
            }
        } catch (IOException e) {
            LOG.error("%s failed: %s", command, e.getMessage());
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
        printUsage(out);
        return EXIT_USAGE;
    }

    private static int upload(Path file, TransferSettings settings, PrintStream out) throws IOException {
        HttpMultipartTransferClient client = new HttpMultipartTransferClient(settings.getApiBaseUrl());
        FileUploadService service = new FileUploadService(client, settings);
        CancellationSignal cancellation = new CancellationSignal();
        Thread hook = new Thread(cancellation::cancel, "blindfile-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        UploadOutcome outcome;
        try {
            outcome = service.upload(file, cancellation, progress ->
                    out.printf("\r%5.1f%% %d/%d parts", progress.getPercentage(),
                            progress.getPartsCompleted(), progress.getTotalParts()));
        } finally {
            removeHook(hook);
        }
        out.println();
        if (!outcome.isCompleted()) {
            out.println("Upload cancelled");
            return EXIT_CANCELLED;
        }
        out.println(outcome.getShareLink().format());
        return EXIT_OK;
    }

    private static int download(ShareLink link, Path output, TransferSettings settings, PrintStream out)
            throws IOException {
        HttpClient httpClient = newHttpClient();
        FileDownloadService service = new FileDownloadService(
                new HttpMultipartTransferClient(settings.getApiBaseUrl(), httpClient), httpClient);
        ResolvedDownload resolved = service.resolve(link);
        Path target = FileDownloadService.targetFor(output, resolved.getFileName());

        try (ProxyBridge bridge = new ProxyBridge(settings.getBridgePort())) {
            bridge.start();
            StreamingDownloader downloader = new StreamingDownloader(bridge, settings.getHandshakeTimeoutMs());
            downloader.download(resolved, new HttpDownloadConsumer(httpClient, target));
        }
        out.println("Saved " + target);
        return EXIT_OK;
    }

    private static int fetch(ShareLink link, Path output, TransferSettings settings, PrintStream out)
            throws IOException {
        HttpClient httpClient = newHttpClient();
        FileDownloadService service = new FileDownloadService(
                new HttpMultipartTransferClient(settings.getApiBaseUrl(), httpClient), httpClient);
        Path target = service.fetch(link, output, new CancellationSignal(), progress ->
                out.printf("\r%5.1f%%", progress.getPercentage()));
        out.println();
        out.println("Saved " + target + " (" + Files.size(target) + " bytes)");
        return EXIT_OK;
    }

    private static int cat(ShareLink link, TransferSettings settings, PrintStream out) throws IOException {
        BlindFileLogger.setSink(LogSink.console(System.err, System.err));
        HttpClient httpClient = newHttpClient();
        FileDownloadService service = new FileDownloadService(
                new HttpMultipartTransferClient(settings.getApiBaseUrl(), httpClient), httpClient);
        try (InputStream plaintext = service.openPlaintext(link)) {
            plaintext.transferTo(out);
        }
        out.flush();
        return EXIT_OK;
    }

    private static HttpClient newHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM is shutting down, cancel hook stays registered");
        }
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  blindfile upload <file>");
        out.println("  blindfile download <share-link> <output>");
        out.println("  blindfile fetch <share-link> <output>");
        out.println("  blindfile cat <share-link>");
    }
}
