package com.blindfile.blindfileclient;

import com.blindfile.blindfileclient.config.TransferSettings;
import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.logging.LogSink;
import com.blindfile.blindfileclient.storage.StubApiServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LauncherTest {

    private static final int PART_SIZE = 64 * 1024;

    @TempDir
    Path tempDir;

    private StubApiServer server;
    private TransferSettings settings;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() throws IOException {
        server = new StubApiServer(PART_SIZE);
        settings = new TransferSettings(tempDir.resolve("settings"));
        String api = server.apiBaseUrl();
        settings.setServerUrl(api.substring(0, api.length() - "/api".length()));
        settings.setRetryBaseDelayMs(10);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        BlindFileLogger.setSink(LogSink.console(System.out, System.err));
        server.close();
    }

    @Test
    void missingArgumentsPrintUsage() {
        assertEquals(Launcher.EXIT_USAGE, Launcher.run(new String[0], settings, out));
        assertEquals(Launcher.EXIT_USAGE, Launcher.run(new String[]{"upload"}, settings, out));
        assertEquals(Launcher.EXIT_USAGE, Launcher.run(new String[]{"rename", "a", "b"}, settings, out));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void malformedLinkFails() {
        int code = Launcher.run(new String[]{"fetch", "not-a-link", tempDir.toString()}, settings, out);
        assertEquals(Launcher.EXIT_FAILURE, code);
        assertTrue(output().contains("Error:"));
    }

    @Test
    void uploadThenDownloadThroughBothPaths() throws IOException {
        byte[] content = new byte[PART_SIZE * 2 + 1234];
        new Random(7).nextBytes(content);
        Path source = tempDir.resolve("report.pdf");
        Files.write(source, content);

        assertEquals(Launcher.EXIT_OK, Launcher.run(new String[]{"upload", source.toString()}, settings, out));
        String[] lines = output().split("\\R");
        String link = lines[lines.length - 1].trim();
        assertTrue(link.contains("/download/") && link.contains("#"), link);

        Path fetched = Files.createDirectory(tempDir.resolve("fetched"));
        assertEquals(Launcher.EXIT_OK, Launcher.run(new String[]{"fetch", link, fetched.toString()}, settings, out));
        assertArrayEquals(content, Files.readAllBytes(fetched.resolve("report.pdf")));

        ByteArrayOutputStream piped = new ByteArrayOutputStream();
        PrintStream pipe = new PrintStream(piped, true, StandardCharsets.UTF_8);
        assertEquals(Launcher.EXIT_OK, Launcher.run(new String[]{"cat", link}, settings, pipe));
        assertArrayEquals(content, piped.toByteArray());

        Path streamed = Files.createDirectory(tempDir.resolve("streamed"));
        assertEquals(Launcher.EXIT_OK, Launcher.run(new String[]{"download", link, streamed.toString()}, settings, out));
        assertArrayEquals(content, Files.readAllBytes(streamed.resolve("report.pdf")));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
