/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.config
Created by: Ashish Kushwaha on 12-10-2026 13:36
File: TransferSettings.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.config;

import com.blindfile.blindfileclient.logging.BlindFileLogger;
import com.blindfile.blindfileclient.logging.LogLevel;
import com.blindfile.blindfileclient.storage.JsonFields;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class TransferSettings {

    private static final BlindFileLogger LOG = BlindFileLogger.get(TransferSettings.class);

    private static final String SETTINGS_FILE = "settings.json";
    private static final String DEFAULT_SERVER_URL = "http://localhost:8788";

    private final Path settingsPath;

    private String serverUrl = DEFAULT_SERVER_URL;
    private int maxConcurrentUploads = 3;
    private int maxAttempts = 3;
    private long retryBaseDelayMs = 1000;
    private long handshakeTimeoutMs = 3000;
    private int bridgePort = 0;
    private String downloadPath;
    private String logLevel = LogLevel.INFO.getLabel();

    public TransferSettings() {
        this(Paths.get(System.getProperty("user.home"), ".blindfile"));
    }

    public TransferSettings(Path settingsDirectory) {
        this.settingsPath = settingsDirectory.resolve(SETTINGS_FILE);
        this.downloadPath = settingsDirectory.resolve("downloads").toString();
    }

    public void load() {
        if (!Files.exists(settingsPath)) {
            return;
        }

        try {
            parseJson(Files.readString(settingsPath, StandardCharsets.UTF_8));
            LOG.debug("Loaded settings from %s", settingsPath);
        } catch (IOException e) {
            LOG.warn("Failed to load settings from %s: %s", settingsPath, e.getMessage());
        }
    }

    public void save() {
        try {
            Files.createDirectories(settingsPath.getParent());
            Files.writeString(settingsPath, toJson(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Failed to save settings to %s: %s", settingsPath, e.getMessage());
        }
    }

    private void parseJson(String json) {
        serverUrl = stringOr(JsonFields.extractString(json, "serverUrl"), serverUrl);
        maxConcurrentUploads = (int) positive(JsonFields.extractLong(json, "maxConcurrentUploads", maxConcurrentUploads), maxConcurrentUploads);
        maxAttempts = (int) positive(JsonFields.extractLong(json, "maxAttempts", maxAttempts), maxAttempts);
        retryBaseDelayMs = positive(JsonFields.extractLong(json, "retryBaseDelayMs", retryBaseDelayMs), retryBaseDelayMs);
        handshakeTimeoutMs = positive(JsonFields.extractLong(json, "handshakeTimeoutMs", handshakeTimeoutMs), handshakeTimeoutMs);
        bridgePort = (int) JsonFields.extractLong(json, "bridgePort", bridgePort);
        downloadPath = stringOr(JsonFields.extractString(json, "downloadPath"), downloadPath);
        logLevel = stringOr(JsonFields.extractString(json, "logLevel"), logLevel);
    }

    private String toJson() {
        StringBuilder sb = new StringBuilder();
        sb.append("{\n");
        sb.append("  \"serverUrl\": \"").append(JsonFields.escape(serverUrl)).append("\",\n");
        sb.append("  \"maxConcurrentUploads\": ").append(maxConcurrentUploads).append(",\n");
        sb.append("  \"maxAttempts\": ").append(maxAttempts).append(",\n");
        sb.append("  \"retryBaseDelayMs\": ").append(retryBaseDelayMs).append(",\n");
        sb.append("  \"handshakeTimeoutMs\": ").append(handshakeTimeoutMs).append(",\n");
        sb.append("  \"bridgePort\": ").append(bridgePort).append(",\n");
        sb.append("  \"downloadPath\": \"").append(JsonFields.escape(downloadPath)).append("\",\n");
        sb.append("  \"logLevel\": \"").append(JsonFields.escape(logLevel)).append("\"\n");
        sb.append("}");
        return sb.toString();
    }

    private static String stringOr(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }

    private static long positive(long value, long defaultValue) {
        return value > 0 ? value : defaultValue;
    }

    public Path getSettingsPath() { return settingsPath; }

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String value) { this.serverUrl = value; }

    /**
     * The HTTP API lives under {@code /api} of the server origin.
     */
    public String getApiBaseUrl() {
        String base = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
        return base + "/api";
    }

    public int getMaxConcurrentUploads() { return maxConcurrentUploads; }
    public void setMaxConcurrentUploads(int value) { this.maxConcurrentUploads = value; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int value) { this.maxAttempts = value; }

    public long getRetryBaseDelayMs() { return retryBaseDelayMs; }
    public void setRetryBaseDelayMs(long value) { this.retryBaseDelayMs = value; }

    public long getHandshakeTimeoutMs() { return handshakeTimeoutMs; }
    public void setHandshakeTimeoutMs(long value) { this.handshakeTimeoutMs = value; }

    public int getBridgePort() { return bridgePort; }
    public void setBridgePort(int value) { this.bridgePort = value; }

    public String getDownloadPath() { return downloadPath; }
    public void setDownloadPath(String value) { this.downloadPath = value; }

    public LogLevel getLogLevel() { return LogLevel.fromLabel(logLevel, LogLevel.INFO); }
    public void setLogLevel(LogLevel value) { this.logLevel = value.getLabel(); }
}
