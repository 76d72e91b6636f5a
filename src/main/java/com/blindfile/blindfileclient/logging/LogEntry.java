/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.logging
Created by: Ashish Kushwaha on 12-10-2026 19:08
File: LogEntry.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.logging;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * One recorded log line. The message is already formatted and scrubbed of share-link keys.
 */
public final class LogEntry {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss.SSS")
            .withZone(ZoneOffset.UTC);

    private final Instant timestamp;
    private final LogLevel level;
    private final String source;
    private final String thread;
    private final String message;
    private final String failure;

    public LogEntry(LogLevel level, String source, String message) {
        this(level, source, message, null);
    }

    public LogEntry(LogLevel level, String source, String message, Throwable cause) {
        this.timestamp = Instant.now();
        this.level = level;
        this.source = source;
        this.thread = Thread.currentThread().getName();
        this.message = message;
        this.failure = cause == null ? null : describe(cause);
    }

    private static String describe(Throwable cause) {
        String detail = cause.getMessage();
        String type = cause.getClass().getSimpleName();
        return detail == null ? type : type + ": " + detail;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public LogLevel getLevel() {
        return level;
    }

    public String getSource() {
        return source;
    }

    public String getThread() {
        return thread;
    }

    public String getMessage() {
        return message;
    }

    /**
     * @return {@code Type: message} of the attached throwable, or {@code null}
     */
    public String getFailure() {
        return failure;
    }

    public String format() {
        StringBuilder sb = new StringBuilder(64 + message.length());
        sb.append(TIME.format(timestamp)).append(' ')
                .append(String.format("%-5s", level.getLabel()))
                .append(" [").append(thread).append("] ")
                .append(source).append(": ")
                .append(message);
        if (failure != null) {
            sb.append(" (").append(failure).append(')');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
