/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.logging
Created by: Ashish Kushwaha on 12-10-2026 18:49
File: BlindFileLogger.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.logging;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Named logger with {@link String#format} messages. Entries land in a process-wide
 * {@link LogStorage} and are handed to the current {@link LogSink}.
 * <p>
 * Share links carry their key in the URL fragment, so every message is scrubbed of
 * {@code #fragment} tails on http(s) URLs before it is recorded.
 */
public final class BlindFileLogger {

    private static final Pattern LINK_FRAGMENT = Pattern.compile("(https?://[^\\s#]+)#[A-Za-z0-9_-]+");

    private static final LogStorage STORAGE = new LogStorage();
    private static final Map<String, BlindFileLogger> LOGGERS = new ConcurrentHashMap<>();
    private static volatile LogLevel threshold = LogLevel.INFO;
    private static volatile LogSink sink = LogSink.console(System.out, System.err);

    private final String name;
    private volatile LogLevel override;

    private BlindFileLogger(String name) {
        this.name = name;
    }

    public static BlindFileLogger get(String name) {
        return LOGGERS.computeIfAbsent(name, BlindFileLogger::new);
    }

    public static BlindFileLogger get(Class<?> type) {
        return get(type.getSimpleName());
    }

    public static LogStorage getStorage() {
        return STORAGE;
    }

    public static void setGlobalLevel(LogLevel level) {
        threshold = level;
    }

    public static LogLevel getGlobalLevel() {
        return threshold;
    }

    public static void setSink(LogSink newSink) {
        sink = newSink == null ? LogSink.discard() : newSink;
    }

    /**
     * Overrides the global threshold for this logger only; {@code null} clears the override.
     */
    public void setLevel(LogLevel level) {
        this.override = level;
    }

    public void trace(String format, Object... args) {
        log(LogLevel.TRACE, null, format, args);
    }

    public void debug(String format, Object... args) {
        log(LogLevel.DEBUG, null, format, args);
    }

    public void info(String format, Object... args) {
        log(LogLevel.INFO, null, format, args);
    }

    public void warn(String format, Object... args) {
        log(LogLevel.WARN, null, format, args);
    }

    public void error(String format, Object... args) {
        log(LogLevel.ERROR, null, format, args);
    }

    public void error(String message, Throwable cause) {
        log(LogLevel.ERROR, cause, message);
    }

    public boolean isEnabled(LogLevel level) {
        LogLevel effective = override != null ? override : threshold;
        return level.isEnabled(effective);
    }

    public boolean isDebugEnabled() {
        return isEnabled(LogLevel.DEBUG);
    }

    public boolean isTraceEnabled() {
        return isEnabled(LogLevel.TRACE);
    }

    private void log(LogLevel level, Throwable cause, String format, Object... args) {
        if (!isEnabled(level)) {
            return;
        }
        String text = args.length == 0 ? format : String.format(format, args);
        LogEntry entry = new LogEntry(level, name, scrub(text), cause);
        STORAGE.add(entry);
        sink.write(entry);
    }

    static String scrub(String text) {
        if (text.indexOf('#') < 0) {
            return text;
        }
        return LINK_FRAGMENT.matcher(text).replaceAll("$1#<key>");
    }

    public String getName() {
        return name;
    }
}
