/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.logging
Created by: Ashish Kushwaha on 13-10-2026 05:12
File: LogSink.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.logging;

import java.io.PrintStream;

/**
 * Destination for entries that passed the level check.
 */
@FunctionalInterface
public interface LogSink {

    void write(LogEntry entry);

    /**
     * WARN and ERROR go to {@code err}, the rest to {@code out}.
     */
    static LogSink console(PrintStream out, PrintStream err) {
        return entry -> {
            PrintStream target = entry.getLevel().isEnabled(LogLevel.WARN) ? err : out;
            target.println(entry.format());
        };
    }

    static LogSink discard() {
        return entry -> { };
    }
}
