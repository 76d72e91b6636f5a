/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.logging
Created by: Ashish Kushwaha on 12-10-2026 19:30
File: LogLevel.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.logging;

public enum LogLevel {

    TRACE(0, "TRACE"),
    DEBUG(1, "DEBUG"),
    INFO(2, "INFO"),
    WARN(3, "WARN"),
    ERROR(4, "ERROR");

    private final int severity;
    private final String label;

    LogLevel(int severity, String label) {
        this.severity = severity;
        this.label = label;
    }

    public int getSeverity() {
        return severity;
    }

    public String getLabel() {
        return label;
    }

    public boolean isEnabled(LogLevel minLevel) {
        return severity >= minLevel.severity;
    }

    public static LogLevel fromLabel(String label, LogLevel defaultLevel) {
        if (label == null) {
            return defaultLevel;
        }
        for (LogLevel level : values()) {
            if (level.label.equalsIgnoreCase(label.trim())) {
                return level;
            }
        }
        return defaultLevel;
    }
}
