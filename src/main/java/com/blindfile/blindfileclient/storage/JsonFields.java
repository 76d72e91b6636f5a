/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 22:15
File: JsonFields.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal flat-JSON helpers for the handful of request and response bodies the client exchanges.
 * Values are looked up by key anywhere in the document; nesting is not interpreted.
 */
public final class JsonFields {

    private JsonFields() {
    }

    public static String object(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < keyValues.length; i += 2) {
            Object value = keyValues[i + 1];
            if (value == null) {
                continue;
            }
            if (sb.length() > 1) {
                sb.append(",");
            }
            sb.append("\"").append(keyValues[i]).append("\":");
            appendValue(sb, value);
        }
        sb.append("}");
        return sb.toString();
    }

    private static void appendValue(StringBuilder sb, Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            sb.append(value);
        } else if (value instanceof RawJson) {
            sb.append(((RawJson) value).json);
        } else {
            sb.append("\"").append(escape(value.toString())).append("\"");
        }
    }

    public static RawJson array(List<String> jsonElements) {
        return new RawJson("[" + String.join(",", jsonElements) + "]");
    }

    public static String extractString(String json, String key) {
        int valueStart = valueStart(json, key);
        if (valueStart < 0 || json.charAt(valueStart) != '"') {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = valueStart + 1; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c == '\\' && i + 1 < json.length()) {
                char next = json.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'u':
                        if (i + 4 < json.length()) {
                            sb.append((char) Integer.parseInt(json.substring(i + 1, i + 5), 16));
                            i += 4;
                        }
                        break;
                    default:
                        sb.append(next);
                }
            } else if (c == '"') {
                return sb.toString();
            } else {
                sb.append(c);
            }
        }
        return null;
    }

    public static long extractLong(String json, String key, long defaultValue) {
        int valueStart = valueStart(json, key);
        if (valueStart < 0) {
            return defaultValue;
        }
        int end = valueStart;
        while (end < json.length() && (Character.isDigit(json.charAt(end)) || json.charAt(end) == '-')) {
            end++;
        }
        try {
            return Long.parseLong(json.substring(valueStart, end));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Like {@link #extractLong} but for fields that must fit an {@code int}.
     *
     * @throws StorageException if the value is out of range
     */
    public static int extractInt(String json, String key, int defaultValue) {
        long value = extractLong(json, key, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new StorageException("Field " + key + " is out of range: " + value, 502);
        }
        return (int) value;
    }

    public static boolean extractBoolean(String json, String key, boolean defaultValue) {
        int valueStart = valueStart(json, key);
        if (valueStart < 0) {
            return defaultValue;
        }
        if (json.startsWith("true", valueStart)) {
            return true;
        }
        if (json.startsWith("false", valueStart)) {
            return false;
        }
        return defaultValue;
    }

    /**
     * Splits the top-level objects of the array stored under {@code key}.
     */
    public static List<String> extractObjectArray(String json, String key) {
        List<String> objects = new ArrayList<>();
        int valueStart = valueStart(json, key);
        if (valueStart < 0 || json.charAt(valueStart) != '[') {
            return objects;
        }
        int depth = 0;
        int start = -1;
        for (int i = valueStart + 1; i < json.length(); i++) {
            char c = json.charAt(i);
            if (c == '{') {
                if (depth == 0) {
                    start = i;
                }
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0 && start >= 0) {
                    objects.add(json.substring(start, i + 1));
                    start = -1;
                }
            } else if (c == ']' && depth == 0) {
                break;
            }
        }
        return objects;
    }

    public static String extractErrorMessage(String responseBody) {
        if (responseBody == null) {
            return null;
        }
        String message = extractString(responseBody, "error");
        return message != null ? message : extractString(responseBody, "message");
    }

    public static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                    sb.append("\\\\");
                    break;
                case '"':
                    sb.append("\\\"");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    private static int valueStart(String json, String key) {
        if (json == null) {
            return -1;
        }
        String searchKey = "\"" + key + "\"";
        int keyIndex = json.indexOf(searchKey);
        if (keyIndex < 0) {
            return -1;
        }
        int colon = json.indexOf(':', keyIndex + searchKey.length());
        if (colon < 0) {
            return -1;
        }
        int valueStart = colon + 1;
        while (valueStart < json.length() && Character.isWhitespace(json.charAt(valueStart))) {
            valueStart++;
        }
        if (valueStart >= json.length() || json.startsWith("null", valueStart)) {
            return -1;
        }
        return valueStart;
    }

    public static final class RawJson {

        private final String json;

        private RawJson(String json) {
            this.json = json;
        }

        @Override
        public String toString() {
            return json;
        }
    }
}
