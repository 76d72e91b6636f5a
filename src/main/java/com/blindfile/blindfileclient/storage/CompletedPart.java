/*

Copyright (c) 2026 Ramjee Prasad
Licensed under a custom Non-Commercial, Attribution, Share-Alike License.
See the LICENSE file in the project root for full license information.
Project: blindfile-client
Package: com.blindfile.blindfileclient.storage
Created by: Ashish Kushwaha on 12-10-2026 20:14
File: CompletedPart.java
This source code is intended for educational and non-commercial purposes only.
Redistribution and use in source and binary forms, with or without modification,
are permitted provided that the following conditions are met:
Attribution must be given to the original author.
The code must be shared under the same license.
Commercial use is strictly prohibited.
*/

package com.blindfile.blindfileclient.storage;

import java.util.Objects;

public final class CompletedPart implements Comparable<CompletedPart> {

    private final int partNumber;
    private final String etag;

    public CompletedPart(int partNumber, String etag) {
        this.partNumber = partNumber;
        this.etag = etag;
    }

    public int getPartNumber() {
        return partNumber;
    }

    public String getEtag() {
        return etag;
    }

    String toJson() {
        return JsonFields.object("partNumber", partNumber, "etag", etag);
    }

    @Override
    public int compareTo(CompletedPart other) {
        return Integer.compare(partNumber, other.partNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CompletedPart)) return false;
        CompletedPart that = (CompletedPart) o;
        return partNumber == that.partNumber && Objects.equals(etag, that.etag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partNumber, etag);
    }

    @Override
    public String toString() {
        return "(" + partNumber + "," + etag + ")";
    }
}
