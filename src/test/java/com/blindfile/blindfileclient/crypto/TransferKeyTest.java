package com.blindfile.blindfileclient.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransferKeyTest {

    @Test
    void generatesDistinctKeys() {
        assertNotEquals(TransferKey.generate().toBase64Url(), TransferKey.generate().toBase64Url());
    }

    @Test
    void base64UrlExportHasNoPaddingOrUnsafeCharacters() {
        String encoded = TransferKey.generate().toBase64Url();
        assertEquals(43, encoded.length());
        assertFalse(encoded.contains("="));
        assertFalse(encoded.contains("+"));
        assertFalse(encoded.contains("/"));
    }

    @Test
    void importRestoresSameKey() {
        TransferKey key = TransferKey.generate();
        TransferKey restored = TransferKey.fromBase64Url(key.toBase64Url());
        assertArrayEquals(key.toSecretKey().getEncoded(), restored.toSecretKey().getEncoded());
    }

    @Test
    void rejectsMalformedKeys() {
        assertThrows(CipherException.class, () -> TransferKey.fromBase64Url(""));
        assertThrows(CipherException.class, () -> TransferKey.fromBase64Url("not*base64"));
        assertThrows(CipherException.class, () -> TransferKey.fromBase64Url("AAAA"));
        assertThrows(CipherException.class, () -> TransferKey.fromBytes(new byte[16]));
    }

    @Test
    void destroyedKeyCannotBeUsed() {
        TransferKey key = TransferKey.generate();
        key.destroy();
        assertTrue(key.isDestroyed());
        assertThrows(CipherException.class, key::toSecretKey);
    }

    @Test
    void toStringIsRedacted() {
        TransferKey key = TransferKey.generate();
        assertFalse(key.toString().contains(key.toBase64Url()));
    }
}
