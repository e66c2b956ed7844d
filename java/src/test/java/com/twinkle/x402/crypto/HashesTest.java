package com.twinkle.x402.crypto;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashesTest {

    @Test
    void sha256IsPrefixedLowerCaseHex() {
        assertEquals("0xba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                Hashes.sha256("abc"));
    }

    @Test
    void utf8HexEncodesMultiByteCharacters() {
        assertEquals("6869", Hashes.utf8Hex("hi"));
        assertEquals("c3a9", Hashes.utf8Hex("é"));
        assertEquals("", Hashes.utf8Hex(""));
    }

    @Test
    void nonceIsThirtyTwoRandomBytes() {
        String a = Hashes.randomNonce();
        assertTrue(a.matches("0x[0-9a-f]{64}"), a);
        assertNotEquals(a, Hashes.randomNonce());
    }
}
