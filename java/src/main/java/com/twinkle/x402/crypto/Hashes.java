package com.twinkle.x402.crypto;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/** Hex and digest helpers shared by the purchase client and the procurement core. */
public final class Hashes {

    private static final SecureRandom RANDOM = new SecureRandom();

    private Hashes() {}

    /** 0x-prefixed SHA-256 of the UTF-8 bytes of {@code data}. */
    public static String sha256(String data) {
        return "0x" + DigestUtils.sha256Hex(data.getBytes(StandardCharsets.UTF_8));
    }

    /** Lower-case hex of the UTF-8 bytes of {@code text}, without prefix. */
    public static String utf8Hex(String text) {
        return toHex(text.getBytes(StandardCharsets.UTF_8));
    }

    public static String toHex(byte[] bytes) {
        return Hex.encodeHexString(bytes);
    }

    /** 0x-prefixed random 32-byte nonce. */
    public static String randomNonce() {
        byte[] nonce = new byte[32];
        RANDOM.nextBytes(nonce);
        return "0x" + toHex(nonce);
    }
}
