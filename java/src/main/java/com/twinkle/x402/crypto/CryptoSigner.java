package com.twinkle.x402.crypto;

import java.util.Map;

/** Payer credential used to authorize pay-per-call purchases.
 *  Implement with web3j, a remote signing proxy, a KMS, etc.; the private key never reaches this SDK.
 */
public interface CryptoSigner {
    /** Wallet address the signatures are attributable to. */
    String address();

    /** Returns a hex-encoded signature covering the given authorization map. */
    String sign(Map<String, Object> authorization);
}
