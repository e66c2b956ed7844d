package com.twinkle.x402.client;

import com.twinkle.x402.crypto.CryptoSigner;

import java.io.IOException;

/** Contract for buying one analysis from a provider endpoint (HTTP x402, in-process, mock, etc.). */
public interface PurchaseClient {
    /**
     * Requests the provider's analysis for a query, paying for it when the provider
     * challenges with HTTP 402 and a payer credential is available.
     *
     * @param endpoint provider query endpoint
     * @param query the procurement query
     * @param payer payer credential, or {@code null} to purchase without the payment protocol
     * @return the delivered payload and what it cost
     * @throws IOException if the provider is unreachable, refuses payment, or returns an unexpected status
     * @throws InterruptedException if the request is interrupted
     */
    PurchaseResult purchase(String endpoint, String query, CryptoSigner payer)
            throws IOException, InterruptedException;
}
