package com.twinkle.agent.escrow;

import java.io.IOException;

/**
 * Escrow contract as seen from the buyer's and sellers' wallets. Implementations submit
 * transactions and return their hashes; the contract enforces the funds movement.
 */
public interface EscrowLedger {

    /** Address of the buying wallet. */
    String buyer();

    /**
     * Locks {@code terms.amount} of {@code terms.token} for {@code terms.seller}. When
     * {@code terms.encrypted} is set the creation transaction is sent threshold-encrypted.
     */
    LedgerReceipt createEscrow(EscrowTerms terms) throws IOException, InterruptedException;

    /** Seller-side: records the hash of what was delivered. */
    String submitResponse(long escrowId, String responseHash) throws IOException, InterruptedException;

    /** Buyer-side: pays the seller when {@code matched}, refunds the buyer otherwise. */
    String settle(long escrowId, boolean matched) throws IOException, InterruptedException;

    /** Buyer-side refund of an expired escrow. */
    String claimRefund(long escrowId) throws IOException, InterruptedException;

    /** Administrative refund once the grace period after the deadline has passed. */
    String emergencyRefund(long escrowId) throws IOException, InterruptedException;
}
