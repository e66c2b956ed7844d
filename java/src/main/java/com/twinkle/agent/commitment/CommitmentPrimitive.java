package com.twinkle.agent.commitment;

import java.io.IOException;

/**
 * Threshold-encryption commitment service (for example the chain's encrypted-transaction
 * precompile). Committed data stays confidential until the network decrypts it.
 */
public interface CommitmentPrimitive {

    /**
     * Encrypts and commits hex data.
     *
     * @param hexData payload as hex, with or without {@code 0x}
     * @return receipt whose {@code success} flag reflects the committing transaction
     * @throws IOException if the commit could not be submitted
     * @throws InterruptedException if the call is interrupted
     */
    CommitReceipt commitEncrypted(String hexData) throws IOException, InterruptedException;

    /**
     * Reads back the decrypted payload of a commitment.
     *
     * @param reference reference returned by {@link #commitEncrypted(String)}
     * @return decrypted hex payload, possibly padded
     * @throws IOException while decryption is not available yet, or on transport failure
     * @throws InterruptedException if the call is interrupted
     */
    String decryptCommitment(String reference) throws IOException, InterruptedException;
}
