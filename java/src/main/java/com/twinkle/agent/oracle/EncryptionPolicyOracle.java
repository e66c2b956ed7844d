package com.twinkle.agent.oracle;

import java.io.IOException;

/** Threat-models a query and advises which layers to encrypt. */
public interface EncryptionPolicyOracle {
    EncryptionAdvice analyze(String query) throws IOException, InterruptedException;
}
