package com.twinkle.agent.oracle;

import com.twinkle.agent.mandate.Amount;

import java.io.IOException;
import java.util.List;

/** Recommends which candidates to engage and why. Advisory: the run records, not filters. */
public interface ProviderSelectionOracle {
    List<ProviderSelection> select(List<ProviderCandidate> candidates, Amount budget, String query)
            throws IOException, InterruptedException;
}
