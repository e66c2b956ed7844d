package com.twinkle.agent.oracle;

import java.io.IOException;
import java.util.List;

/** Merges the passing providers' analyses into one narrative. */
public interface SynthesisOracle {
    String synthesize(List<ProviderReport> passing, String query) throws IOException, InterruptedException;
}
