package com.twinkle.agent.registry;

import java.io.IOException;

/** Agent identity registry; hands out the numeric handle reputation is keyed by. */
public interface IdentityRegistry {
    long register(AgentRegistration registration) throws IOException, InterruptedException;
}
