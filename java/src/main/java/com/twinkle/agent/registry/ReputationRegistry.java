package com.twinkle.agent.registry;

import java.io.IOException;

public interface ReputationRegistry {
    /** @return reference of the feedback transaction */
    String submit(Feedback feedback) throws IOException, InterruptedException;
}
