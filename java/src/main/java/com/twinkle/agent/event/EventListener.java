package com.twinkle.agent.event;

/** External subscriber to lifecycle events (SSE bridge, dashboard, test probe). */
@FunctionalInterface
public interface EventListener {
    void onEvent(AgentEvent event);
}
