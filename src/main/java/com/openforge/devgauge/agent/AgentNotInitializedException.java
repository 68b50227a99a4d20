package com.openforge.devgauge.agent;

/** The session has no metrics or profile to work with yet. */
public class AgentNotInitializedException extends RuntimeException {

    public AgentNotInitializedException(String sessionId) {
        super("Agent not initialized with user context: " + sessionId);
    }
}
