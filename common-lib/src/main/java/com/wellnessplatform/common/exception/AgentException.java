package com.wellnessplatform.common.exception;

/**
 * Failure inside a single decision component (a council agent, the narrative generator).
 * The message is prefixed with the component name so log lines stay greppable.
 */
public class AgentException extends RuntimeException {
    private final String agentName;

    public AgentException(String agentName, String message) {
        super("[" + agentName + "] " + message);
        this.agentName = agentName;
    }

    public AgentException(String agentName, String message, Throwable cause) {
        super("[" + agentName + "] " + message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
