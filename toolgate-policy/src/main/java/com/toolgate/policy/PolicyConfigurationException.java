package com.toolgate.policy;

/**
 * Raised when a policy document or one of its constraints is malformed.
 * Always surfaces at load time, never while a call is being evaluated.
 */
public class PolicyConfigurationException extends RuntimeException {

    public PolicyConfigurationException(String message) {
        super(message);
    }

    public PolicyConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
