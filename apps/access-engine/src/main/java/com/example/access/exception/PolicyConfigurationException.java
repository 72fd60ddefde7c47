package com.example.access.exception;

/**
 * The privilege catalog or role default table is incomplete or inconsistent.
 * Raised while the engine is being assembled; the application must not start.
 */
public class PolicyConfigurationException extends IllegalStateException {

    public PolicyConfigurationException(String message) {
        super(message);
    }
}
